package com.pingponghub.practice.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OrganizerIdentityFilterTest {

    private OrganizerIdentityFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new OrganizerIdentityFilter();
        request = new MockHttpServletRequest("GET", "/practices");
        response = new MockHttpServletResponse();
    }

    @Test
    void doFilter_WithHeader_SetsAttributeAndMdcDuringChain() throws Exception {
        // Given
        request.addHeader(OrganizerIdentityFilter.ORGANIZER_HEADER, "  user_organizer ");
        AtomicReference<String> mdcInChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> mdcInChain.set(MDC.get(OrganizerIdentityFilter.MDC_ORGANIZER_ID));

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertThat(request.getAttribute(OrganizerIdentityFilter.ORGANIZER_ATTRIBUTE)).isEqualTo("user_organizer");
        assertThat(mdcInChain.get()).isEqualTo("user_organizer");
        assertThat(MDC.get(OrganizerIdentityFilter.MDC_ORGANIZER_ID)).isNull();
    }

    @Test
    void doFilter_WithoutHeader_PassesThroughWithoutAttribute() throws Exception {
        // Given
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(request.getAttribute(OrganizerIdentityFilter.ORGANIZER_ATTRIBUTE)).isNull();
    }

    @Test
    void doFilter_WithBlankHeader_IsTreatedAsMissing() throws Exception {
        request.addHeader(OrganizerIdentityFilter.ORGANIZER_HEADER, "   ");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(request.getAttribute(OrganizerIdentityFilter.ORGANIZER_ATTRIBUTE)).isNull();
    }
}
