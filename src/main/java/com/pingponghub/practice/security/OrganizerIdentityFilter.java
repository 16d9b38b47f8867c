package com.pingponghub.practice.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Copies the organizer identity set by the upstream gateway into a request attribute
 * for controllers and into the MDC for logging.
 * Requests without the header pass through; controllers that need an organizer reject them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class OrganizerIdentityFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(OrganizerIdentityFilter.class);

    public static final String ORGANIZER_HEADER = "X-Organizer-Id";
    public static final String ORGANIZER_ATTRIBUTE = "organizerId";
    static final String MDC_ORGANIZER_ID = "organizerId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String organizerId = request.getHeader(ORGANIZER_HEADER);
        if (organizerId == null || organizerId.trim().isEmpty()) {
            logger.debug("No {} header on {} {}", ORGANIZER_HEADER, request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        organizerId = organizerId.trim();
        request.setAttribute(ORGANIZER_ATTRIBUTE, organizerId);

        try {
            MDC.put(MDC_ORGANIZER_ID, organizerId);
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_ORGANIZER_ID);
        }
    }
}
