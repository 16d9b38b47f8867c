package com.pingponghub.practice.controller;

import com.pingponghub.practice.dto.ConflictRecord;
import com.pingponghub.practice.dto.RecurrenceRuleUpdateResponse;
import com.pingponghub.practice.exception.ConflictDetectedException;
import com.pingponghub.practice.exception.PolicyCapExceededException;
import com.pingponghub.practice.exception.ResourceNotFoundException;
import com.pingponghub.practice.service.PracticeSeriesService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecurrenceRuleController Tests")
class RecurrenceRuleControllerTest {

    private static final String ORGANIZER_ID = "user_organizer";
    private static final String RULE_ID = "9a8b7c6d-5e4f-4a3b-8c2d-1e0f9a8b7c6d";
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);
    private static final LocalDate NEW_END = LocalDate.of(2024, 5, 31);

    @Mock
    private PracticeSeriesService practiceSeriesService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("Asia/Tokyo"));
        mockMvc = MockMvcBuilders.standaloneSetup(new RecurrenceRuleController(practiceSeriesService, clock)).build();
    }

    @Test
    @DisplayName("Extending a series returns the number of added occurrences")
    void updateEndDate_Extend_ReturnsCounts() throws Exception {
        // Given
        when(practiceSeriesService.updateRecurrenceEndDate(RULE_ID, NEW_END, ORGANIZER_ID, NOW))
            .thenReturn(new RecurrenceRuleUpdateResponse(RULE_ID, NEW_END, 4, 0));

        // When/Then
        mockMvc.perform(patch("/recurrence-rules/" + RULE_ID + "/end-date")
                .requestAttr("organizerId", ORGANIZER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endDate\": \"2024-05-31\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ruleId").value(RULE_ID))
            .andExpect(jsonPath("$.endDate").value("2024-05-31"))
            .andExpect(jsonPath("$.addedCount").value(4))
            .andExpect(jsonPath("$.removedCount").value(0));

        verify(practiceSeriesService).updateRecurrenceEndDate(RULE_ID, NEW_END, ORGANIZER_ID, NOW);
    }

    @Test
    @DisplayName("Missing end date returns 400")
    void updateEndDate_WithoutEndDate_Returns400() throws Exception {
        mockMvc.perform(patch("/recurrence-rules/" + RULE_ID + "/end-date")
                .requestAttr("organizerId", ORGANIZER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("endDate: End date is required"));

        verifyNoInteractions(practiceSeriesService);
    }

    @Test
    @DisplayName("Unknown rule returns 404")
    void updateEndDate_UnknownRule_Returns404() throws Exception {
        when(practiceSeriesService.updateRecurrenceEndDate(RULE_ID, NEW_END, ORGANIZER_ID, NOW))
            .thenThrow(new ResourceNotFoundException("Recurrence rule not found: " + RULE_ID));

        mockMvc.perform(patch("/recurrence-rules/" + RULE_ID + "/end-date")
                .requestAttr("organizerId", ORGANIZER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endDate\": \"2024-05-31\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Extension past the cap returns 400")
    void updateEndDate_PastCap_Returns400() throws Exception {
        when(practiceSeriesService.updateRecurrenceEndDate(RULE_ID, NEW_END, ORGANIZER_ID, NOW))
            .thenThrow(new PolicyCapExceededException("Recurring practices must end by 2024-12-31"));

        mockMvc.perform(patch("/recurrence-rules/" + RULE_ID + "/end-date")
                .requestAttr("organizerId", ORGANIZER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endDate\": \"2024-05-31\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("POLICY_CAP_EXCEEDED"));
    }

    @Test
    @DisplayName("Extension that double-books returns 409")
    void updateEndDate_WithConflicts_Returns409() throws Exception {
        ConflictRecord conflict = new ConflictRecord(LocalDate.of(2024, 4, 6), "13:00", "15:00", "Annex", "Tigers");
        when(practiceSeriesService.updateRecurrenceEndDate(RULE_ID, NEW_END, ORGANIZER_ID, NOW))
            .thenThrow(new ConflictDetectedException(List.of(conflict)));

        mockMvc.perform(patch("/recurrence-rules/" + RULE_ID + "/end-date")
                .requestAttr("organizerId", ORGANIZER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endDate\": \"2024-05-31\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.conflicts[0].date").value("2024-04-06"))
            .andExpect(jsonPath("$.conflicts[0].location").value("Annex"));
    }
}
