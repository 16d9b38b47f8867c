package com.pingponghub.practice.controller;

import com.pingponghub.practice.dto.RecurrenceRuleUpdateResponse;
import com.pingponghub.practice.dto.UpdateRecurrenceEndDateRequest;
import com.pingponghub.practice.service.PracticeSeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/recurrence-rules")
@Validated
@Tag(name = "Recurrence rules", description = "Maintenance of recurring practice series")
public class RecurrenceRuleController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceRuleController.class);

    private final PracticeSeriesService practiceSeriesService;
    private final Clock clock;

    @Autowired
    public RecurrenceRuleController(PracticeSeriesService practiceSeriesService, Clock clock) {
        this.practiceSeriesService = practiceSeriesService;
        this.clock = clock;
    }

    @PatchMapping("/{ruleId}/end-date")
    @Operation(summary = "Move the last date of a series, adding or removing occurrences")
    public ResponseEntity<RecurrenceRuleUpdateResponse> updateEndDate(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid rule ID format") String ruleId,
            @Valid @RequestBody UpdateRecurrenceEndDateRequest request,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);

        RecurrenceRuleUpdateResponse response = practiceSeriesService.updateRecurrenceEndDate(
            ruleId, request.getEndDate(), organizerId, LocalDateTime.now(clock));
        logger.info("Rule {} now ends {} (+{} / -{})", ruleId, response.getEndDate(),
            response.getAddedCount(), response.getRemovedCount());

        return ResponseEntity.ok(response);
    }
}
