package com.pingponghub.practice.controller;

import com.pingponghub.practice.dto.CreatePracticesRequest;
import com.pingponghub.practice.dto.CreatePracticesResponse;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import com.pingponghub.practice.dto.UpdatePracticeRequest;
import com.pingponghub.practice.model.OperationScope;
import com.pingponghub.practice.service.PracticeSeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * REST controller for practice sessions and recurring series.
 */
@RestController
@RequestMapping("/practices")
@Validated
@Tag(name = "Practices", description = "Publishing and editing practice sessions")
public class PracticeController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(PracticeController.class);

    private final PracticeSeriesService practiceSeriesService;
    private final Clock clock;

    @Autowired
    public PracticeController(PracticeSeriesService practiceSeriesService, Clock clock) {
        this.practiceSeriesService = practiceSeriesService;
        this.clock = clock;
    }

    @PostMapping
    @Operation(summary = "Publish a practice, optionally as a recurring series")
    public ResponseEntity<CreatePracticesResponse> createPractices(
            @Valid @RequestBody CreatePracticesRequest request,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);

        CreatePracticesResponse response = practiceSeriesService.createPractices(
            request, organizerId, LocalDateTime.now(clock));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get one practice session")
    public ResponseEntity<PracticeSessionDTO> getPractice(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId) {

        return ResponseEntity.ok(practiceSeriesService.getPractice(sessionId));
    }

    @GetMapping
    @Operation(summary = "List the organizer's practices for a team between two dates")
    public ResponseEntity<List<PracticeSessionDTO>> listPractices(
            @RequestParam("team") String teamName,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);
        List<PracticeSessionDTO> practices = practiceSeriesService.listPractices(organizerId, teamName, from, to);
        logger.debug("Listed {} practices for organizer {} team {}", practices.size(), organizerId, teamName);

        return ResponseEntity.ok(practices);
    }

    @PutMapping("/{sessionId}")
    @Operation(summary = "Edit one occurrence or its whole series")
    public ResponseEntity<PracticeSessionDTO> updatePractice(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId,
            @Valid @RequestBody UpdatePracticeRequest request,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);

        PracticeSessionDTO updated = practiceSeriesService.updatePractice(
            sessionId, request, organizerId, LocalDateTime.now(clock));

        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Delete one occurrence or its whole series")
    public ResponseEntity<Void> deletePractice(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId,
            @RequestParam(defaultValue = "SINGLE") OperationScope scope,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);
        practiceSeriesService.deletePractice(sessionId, scope, organizerId);

        return ResponseEntity.noContent().build();
    }
}
