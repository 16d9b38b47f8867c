package com.pingponghub.practice.controller;

import com.pingponghub.practice.dto.SignupDTO;
import com.pingponghub.practice.service.SignupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * REST controller for members joining and leaving practice sessions.
 * The caller identity set by the gateway is the member's user id here.
 */
@RestController
@RequestMapping("/practices/{sessionId}/signups")
@Validated
@Tag(name = "Sign-ups", description = "Joining and leaving practice sessions")
public class SignupController extends BaseController {

    private final SignupService signupService;
    private final Clock clock;

    @Autowired
    public SignupController(SignupService signupService, Clock clock) {
        this.signupService = signupService;
        this.clock = clock;
    }

    @PostMapping
    @Operation(summary = "Join a practice session")
    public ResponseEntity<SignupDTO> joinPractice(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId,
            HttpServletRequest httpRequest) {

        String userId = extractOrganizerId(httpRequest);
        SignupDTO signup = signupService.joinPractice(sessionId, userId, LocalDateTime.now(clock));

        return ResponseEntity.status(HttpStatus.CREATED).body(signup);
    }

    @DeleteMapping
    @Operation(summary = "Cancel the caller's sign-up for a practice session")
    public ResponseEntity<Void> cancelSignup(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId,
            HttpServletRequest httpRequest) {

        String userId = extractOrganizerId(httpRequest);
        signupService.cancelSignup(sessionId, userId);

        return ResponseEntity.noContent().build();
    }

    @GetMapping
    @Operation(summary = "List the members signed up for a practice session")
    public ResponseEntity<List<SignupDTO>> listSignups(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid practice ID format") String sessionId) {

        return ResponseEntity.ok(signupService.listSignups(sessionId));
    }
}
