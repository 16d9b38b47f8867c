package com.pingponghub.practice.service.impl;

import com.pingponghub.practice.dto.ConflictRecord;
import com.pingponghub.practice.dto.CreatePracticesRequest;
import com.pingponghub.practice.dto.CreatePracticesResponse;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import com.pingponghub.practice.dto.RecurrenceRuleUpdateResponse;
import com.pingponghub.practice.dto.UpdatePracticeRequest;
import com.pingponghub.practice.exception.*;
import com.pingponghub.practice.model.OccurrenceSlot;
import com.pingponghub.practice.model.OperationScope;
import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.model.RecurrenceKind;
import com.pingponghub.practice.model.RecurrenceRule;
import com.pingponghub.practice.repository.PracticeSessionRepository;
import com.pingponghub.practice.repository.RecurrenceRuleRepository;
import com.pingponghub.practice.repository.SignupRepository;
import com.pingponghub.practice.service.ConflictDetector;
import com.pingponghub.practice.service.PracticeSeriesService;
import com.pingponghub.practice.service.RecurrenceExpander;
import com.pingponghub.practice.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Implementation of PracticeSeriesService.
 * Expands recurrences, rejects double-bookings and keeps series occurrences in step with their rule.
 */
@Service
public class PracticeSeriesServiceImpl implements PracticeSeriesService {

    private static final Logger logger = LoggerFactory.getLogger(PracticeSeriesServiceImpl.class);

    private final PracticeSessionRepository sessionRepository;
    private final RecurrenceRuleRepository ruleRepository;
    private final SignupRepository signupRepository;
    private final RecurrenceExpander recurrenceExpander;
    private final ConflictDetector conflictDetector;

    @Autowired
    public PracticeSeriesServiceImpl(
            PracticeSessionRepository sessionRepository,
            RecurrenceRuleRepository ruleRepository,
            SignupRepository signupRepository,
            RecurrenceExpander recurrenceExpander,
            ConflictDetector conflictDetector) {
        this.sessionRepository = sessionRepository;
        this.ruleRepository = ruleRepository;
        this.signupRepository = signupRepository;
        this.recurrenceExpander = recurrenceExpander;
        this.conflictDetector = conflictDetector;
    }

    @Override
    public CreatePracticesResponse createPractices(CreatePracticesRequest request, String organizerId, LocalDateTime now) {
        logger.info("Organizer {} publishing {} practice for team {} from {}",
            organizerId, request.getRecurrenceType(), request.getTeamName(), request.getEventDate());

        // 1. Validation
        String teamName = requireText(request.getTeamName(), "Team name");
        String location = requireText(request.getLocation(), "Location");
        String startTime = DateTimeUtils.normalizeTime(request.getStartTime());
        String endTime = DateTimeUtils.normalizeTime(request.getEndTime());
        requireStartBeforeEnd(startTime, endTime);
        int capacity = requireCapacity(request.getMaxParticipants());

        LocalDate anchor = request.getEventDate();
        if (anchor == null) {
            throw new ValidationException("Event date is required");
        }

        RecurrenceKind kind = request.getRecurrenceType() == null
            ? null
            : request.getRecurrenceType().toKind().orElse(null);
        if (kind != null) {
            if (request.getRecurrenceEndDate() == null) {
                throw new ValidationException("Recurrence end date is required for a recurring practice");
            }
            requireWithinPolicyCap(request.getRecurrenceEndDate(), now);
        }

        // 2. Expansion
        int dayOfWeek = DateTimeUtils.dayOfWeek(anchor);
        int nthWeek = DateTimeUtils.nthWeekOf(anchor);
        List<LocalDate> dates = kind == null
            ? List.of(anchor)
            : recurrenceExpander.expand(anchor, request.getRecurrenceEndDate(), kind, dayOfWeek, nthWeek);

        if (dates.isEmpty()) {
            throw new NoEligibleDatesException("The recurrence produces no practice dates before "
                + request.getRecurrenceEndDate());
        }

        // 3. Checks over the whole batch
        for (LocalDate date : dates) {
            requireNotPast(date, startTime, now);
        }

        List<OccurrenceSlot> slots = dates.stream()
            .map(date -> new OccurrenceSlot(date, startTime, endTime))
            .collect(Collectors.toList());
        List<PracticeSession> existing = sessionRepository.findByOrganizerAndTeamOnDates(organizerId, teamName, dates);
        requireNoConflicts(slots, existing, organizerId, teamName);

        // 4. Persistence
        RecurrenceRule rule = null;
        if (kind != null) {
            // an end before the anchor still yields the anchor occurrence, so the stored range starts there
            LocalDate endDate = request.getRecurrenceEndDate().isBefore(anchor) ? anchor : request.getRecurrenceEndDate();
            rule = new RecurrenceRule(organizerId, teamName, kind, anchor, endDate);
            if (kind != RecurrenceKind.MONTHLY_FIXED_DATE) {
                rule.setDayOfWeek(dayOfWeek);
            }
            if (kind == RecurrenceKind.MONTHLY_NTH_WEEKDAY) {
                rule.setNthWeek(nthWeek);
            }
            ruleRepository.save(rule);
        }

        List<PracticeSession> sessions = new ArrayList<>();
        for (LocalDate date : dates) {
            PracticeSession session = new PracticeSession(organizerId, teamName, date, startTime, endTime);
            session.setLocation(location);
            session.setMaxParticipants(capacity);
            session.setContent(blankToNull(request.getContent()));
            session.setLevel(blankToNull(request.getLevel()));
            session.setConditions(blankToNull(request.getConditions()));
            session.setRecurrenceRuleId(rule != null ? rule.getRuleId() : null);
            sessions.add(session);
        }
        sessionRepository.saveAll(sessions);

        String ruleId = rule != null ? rule.getRuleId() : null;
        logger.info("Created {} practice session(s) for organizer {} team {} (rule {})",
            sessions.size(), organizerId, teamName, ruleId);

        return new CreatePracticesResponse(
            sessions.size(),
            ruleId,
            sessions.stream().map(PracticeSession::getSessionId).collect(Collectors.toList())
        );
    }

    @Override
    public PracticeSessionDTO getPractice(String sessionId) {
        return new PracticeSessionDTO(loadSession(sessionId));
    }

    @Override
    public List<PracticeSessionDTO> listPractices(String organizerId, String teamName, LocalDate from, LocalDate to) {
        String team = requireText(teamName, "Team name");
        if (from == null || to == null) {
            throw new ValidationException("Both from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("From date must not be after to date");
        }

        List<PracticeSessionDTO> practices = sessionRepository.findByOrganizerAndTeamBetween(organizerId, team, from, to)
            .stream()
            .map(PracticeSessionDTO::new)
            .collect(Collectors.toList());

        logger.debug("Found {} practices for organizer {} team {} between {} and {}",
            practices.size(), organizerId, team, from, to);
        return practices;
    }

    @Override
    public RecurrenceRuleUpdateResponse updateRecurrenceEndDate(String ruleId, LocalDate newEndDate,
                                                                String organizerId, LocalDateTime now) {
        logger.info("Organizer {} moving end date of rule {} to {}", organizerId, ruleId, newEndDate);

        // 1. Validation and permissions
        if (newEndDate == null) {
            throw new ValidationException("End date is required");
        }
        RecurrenceRule rule = ruleRepository.findById(ruleId)
            .orElseThrow(() -> new ResourceNotFoundException("Recurrence rule not found: " + ruleId));
        requireOwner(rule.getOrganizerId(), organizerId, "recurrence rule " + ruleId);

        if (newEndDate.isBefore(rule.getAnchorDate())) {
            throw new ValidationException("End date must not be before the first practice on " + rule.getAnchorDate());
        }
        requireWithinPolicyCap(newEndDate, now);

        LocalDate oldEndDate = rule.getEndDate();
        if (newEndDate.equals(oldEndDate)) {
            return new RecurrenceRuleUpdateResponse(ruleId, newEndDate, 0, 0);
        }

        List<PracticeSession> occurrences = sessionRepository.findByRecurrenceRuleId(ruleId);

        // 2. Shortening removes the occurrences past the new end
        if (newEndDate.isBefore(oldEndDate)) {
            List<PracticeSession> removed = occurrences.stream()
                .filter(session -> session.getEventDate().isAfter(newEndDate))
                .collect(Collectors.toList());

            ruleRepository.updateEndDate(ruleId, newEndDate);
            writeOrRestoreEndDate(ruleId, oldEndDate, () -> deleteWithSignups(removed));

            logger.info("Shortened rule {} to {}, removed {} occurrence(s)", ruleId, newEndDate, removed.size());
            return new RecurrenceRuleUpdateResponse(ruleId, newEndDate, 0, removed.size());
        }

        // 3. Extension generates the missing occurrences from the latest one
        List<LocalDate> newDates = recurrenceExpander.expandAfter(rule, oldEndDate, newEndDate);
        List<PracticeSession> added = new ArrayList<>();

        if (!newDates.isEmpty()) {
            PracticeSession template = occurrences.stream()
                .max(Comparator.comparing(PracticeSession::getEventDate))
                .orElseThrow(() -> new ValidationException("Series " + ruleId + " has no occurrence to extend from"));

            for (LocalDate date : newDates) {
                requireNotPast(date, template.getStartTime(), now);
            }
            List<OccurrenceSlot> slots = newDates.stream()
                .map(date -> new OccurrenceSlot(date, template.getStartTime(), template.getEndTime()))
                .collect(Collectors.toList());
            List<PracticeSession> existing = sessionRepository.findByOrganizerAndTeamOnDates(
                rule.getOrganizerId(), rule.getTeamName(), newDates);
            requireNoConflicts(slots, existing, rule.getOrganizerId(), rule.getTeamName());

            for (LocalDate date : newDates) {
                added.add(template.copyForDate(date));
            }
        }

        ruleRepository.updateEndDate(ruleId, newEndDate);
        writeOrRestoreEndDate(ruleId, oldEndDate, () -> sessionRepository.saveAll(added));

        logger.info("Extended rule {} to {}, added {} occurrence(s)", ruleId, newEndDate, added.size());
        return new RecurrenceRuleUpdateResponse(ruleId, newEndDate, added.size(), 0);
    }

    @Override
    public PracticeSessionDTO updatePractice(String sessionId, UpdatePracticeRequest request,
                                             String organizerId, LocalDateTime now) {
        logger.info("Organizer {} updating practice {} with scope {}", organizerId, sessionId, request.getScope());

        // 1. Validation and permissions
        if (request.getScope() == null) {
            throw new ValidationException("Scope is required");
        }
        PracticeSession session = loadSession(sessionId);
        requireOwner(session.getOrganizerId(), organizerId, "practice " + sessionId);

        String location = requireText(request.getLocation(), "Location");
        String startTime = DateTimeUtils.normalizeTime(request.getStartTime());
        String endTime = DateTimeUtils.normalizeTime(request.getEndTime());
        requireStartBeforeEnd(startTime, endTime);
        int capacity = requireCapacity(request.getMaxParticipants());
        requireRoomForSignups(session, capacity);

        boolean timingChanged = !startTime.equals(session.getStartTime()) || !endTime.equals(session.getEndTime());

        if (request.getScope() == OperationScope.SINGLE) {
            LocalDate date = request.getEventDate() != null ? request.getEventDate() : session.getEventDate();
            timingChanged = timingChanged || !date.equals(session.getEventDate());

            // 2. Checks against the organizer's other sessions
            if (timingChanged) {
                requireNotPast(date, startTime, now);
                List<PracticeSession> others = sessionRepository
                    .findByOrganizerAndTeamOnDates(organizerId, session.getTeamName(), List.of(date))
                    .stream()
                    .filter(other -> !other.getSessionId().equals(sessionId))
                    .collect(Collectors.toList());
                requireNoConflicts(List.of(new OccurrenceSlot(date, startTime, endTime)), others,
                    organizerId, session.getTeamName());
            }

            // 3. Persistence
            session.setEventDate(date);
            applyDetails(session, request, startTime, endTime, location, capacity);
            if (request.isDetachFromSeries() && session.isPartOfSeries()) {
                logger.info("Detaching practice {} from series {}", sessionId, session.getRecurrenceRuleId());
                session.setRecurrenceRuleId(null);
            }
            sessionRepository.save(session);

            logger.info("Updated practice {}", sessionId);
            return new PracticeSessionDTO(session);
        }

        if (!session.isPartOfSeries()) {
            throw new ValidationException("Practice " + sessionId + " is not part of a series");
        }
        if (request.isDetachFromSeries()) {
            throw new ValidationException("Only a single occurrence can be detached from its series");
        }

        // 2. Checks against sessions outside the series
        List<PracticeSession> occurrences = sessionRepository.findByRecurrenceRuleId(session.getRecurrenceRuleId());
        for (PracticeSession occurrence : occurrences) {
            requireRoomForSignups(occurrence, capacity);
        }
        if (timingChanged) {
            Set<String> seriesIds = occurrences.stream()
                .map(PracticeSession::getSessionId)
                .collect(Collectors.toSet());
            List<LocalDate> dates = occurrences.stream()
                .map(PracticeSession::getEventDate)
                .collect(Collectors.toList());
            List<OccurrenceSlot> slots = dates.stream()
                .map(date -> new OccurrenceSlot(date, startTime, endTime))
                .collect(Collectors.toList());
            List<PracticeSession> others = sessionRepository
                .findByOrganizerAndTeamOnDates(organizerId, session.getTeamName(), dates)
                .stream()
                .filter(other -> !seriesIds.contains(other.getSessionId()))
                .collect(Collectors.toList());
            requireNoConflicts(slots, others, organizerId, session.getTeamName());
        }

        // 3. Persistence
        PracticeSession edited = session;
        for (PracticeSession occurrence : occurrences) {
            applyDetails(occurrence, request, startTime, endTime, location, capacity);
            if (occurrence.getSessionId().equals(sessionId)) {
                edited = occurrence;
            }
        }
        sessionRepository.saveAll(occurrences);

        logger.info("Updated {} occurrence(s) of series {}", occurrences.size(), session.getRecurrenceRuleId());
        return new PracticeSessionDTO(edited);
    }

    @Override
    public void deletePractice(String sessionId, OperationScope scope, String organizerId) {
        logger.info("Organizer {} deleting practice {} with scope {}", organizerId, sessionId, scope);

        if (scope == null) {
            throw new ValidationException("Scope is required");
        }
        PracticeSession session = loadSession(sessionId);
        requireOwner(session.getOrganizerId(), organizerId, "practice " + sessionId);

        if (scope == OperationScope.SINGLE) {
            int signups = signupRepository.deleteAllForSessions(List.of(sessionId));
            sessionRepository.deleteById(sessionId);
            logger.info("Deleted practice {} with {} sign-up(s)", sessionId, signups);
            return;
        }

        if (!session.isPartOfSeries()) {
            throw new ValidationException("Practice " + sessionId + " is not part of a series");
        }
        String ruleId = session.getRecurrenceRuleId();
        List<PracticeSession> occurrences = sessionRepository.findByRecurrenceRuleId(ruleId);
        deleteWithSignups(occurrences);
        ruleRepository.deleteById(ruleId);

        logger.info("Deleted series {} with {} occurrence(s)", ruleId, occurrences.size());
    }

    private PracticeSession loadSession(String sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Practice not found: " + sessionId));
    }

    private void applyDetails(PracticeSession session, UpdatePracticeRequest request,
                              String startTime, String endTime, String location, int capacity) {
        session.setStartTime(startTime);
        session.setEndTime(endTime);
        session.setLocation(location);
        session.setMaxParticipants(capacity);
        session.setContent(blankToNull(request.getContent()));
        session.setLevel(blankToNull(request.getLevel()));
        session.setConditions(blankToNull(request.getConditions()));
    }

    private void deleteWithSignups(List<PracticeSession> sessions) {
        if (sessions.isEmpty()) {
            return;
        }
        List<String> sessionIds = sessions.stream()
            .map(PracticeSession::getSessionId)
            .collect(Collectors.toList());
        int signups = signupRepository.deleteAllForSessions(sessionIds);
        sessionRepository.deleteAll(sessions);
        logger.debug("Deleted {} session(s) and {} sign-up(s)", sessions.size(), signups);
    }

    private void writeOrRestoreEndDate(String ruleId, LocalDate previousEndDate, Runnable sessionWrite) {
        try {
            sessionWrite.run();
        } catch (RepositoryException e) {
            logger.error("Occurrence write for rule {} failed, restoring end date {}", ruleId, previousEndDate, e);
            try {
                ruleRepository.updateEndDate(ruleId, previousEndDate);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }

    private void requireNoConflicts(List<OccurrenceSlot> slots, List<PracticeSession> existing,
                                    String organizerId, String teamName) {
        List<ConflictRecord> conflicts = conflictDetector.detect(slots, existing);
        if (!conflicts.isEmpty()) {
            logger.warn("Rejected practice for organizer {} team {}: {} conflict(s), first on {}",
                organizerId, teamName, conflicts.size(), conflicts.get(0).date());
            throw new ConflictDetectedException(conflicts);
        }
    }

    private static void requireRoomForSignups(PracticeSession session, int capacity) {
        if (capacity < session.getParticipantCount()) {
            throw new ValidationException("Capacity of practice on " + session.getEventDate() + " cannot drop below the "
                + session.getParticipantCount() + " member(s) already signed up");
        }
    }

    private static void requireNotPast(LocalDate date, String startTime, LocalDateTime now) {
        if (date.atTime(DateTimeUtils.parseTime(startTime)).isBefore(now)) {
            throw new PastDatetimeException("Practice on " + date + " at " + startTime + " starts in the past");
        }
    }

    private static void requireWithinPolicyCap(LocalDate endDate, LocalDateTime now) {
        LocalDate cap = LocalDate.of(now.getYear(), 12, 31);
        if (endDate.isAfter(cap)) {
            throw new PolicyCapExceededException("Recurrence cannot run past " + cap);
        }
    }

    private static void requireOwner(String ownerId, String organizerId, String what) {
        if (organizerId == null || !organizerId.equals(ownerId)) {
            throw new UnauthorizedException("Organizer " + organizerId + " does not own " + what);
        }
    }

    private static void requireStartBeforeEnd(String startTime, String endTime) {
        if (DateTimeUtils.toMinutes(startTime) >= DateTimeUtils.toMinutes(endTime)) {
            throw new ValidationException("Start time must be before end time");
        }
    }

    private static int requireCapacity(Integer maxParticipants) {
        if (maxParticipants == null || maxParticipants < 1) {
            throw new ValidationException("Capacity must be at least 1");
        }
        return maxParticipants;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
