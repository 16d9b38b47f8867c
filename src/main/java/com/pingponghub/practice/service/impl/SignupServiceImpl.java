package com.pingponghub.practice.service.impl;

import com.pingponghub.practice.dto.SignupDTO;
import com.pingponghub.practice.exception.CapacityExceededException;
import com.pingponghub.practice.exception.PastDatetimeException;
import com.pingponghub.practice.exception.ResourceNotFoundException;
import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.model.Signup;
import com.pingponghub.practice.repository.PracticeSessionRepository;
import com.pingponghub.practice.repository.SignupRepository;
import com.pingponghub.practice.service.SignupService;
import com.pingponghub.practice.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementation of SignupService.
 * The capacity check here only short-cuts the common case; the repository transaction enforces it.
 */
@Service
public class SignupServiceImpl implements SignupService {

    private static final Logger logger = LoggerFactory.getLogger(SignupServiceImpl.class);

    private final PracticeSessionRepository sessionRepository;
    private final SignupRepository signupRepository;

    @Autowired
    public SignupServiceImpl(PracticeSessionRepository sessionRepository, SignupRepository signupRepository) {
        this.sessionRepository = sessionRepository;
        this.signupRepository = signupRepository;
    }

    @Override
    public SignupDTO joinPractice(String sessionId, String userId, LocalDateTime now) {
        logger.info("User {} joining practice {}", userId, sessionId);

        PracticeSession session = loadSession(sessionId);

        LocalDateTime start = session.getEventDate().atTime(DateTimeUtils.parseTime(session.getStartTime()));
        if (start.isBefore(now)) {
            throw new PastDatetimeException("Practice " + sessionId + " already started at " + start);
        }

        if (session.getParticipantCount() >= session.getMaxParticipants()) {
            throw new CapacityExceededException(String.format("This practice is full (%d/%d places taken)",
                session.getParticipantCount(), session.getMaxParticipants()));
        }

        Signup signup = signupRepository.join(sessionId, userId);

        logger.info("User {} joined practice {} ({} of {} places were taken before)",
            userId, sessionId, session.getParticipantCount(), session.getMaxParticipants());
        return new SignupDTO(signup);
    }

    @Override
    public void cancelSignup(String sessionId, String userId) {
        logger.info("User {} cancelling sign-up for practice {}", userId, sessionId);

        loadSession(sessionId);
        signupRepository.cancel(sessionId, userId);

        logger.info("User {} left practice {}", userId, sessionId);
    }

    @Override
    public List<SignupDTO> listSignups(String sessionId) {
        loadSession(sessionId);
        return signupRepository.findBySessionId(sessionId).stream()
            .map(SignupDTO::new)
            .collect(Collectors.toList());
    }

    private PracticeSession loadSession(String sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Practice not found: " + sessionId));
    }
}
