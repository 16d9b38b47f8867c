package com.pingponghub.practice.service.impl;

import com.pingponghub.practice.dto.SignupDTO;
import com.pingponghub.practice.exception.AlreadySignedUpException;
import com.pingponghub.practice.exception.CapacityExceededException;
import com.pingponghub.practice.exception.PastDatetimeException;
import com.pingponghub.practice.exception.ResourceNotFoundException;
import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.model.Signup;
import com.pingponghub.practice.repository.PracticeSessionRepository;
import com.pingponghub.practice.repository.SignupRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignupServiceImplTest {

    private static final String USER_ID = "user_member";
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);

    @Mock
    private PracticeSessionRepository sessionRepository;

    @Mock
    private SignupRepository signupRepository;

    private SignupServiceImpl service;
    private PracticeSession session;

    @BeforeEach
    void setUp() {
        service = new SignupServiceImpl(sessionRepository, signupRepository);

        session = new PracticeSession("user_organizer", "Tigers", LocalDate.of(2024, 2, 10), "14:00", "16:00");
        session.setLocation("City Gym");
        session.setMaxParticipants(2);
        lenient().when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));
    }

    @Nested
    @DisplayName("joinPractice")
    class JoinPractice {

        @Test
        void withFreePlace_StoresSignup() {
            // Given
            session.setParticipantCount(1);
            when(signupRepository.join(session.getSessionId(), USER_ID))
                .thenReturn(new Signup(session.getSessionId(), USER_ID));

            // When
            SignupDTO result = service.joinPractice(session.getSessionId(), USER_ID, NOW);

            // Then
            assertThat(result.getSessionId()).isEqualTo(session.getSessionId());
            assertThat(result.getUserId()).isEqualTo(USER_ID);
            assertThat(result.getJoinedAt()).isNotNull();
        }

        @Test
        void whenFull_RejectsWithoutWriting() {
            // Given
            session.setParticipantCount(2);

            // When / Then
            assertThatThrownBy(() -> service.joinPractice(session.getSessionId(), USER_ID, NOW))
                .isInstanceOf(CapacityExceededException.class)
                .hasMessageContaining("2/2");
            verifyNoInteractions(signupRepository);
        }

        @Test
        void whenFilledConcurrently_PropagatesRepositoryRejection() {
            // Given the count read here is stale
            session.setParticipantCount(1);
            when(signupRepository.join(session.getSessionId(), USER_ID))
                .thenThrow(new CapacityExceededException("This practice is full (2/2 places taken)"));

            // When / Then
            assertThatThrownBy(() -> service.joinPractice(session.getSessionId(), USER_ID, NOW))
                .isInstanceOf(CapacityExceededException.class);
        }

        @Test
        void twice_IsRejected() {
            when(signupRepository.join(session.getSessionId(), USER_ID))
                .thenThrow(new AlreadySignedUpException("User user_member already joined"));

            assertThatThrownBy(() -> service.joinPractice(session.getSessionId(), USER_ID, NOW))
                .isInstanceOf(AlreadySignedUpException.class);
        }

        @Test
        void afterStart_IsRejected() {
            LocalDateTime duringPractice = LocalDateTime.of(2024, 2, 10, 14, 30);

            assertThatThrownBy(() -> service.joinPractice(session.getSessionId(), USER_ID, duringPractice))
                .isInstanceOf(PastDatetimeException.class);
            verifyNoInteractions(signupRepository);
        }

        @Test
        void unknownSession_IsNotFound() {
            when(sessionRepository.findById(anyString())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.joinPractice("12345678-1234-1234-1234-123456789012", USER_ID, NOW))
                .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(signupRepository);
        }
    }

    @Test
    void cancelSignup_RemovesMembersSignup() {
        service.cancelSignup(session.getSessionId(), USER_ID);

        verify(signupRepository).cancel(session.getSessionId(), USER_ID);
    }

    @Test
    void cancelSignup_OnUnknownSession_IsNotFound() {
        when(sessionRepository.findById(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.cancelSignup("12345678-1234-1234-1234-123456789012", USER_ID))
            .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(signupRepository);
    }

    @Test
    void listSignups_MapsSignupsToDtos() {
        when(signupRepository.findBySessionId(session.getSessionId())).thenReturn(List.of(
            new Signup(session.getSessionId(), "member_a"),
            new Signup(session.getSessionId(), "member_b")));

        List<SignupDTO> result = service.listSignups(session.getSessionId());

        assertThat(result).extracting(SignupDTO::getUserId).containsExactly("member_a", "member_b");
    }
}
