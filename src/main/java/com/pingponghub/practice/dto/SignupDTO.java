package com.pingponghub.practice.dto;

import com.pingponghub.practice.model.Signup;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class SignupDTO {
    private String sessionId;
    private String userId;
    private Instant joinedAt;

    public SignupDTO(Signup signup) {
        this.sessionId = signup.getSessionId();
        this.userId = signup.getUserId();
        this.joinedAt = signup.getCreatedAt();
    }
}
