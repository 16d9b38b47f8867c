package com.pingponghub.practice.model;

import com.pingponghub.practice.util.PracticeKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * A member's place in one practice session. At most one per member and session.
 *
 * Key Pattern: PK = PRACTICE#{sessionId}, SK = SIGNUP#{userId}
 */
@DynamoDbBean
public class Signup extends BaseItem {

    public static final String ITEM_TYPE = "SIGNUP";

    private String sessionId;
    private String userId;

    // Default constructor for DynamoDB
    public Signup() {
        super();
        setItemType(ITEM_TYPE);
    }

    public Signup(String sessionId, String userId) {
        super();
        setItemType(ITEM_TYPE);
        this.sessionId = sessionId;
        this.userId = userId;

        setPk(PracticeKeyFactory.getPracticePk(sessionId));
        setSk(PracticeKeyFactory.getSignupSk(userId));
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }
}
