package com.pingponghub.practice.util;

import com.pingponghub.practice.exception.InvalidKeyException;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the PracticeTable single-table design.
 */
public final class PracticeKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", 
        Pattern.CASE_INSENSITIVE
    );
    
    public static final String TABLE_NAME = "PracticeTable";

    public static final String PRACTICE_PREFIX = "PRACTICE";
    public static final String RULE_PREFIX = "RULE";
    public static final String ORGANIZER_PREFIX = "ORGANIZER";
    public static final String TEAM_PREFIX = "TEAM";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String SIGNUP_PREFIX = "SIGNUP";

    public static final String ORGANIZER_TEAM_INDEX = "OrganizerTeamIndex";
    public static final String RECURRENCE_RULE_INDEX = "RecurrenceRuleIndex";
    
    private PracticeKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }
    
    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    private static void validateLabel(String value, String type) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidKeyException(type + " cannot be null or empty");
        }
    }
    
    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }
    
    public static String getPracticePk(String sessionId) {
        validateId(sessionId, "Practice");
        return PRACTICE_PREFIX + DELIMITER + sessionId;
    }
    
    /**
     * Sort key of a member's sign-up, stored in the partition of the practice it belongs to.
     */
    public static String getSignupSk(String userId) {
        validateLabel(userId, "User ID");
        return SIGNUP_PREFIX + DELIMITER + userId;
    }

    public static String getRulePk(String ruleId) {
        validateId(ruleId, "Recurrence rule");
        return RULE_PREFIX + DELIMITER + ruleId;
    }
    
    /**
     * Partition key of OrganizerTeamIndex. Organizer ids come from the identity provider
     * and are opaque strings, so only emptiness is checked.
     */
    public static String getOrganizerTeamKey(String organizerId, String teamName) {
        validateLabel(organizerId, "Organizer ID");
        validateLabel(teamName, "Team name");
        return ORGANIZER_PREFIX + DELIMITER + organizerId + DELIMITER + TEAM_PREFIX + DELIMITER + teamName;
    }
    
    /**
     * Sort key of OrganizerTeamIndex, e.g. {@code 2024-02-10T14:00}.
     * ISO dates sort lexicographically, so a date range maps to a BETWEEN condition.
     */
    public static String getSessionSlotSk(LocalDate eventDate, String startTime) {
        if (eventDate == null) {
            throw new InvalidKeyException("Event date cannot be null");
        }
        return eventDate + "T" + startTime;
    }

    /**
     * Upper bound (inclusive) of all slot keys on the given date.
     */
    public static String getEndOfDaySlotSk(LocalDate eventDate) {
        return eventDate + "T23:59";
    }
    
    public static boolean isPracticeItem(String pk) {
        return pk != null && pk.startsWith(PRACTICE_PREFIX + DELIMITER);
    }

    public static boolean isSignupItem(String sk) {
        return sk != null && sk.startsWith(SIGNUP_PREFIX + DELIMITER);
    }
}
