package com.pingponghub.practice.model;

import com.pingponghub.practice.util.PracticeKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.LocalDate;
import java.util.UUID;

/**
 * One concrete, bookable practice occurrence.
 * 
 * Key Pattern: PK = PRACTICE#{sessionId}, SK = METADATA
 * GSI1 (OrganizerTeamIndex): ORGANIZER#{organizerId}#TEAM#{teamName} / {eventDate}T{startTime}
 * GSI2 (RecurrenceRuleIndex): RULE#{recurrenceRuleId} / {eventDate}, only for series members
 */
@DynamoDbBean
public class PracticeSession extends BaseItem {

    public static final String ITEM_TYPE = "PRACTICE";
    
    private String sessionId;
    private String organizerId;
    private String teamName;
    private LocalDate eventDate;
    private String startTime;           // HH:MM
    private String endTime;             // HH:MM
    private String location;
    private int maxParticipants;
    private int participantCount;       // kept in step with the SIGNUP# items of this partition
    private String content;
    private String level;
    private String conditions;
    private String recurrenceRuleId;    // null for one-off sessions
    
    // Default constructor for DynamoDB
    public PracticeSession() {
        super();
        setItemType(ITEM_TYPE);
    }

    /**
     * Create a new session with generated UUID and keys.
     */
    public PracticeSession(String organizerId, String teamName, LocalDate eventDate, String startTime, String endTime) {
        super();
        setItemType(ITEM_TYPE);
        this.sessionId = UUID.randomUUID().toString();
        this.organizerId = organizerId;
        this.teamName = teamName;
        this.eventDate = eventDate;
        this.startTime = startTime;
        this.endTime = endTime;
        
        setPk(PracticeKeyFactory.getPracticePk(this.sessionId));
        setSk(PracticeKeyFactory.getMetadataSk());
        refreshIndexKeys();
    }

    /**
     * Copy every descriptive field of this session onto a new occurrence for another date.
     * The copy gets its own id and keys and belongs to the same series.
     */
    public PracticeSession copyForDate(LocalDate date) {
        PracticeSession copy = new PracticeSession(organizerId, teamName, date, startTime, endTime);
        copy.setLocation(location);
        copy.setMaxParticipants(maxParticipants);
        copy.setContent(content);
        copy.setLevel(level);
        copy.setConditions(conditions);
        copy.setRecurrenceRuleId(recurrenceRuleId);
        return copy;
    }

    /**
     * Recompute the GSI keys after the date, start time, team or series membership changed.
     */
    public void refreshIndexKeys() {
        setGsi1pk(PracticeKeyFactory.getOrganizerTeamKey(organizerId, teamName));
        setGsi1sk(PracticeKeyFactory.getSessionSlotSk(eventDate, startTime));
        if (recurrenceRuleId != null) {
            setGsi2pk(PracticeKeyFactory.getRulePk(recurrenceRuleId));
            setGsi2sk(eventDate.toString());
        } else {
            setGsi2pk(null);
            setGsi2sk(null);
        }
    }
    
    public String getSessionId() {
        return sessionId;
    }
    
    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
    
    public String getOrganizerId() {
        return organizerId;
    }
    
    public void setOrganizerId(String organizerId) {
        this.organizerId = organizerId;
    }
    
    public String getTeamName() {
        return teamName;
    }
    
    public void setTeamName(String teamName) {
        this.teamName = teamName;
    }
    
    public LocalDate getEventDate() {
        return eventDate;
    }
    
    public void setEventDate(LocalDate eventDate) {
        this.eventDate = eventDate;
    }
    
    public String getStartTime() {
        return startTime;
    }
    
    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }
    
    public String getEndTime() {
        return endTime;
    }
    
    public void setEndTime(String endTime) {
        this.endTime = endTime;
    }
    
    public String getLocation() {
        return location;
    }
    
    public void setLocation(String location) {
        this.location = location;
    }
    
    public int getMaxParticipants() {
        return maxParticipants;
    }
    
    public void setMaxParticipants(int maxParticipants) {
        this.maxParticipants = maxParticipants;
    }
    
    public int getParticipantCount() {
        return participantCount;
    }

    public void setParticipantCount(int participantCount) {
        this.participantCount = participantCount;
    }

    public String getContent() {
        return content;
    }
    
    public void setContent(String content) {
        this.content = content;
    }
    
    public String getLevel() {
        return level;
    }
    
    public void setLevel(String level) {
        this.level = level;
    }
    
    public String getConditions() {
        return conditions;
    }
    
    public void setConditions(String conditions) {
        this.conditions = conditions;
    }
    
    public String getRecurrenceRuleId() {
        return recurrenceRuleId;
    }
    
    public void setRecurrenceRuleId(String recurrenceRuleId) {
        this.recurrenceRuleId = recurrenceRuleId;
    }
    
    /**
     * Check if this session was generated by a recurrence rule.
     */
    @DynamoDbIgnore
    public boolean isPartOfSeries() {
        return recurrenceRuleId != null;
    }
}
