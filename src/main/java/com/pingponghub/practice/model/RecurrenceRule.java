package com.pingponghub.practice.model;

import com.pingponghub.practice.util.PracticeKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The generating function of a practice series.
 * Immutable except for its end date.
 * 
 * Key Pattern: PK = RULE#{ruleId}, SK = METADATA
 */
@DynamoDbBean
public class RecurrenceRule extends BaseItem {

    public static final String ITEM_TYPE = "RECURRENCE_RULE";
    
    private String ruleId;
    private String organizerId;
    private String teamName;
    private RecurrenceKind kind;
    private LocalDate anchorDate;
    private Integer dayOfWeek;      // 0 = Sunday, null for MONTHLY_FIXED_DATE
    private Integer nthWeek;        // 1..5, only for MONTHLY_NTH_WEEKDAY
    private LocalDate endDate;      // inclusive
    
    // Default constructor for DynamoDB
    public RecurrenceRule() {
        super();
        setItemType(ITEM_TYPE);
    }

    /**
     * Create a new rule with generated UUID.
     */
    public RecurrenceRule(String organizerId, String teamName, RecurrenceKind kind,
                          LocalDate anchorDate, LocalDate endDate) {
        super();
        setItemType(ITEM_TYPE);
        this.ruleId = UUID.randomUUID().toString();
        this.organizerId = organizerId;
        this.teamName = teamName;
        this.kind = kind;
        this.anchorDate = anchorDate;
        this.endDate = endDate;
        
        setPk(PracticeKeyFactory.getRulePk(this.ruleId));
        setSk(PracticeKeyFactory.getMetadataSk());
    }
    
    public String getRuleId() {
        return ruleId;
    }
    
    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
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
    
    public RecurrenceKind getKind() {
        return kind;
    }
    
    public void setKind(RecurrenceKind kind) {
        this.kind = kind;
    }
    
    public LocalDate getAnchorDate() {
        return anchorDate;
    }
    
    public void setAnchorDate(LocalDate anchorDate) {
        this.anchorDate = anchorDate;
    }
    
    public Integer getDayOfWeek() {
        return dayOfWeek;
    }
    
    public void setDayOfWeek(Integer dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }
    
    public Integer getNthWeek() {
        return nthWeek;
    }
    
    public void setNthWeek(Integer nthWeek) {
        this.nthWeek = nthWeek;
    }
    
    public LocalDate getEndDate() {
        return endDate;
    }
    
    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }
}
