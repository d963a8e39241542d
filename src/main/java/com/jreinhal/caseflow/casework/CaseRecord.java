package com.jreinhal.caseflow.casework;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * Case document as written by the case module. The pipeline reads ownership and
 * classification and only ever mutates the stage, outcome and note fields.
 */
@Document(collection="cases")
public class CaseRecord {
    @Id
    private String id;
    @Field(targetType = FieldType.OBJECT_ID)
    private String firmId;
    @Field(targetType = FieldType.OBJECT_ID)
    private String lawyerId;
    @Field(targetType = FieldType.OBJECT_ID)
    private String clientId;
    private Instant deletedAt;
    private String caseNumber;
    private String title;
    private CaseCategory category;
    private String status;
    private String priority;
    private CaseOutcome outcome;
    private String court;
    private String judge;
    private Instant nextHearing;
    private String plaintiffName;
    private String defendantName;
    private PartyDetails plaintiff;
    private PartyDetails defendant;
    private LaborCaseDetails laborCaseDetails;
    private String currentStage;
    private String pipelineStage;
    private Instant stageEnteredAt;
    private List<StageHistoryEntry> stageHistory = new ArrayList<StageHistoryEntry>();
    private Instant endDate;
    private EndDetails endDetails;
    private List<CaseNote> notes = new ArrayList<CaseNote>();
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal claimAmount;
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal expectedWinAmount;
    private Long revision;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isDeleted() {
        return this.deletedAt != null;
    }

    public boolean isEnded() {
        return CaseStatus.isTerminal(this.status);
    }

    public CaseCategory resolvedCategory() {
        return this.category != null ? this.category : CaseCategory.OTHER;
    }

    public long currentRevision() {
        return this.revision != null ? this.revision : 0L;
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getFirmId() {
        return this.firmId;
    }

    public void setFirmId(String firmId) {
        this.firmId = firmId;
    }

    public String getLawyerId() {
        return this.lawyerId;
    }

    public void setLawyerId(String lawyerId) {
        this.lawyerId = lawyerId;
    }

    public String getClientId() {
        return this.clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public Instant getDeletedAt() {
        return this.deletedAt;
    }

    public void setDeletedAt(Instant deletedAt) {
        this.deletedAt = deletedAt;
    }

    public String getCaseNumber() {
        return this.caseNumber;
    }

    public void setCaseNumber(String caseNumber) {
        this.caseNumber = caseNumber;
    }

    public String getTitle() {
        return this.title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public CaseCategory getCategory() {
        return this.category;
    }

    public void setCategory(CaseCategory category) {
        this.category = category;
    }

    public String getStatus() {
        return this.status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPriority() {
        return this.priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public CaseOutcome getOutcome() {
        return this.outcome;
    }

    public void setOutcome(CaseOutcome outcome) {
        this.outcome = outcome;
    }

    public String getCourt() {
        return this.court;
    }

    public void setCourt(String court) {
        this.court = court;
    }

    public String getJudge() {
        return this.judge;
    }

    public void setJudge(String judge) {
        this.judge = judge;
    }

    public Instant getNextHearing() {
        return this.nextHearing;
    }

    public void setNextHearing(Instant nextHearing) {
        this.nextHearing = nextHearing;
    }

    public String getPlaintiffName() {
        return this.plaintiffName;
    }

    public void setPlaintiffName(String plaintiffName) {
        this.plaintiffName = plaintiffName;
    }

    public String getDefendantName() {
        return this.defendantName;
    }

    public void setDefendantName(String defendantName) {
        this.defendantName = defendantName;
    }

    public PartyDetails getPlaintiff() {
        return this.plaintiff;
    }

    public void setPlaintiff(PartyDetails plaintiff) {
        this.plaintiff = plaintiff;
    }

    public PartyDetails getDefendant() {
        return this.defendant;
    }

    public void setDefendant(PartyDetails defendant) {
        this.defendant = defendant;
    }

    public LaborCaseDetails getLaborCaseDetails() {
        return this.laborCaseDetails;
    }

    public void setLaborCaseDetails(LaborCaseDetails laborCaseDetails) {
        this.laborCaseDetails = laborCaseDetails;
    }

    public String getCurrentStage() {
        return this.currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public String getPipelineStage() {
        return this.pipelineStage;
    }

    public void setPipelineStage(String pipelineStage) {
        this.pipelineStage = pipelineStage;
    }

    public Instant getStageEnteredAt() {
        return this.stageEnteredAt;
    }

    public void setStageEnteredAt(Instant stageEnteredAt) {
        this.stageEnteredAt = stageEnteredAt;
    }

    public List<StageHistoryEntry> getStageHistory() {
        return this.stageHistory;
    }

    public void setStageHistory(List<StageHistoryEntry> stageHistory) {
        this.stageHistory = stageHistory;
    }

    public Instant getEndDate() {
        return this.endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = endDate;
    }

    public EndDetails getEndDetails() {
        return this.endDetails;
    }

    public void setEndDetails(EndDetails endDetails) {
        this.endDetails = endDetails;
    }

    public List<CaseNote> getNotes() {
        return this.notes;
    }

    public void setNotes(List<CaseNote> notes) {
        this.notes = notes;
    }

    public BigDecimal getClaimAmount() {
        return this.claimAmount;
    }

    public void setClaimAmount(BigDecimal claimAmount) {
        this.claimAmount = claimAmount;
    }

    public BigDecimal getExpectedWinAmount() {
        return this.expectedWinAmount;
    }

    public void setExpectedWinAmount(BigDecimal expectedWinAmount) {
        this.expectedWinAmount = expectedWinAmount;
    }

    public Long getRevision() {
        return this.revision;
    }

    public void setRevision(Long revision) {
        this.revision = revision;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return this.updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /** Pre-migration party shape: {@code plaintiff.fullNameArabic}. */
    public record PartyDetails(String fullNameArabic) {
    }

    /** Pre-migration labor case shape: {@code laborCaseDetails.plaintiff.name} / {@code .company.name}. */
    public record LaborCaseDetails(NamedParty plaintiff, NamedParty company) {
    }

    public record NamedParty(String name) {
    }
}
