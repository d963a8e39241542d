package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.ClientSummary;
import java.math.BigDecimal;
import java.time.Instant;

/** Kanban card. */
public record StageBoardCard(
    String id,
    String title,
    String caseNumber,
    CaseCategory category,
    String status,
    String priority,
    String plaintiffName,
    String defendantName,
    ClientSummary client,
    String court,
    BigDecimal claimAmount,
    String currentStage,
    Instant stageEnteredAt,
    long daysInStage,
    Instant nextHearing,
    CaseOutcome outcome,
    String latestNote,
    Instant updatedAt,
    Instant createdAt
) {
}
