package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseNote;
import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.ClientSummary;
import java.math.BigDecimal;
import java.time.Instant;

public record PipelineCaseView(
    String id,
    String caseNumber,
    String title,
    CaseCategory category,
    String status,
    String priority,
    CaseOutcome outcome,
    String plaintiffName,
    String defendantName,
    ClientSummary client,
    String court,
    String judge,
    Instant nextHearing,
    BigDecimal claimAmount,
    BigDecimal expectedWinAmount,
    String currentStage,
    Instant stageEnteredAt,
    long daysInCurrentStage,
    long tasksCount,
    long notionPagesCount,
    long remindersCount,
    long eventsCount,
    int notesCount,
    CaseNote latestNote,
    Instant createdAt,
    Instant updatedAt
) {
}
