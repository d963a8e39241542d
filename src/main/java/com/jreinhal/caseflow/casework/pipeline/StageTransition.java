package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.StageHistoryEntry;
import java.time.Instant;
import java.util.List;

public record StageTransition(String caseId, String currentStage, Instant stageEnteredAt, List<StageHistoryEntry> stageHistory) {
}
