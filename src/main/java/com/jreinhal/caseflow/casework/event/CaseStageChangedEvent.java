package com.jreinhal.caseflow.casework.event;

import com.jreinhal.caseflow.model.User;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record CaseStageChangedEvent(
    String caseId,
    User actor,
    String oldStage,
    String newStage,
    String notes,
    Instant occurredAt
) implements CasePipelineEvent {
    public static final String ACTION = "stage_change";

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", ACTION);
        details.put("oldStage", oldStage);
        details.put("newStage", newStage);
        details.put("notes", notes);
        return details;
    }
}
