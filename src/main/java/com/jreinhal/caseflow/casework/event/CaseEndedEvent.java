package com.jreinhal.caseflow.casework.event;

import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.model.User;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record CaseEndedEvent(
    String caseId,
    User actor,
    CaseOutcome outcome,
    String endReason,
    BigDecimal finalAmount,
    Instant occurredAt
) implements CasePipelineEvent {
    public static final String ACTION = "case_ended";

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", ACTION);
        details.put("outcome", outcome.getKey());
        details.put("endReason", endReason);
        details.put("finalAmount", finalAmount != null ? finalAmount.toPlainString() : null);
        return details;
    }
}
