package com.jreinhal.caseflow.casework.event;

import com.jreinhal.caseflow.model.User;
import java.time.Instant;
import java.util.Map;

/**
 * Published after a pipeline change has been persisted.
 */
public interface CasePipelineEvent {
    String caseId();

    User actor();

    Instant occurredAt();

    /** Audit action name. */
    String action();

    /** Audit payload. */
    Map<String, Object> details();
}
