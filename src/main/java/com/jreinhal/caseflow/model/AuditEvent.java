package com.jreinhal.caseflow.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="audit_log")
public class AuditEvent {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private EventType eventType;
    @Indexed
    private String userId;
    private String username;
    private String firmId;
    private String correlationId;
    private String action;
    private String resourceType;
    @Indexed
    private String resourceId;
    @Indexed
    private Outcome outcome;
    private String outcomeReason;
    private Map<String, Object> metadata = new HashMap<String, Object>();

    public AuditEvent() {
        this.timestamp = Instant.now();
    }

    public static AuditEvent create(EventType type, String userId, String action) {
        AuditEvent event = new AuditEvent();
        event.eventType = type;
        event.userId = userId;
        event.action = action;
        event.outcome = Outcome.SUCCESS;
        return event;
    }

    public AuditEvent withUser(User user) {
        if (user != null) {
            this.userId = user.getId();
            this.username = user.getUsername();
            this.firmId = user.getFirmId();
        }
        return this;
    }

    public AuditEvent withCorrelationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public AuditEvent withResource(String type, String id) {
        this.resourceType = type;
        this.resourceId = id;
        return this;
    }

    public AuditEvent withOutcome(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.outcomeReason = reason;
        return this;
    }

    public AuditEvent withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public AuditEvent withMetadata(Map<String, Object> values) {
        if (values != null) {
            this.metadata.putAll(values);
        }
        return this;
    }

    public String getId() {
        return this.id;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getUsername() {
        return this.username;
    }

    public String getFirmId() {
        return this.firmId;
    }

    public String getCorrelationId() {
        return this.correlationId;
    }

    public String getAction() {
        return this.action;
    }

    public String getResourceType() {
        return this.resourceType;
    }

    public String getResourceId() {
        return this.resourceId;
    }

    public Outcome getOutcome() {
        return this.outcome;
    }

    public String getOutcomeReason() {
        return this.outcomeReason;
    }

    public Map<String, Object> getMetadata() {
        return this.metadata;
    }

    public static enum EventType {
        AUTH_FAILURE,
        ACCESS_DENIED,
        CASE_UPDATED;

    }

    public static enum Outcome {
        SUCCESS,
        FAILURE,
        DENIED,
        ERROR;

    }
}
