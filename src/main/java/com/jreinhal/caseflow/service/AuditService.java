package com.jreinhal.caseflow.service;

import com.jreinhal.caseflow.filter.CorrelationIdFilter;
import com.jreinhal.caseflow.model.AuditEvent;
import com.jreinhal.caseflow.model.User;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);
    public static final String COLLECTION = "audit_log";
    private final MongoTemplate mongoTemplate;
    @Value(value="${caseflow.audit.fail-closed:false}")
    private boolean failClosed;

    public AuditService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void log(AuditEvent event) {
        try {
            this.mongoTemplate.save(event, COLLECTION);
            log.debug("Audit event logged: {} - {} - {}", new Object[]{event.getEventType(), event.getUserId(), event.getAction()});
        }
        catch (Exception e) {
            log.error("Failed to persist audit event: {} - {}", event.getEventType(), e.getMessage());
            if (this.failClosed) {
                throw new AuditFailureException("Audit logging failed. Event: " + String.valueOf(event.getEventType()) + ", Error: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Records a pipeline mutation. {@code action} is the event name
     * ({@code stage_change}, {@code case_ended}, ...).
     */
    public void logCaseUpdate(String caseId, User user, String action, Map<String, Object> details) {
        AuditEvent event = AuditEvent.create(AuditEvent.EventType.CASE_UPDATED, user != null ? user.getId() : null, action)
                .withUser(user)
                .withCorrelationId(CorrelationIdFilter.currentCorrelationId())
                .withResource("CASE", caseId)
                .withMetadata(details);
        this.log(event);
    }

    public void logAuthFailure(String reason, HttpServletRequest request) {
        AuditEvent event = AuditEvent.create(AuditEvent.EventType.AUTH_FAILURE, "ANONYMOUS", "Authentication failed")
                .withCorrelationId(CorrelationIdFilter.currentCorrelationId())
                .withResource("ENDPOINT", request.getRequestURI())
                .withOutcome(AuditEvent.Outcome.FAILURE, reason)
                .withMetadata("sourceIp", this.getClientIp(request));
        this.log(event);
    }

    public void logAccessDenied(User user, String resourceType, String resourceId, String reason) {
        AuditEvent event = AuditEvent.create(AuditEvent.EventType.ACCESS_DENIED, user != null ? user.getId() : "ANONYMOUS", "Access denied to: " + resourceType)
                .withUser(user)
                .withCorrelationId(CorrelationIdFilter.currentCorrelationId())
                .withResource(resourceType, resourceId)
                .withOutcome(AuditEvent.Outcome.DENIED, reason);
        this.log(event);
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    public static class AuditFailureException
    extends RuntimeException {
        public AuditFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
