package com.jreinhal.caseflow.casework.event;

import com.jreinhal.caseflow.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class CaseAuditListener {
    private static final Logger log = LoggerFactory.getLogger(CaseAuditListener.class);
    private final AuditService auditService;

    public CaseAuditListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onPipelineEvent(CasePipelineEvent event) {
        try {
            auditService.logCaseUpdate(event.caseId(), event.actor(), event.action(), event.details());
        } catch (RuntimeException e) {
            log.warn("Audit log error for {} on case {}: {}", event.action(), event.caseId(), e.getMessage());
        }
    }
}
