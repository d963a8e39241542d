package com.jreinhal.caseflow.casework;

import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.service.AuditService;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

/**
 * Tenant scope for queries and the id/existence/ownership gate every case command
 * passes before it touches the case.
 */
@Component
public class CaseAccessPolicy {
    private static final Logger log = LoggerFactory.getLogger(CaseAccessPolicy.class);
    private final CaseStore caseStore;
    private final AuditService auditService;

    @Value("${caseflow.pipeline.conceal-foreign-cases:false}")
    private boolean concealForeignCases;

    public CaseAccessPolicy(CaseStore caseStore, AuditService auditService) {
        this.caseStore = caseStore;
        this.auditService = auditService;
    }

    /**
     * Firm members see the firm's cases plus any case assigned to them; solo lawyers see
     * only their assigned cases. Soft-deleted cases are always excluded.
     */
    public Criteria scopeCriteria(User user) {
        Criteria notDeleted = Criteria.where("deletedAt").is(null);
        if (user.isSoloLawyer()) {
            return new Criteria().andOperator(Criteria.where("lawyerId").is(user.getId()), notDeleted);
        }
        return new Criteria().andOperator(
            new Criteria().orOperator(
                Criteria.where("firmId").is(user.getFirmId()),
                Criteria.where("lawyerId").is(user.getId())
            ),
            notDeleted
        );
    }

    public boolean hasAccess(User user, CaseRecord record) {
        if (user == null || record == null) {
            return false;
        }
        boolean assigned = record.getLawyerId() != null && record.getLawyerId().equals(user.getId());
        if (user.isSoloLawyer()) {
            return assigned;
        }
        boolean sameFirm = record.getFirmId() != null && record.getFirmId().equals(user.getFirmId());
        return sameFirm || assigned;
    }

    public static boolean isValidId(String id) {
        return id != null && ObjectId.isValid(id);
    }

    /**
     * Validates the id, loads the case and checks ownership, in that order.
     */
    public CaseRecord requireAccessibleCase(String caseId, User user) {
        if (!isValidId(caseId)) {
            throw CaseworkException.invalidId();
        }
        CaseRecord record = caseStore.findActive(caseId).orElseThrow(CaseworkException::caseNotFound);
        if (!hasAccess(user, record)) {
            log.warn("Access denied to case {} for user {}", caseId, user != null ? user.getId() : "ANONYMOUS");
            try {
                auditService.logAccessDenied(user, "CASE", caseId, "Caller is outside the case's firm and not the assigned lawyer");
            } catch (RuntimeException e) {
                log.warn("Audit log error for denied access to case {}: {}", caseId, e.getMessage());
            }
            throw concealForeignCases ? CaseworkException.caseNotFound() : CaseworkException.caseForbidden();
        }
        return record;
    }
}
