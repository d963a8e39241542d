package com.jreinhal.caseflow.casework;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.service.AuditService;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;

class CaseAccessPolicyTest {
    private CaseStore caseStore;
    private AuditService auditService;
    private CaseAccessPolicy policy;

    @BeforeEach
    void setUp() {
        caseStore = mock(CaseStore.class);
        auditService = mock(AuditService.class);
        policy = new CaseAccessPolicy(caseStore, auditService);
    }

    @Test
    void firmMemberSeesFirmCasesAndAssignedCases() {
        CaseRecord firmCase = CaseFixtures.openCase(CaseCategory.CIVIL, "filing");
        firmCase.setLawyerId(CaseFixtures.LAWYER_ID);
        CaseRecord assignedElsewhere = CaseFixtures.openCase(CaseCategory.CIVIL, "filing");
        assignedElsewhere.setFirmId(CaseFixtures.OTHER_FIRM_ID);
        assignedElsewhere.setLawyerId(CaseFixtures.COLLEAGUE_ID);

        assertThat(policy.hasAccess(CaseFixtures.colleague(), firmCase)).isTrue();
        assertThat(policy.hasAccess(CaseFixtures.colleague(), assignedElsewhere)).isTrue();
        assertThat(policy.hasAccess(CaseFixtures.outsider(), firmCase)).isFalse();
        assertThat(policy.hasAccess(null, firmCase)).isFalse();
    }

    @Test
    void soloLawyerOnlySeesAssignedCases() {
        User solo = new User(CaseFixtures.LAWYER_ID, "solo", null);
        CaseRecord assigned = CaseFixtures.openCase(CaseCategory.CIVIL, "filing");
        CaseRecord firmOnly = CaseFixtures.openCase(CaseCategory.CIVIL, "filing");
        firmOnly.setFirmId(null);
        firmOnly.setLawyerId(CaseFixtures.COLLEAGUE_ID);

        assertThat(policy.hasAccess(solo, assigned)).isTrue();
        assertThat(policy.hasAccess(solo, firmOnly)).isFalse();
    }

    @Test
    void scopeCriteriaMatchesTenantModel() {
        String firmScope = new Query(policy.scopeCriteria(CaseFixtures.lawyer())).getQueryObject().toJson();
        String soloScope = new Query(policy.scopeCriteria(new User(CaseFixtures.LAWYER_ID, "solo", ""))).getQueryObject().toJson();

        assertThat(firmScope).contains("$or").contains(CaseFixtures.FIRM_ID).contains(CaseFixtures.LAWYER_ID).contains("deletedAt");
        assertThat(soloScope).doesNotContain("firmId").contains(CaseFixtures.LAWYER_ID).contains("deletedAt");
    }

    @Test
    void malformedIdIsRejectedBeforeLookup() {
        assertThatThrownBy(() -> policy.requireAccessibleCase("123", CaseFixtures.lawyer()))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_ID");
        verifyNoInteractions(caseStore);
    }

    @Test
    void missingCaseIsNotFound() {
        when(caseStore.findActive(CaseFixtures.CASE_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> policy.requireAccessibleCase(CaseFixtures.CASE_ID, CaseFixtures.lawyer()))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("code", "CASE_NOT_FOUND");
        verifyNoInteractions(auditService);
    }

    @Test
    void foreignCaseIsForbiddenAndAudited() {
        when(caseStore.findActive(CaseFixtures.CASE_ID)).thenReturn(Optional.of(CaseFixtures.openCase(CaseCategory.CIVIL, "filing")));
        User outsider = CaseFixtures.outsider();

        assertThatThrownBy(() -> policy.requireAccessibleCase(CaseFixtures.CASE_ID, outsider))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("kind", CaseworkException.Kind.FORBIDDEN);
        verify(auditService).logAccessDenied(eq(outsider), eq("CASE"), eq(CaseFixtures.CASE_ID), anyString());
    }

    @Test
    void foreignCaseIsConcealedWhenConfigured() {
        ReflectionTestUtils.setField(policy, "concealForeignCases", true);
        when(caseStore.findActive(CaseFixtures.CASE_ID)).thenReturn(Optional.of(CaseFixtures.openCase(CaseCategory.CIVIL, "filing")));

        assertThatThrownBy(() -> policy.requireAccessibleCase(CaseFixtures.CASE_ID, CaseFixtures.outsider()))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("code", "CASE_NOT_FOUND");
    }

    @Test
    void auditFailureStillYieldsTheAccessError() {
        when(caseStore.findActive(CaseFixtures.CASE_ID)).thenReturn(Optional.of(CaseFixtures.openCase(CaseCategory.CIVIL, "filing")));
        doThrow(new AuditService.AuditFailureException("Audit logging failed", new IllegalStateException("mongo down")))
                .when(auditService).logAccessDenied(any(), anyString(), anyString(), anyString());

        assertThatThrownBy(() -> policy.requireAccessibleCase(CaseFixtures.CASE_ID, CaseFixtures.outsider()))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("kind", CaseworkException.Kind.FORBIDDEN);

        ReflectionTestUtils.setField(policy, "concealForeignCases", true);
        assertThatThrownBy(() -> policy.requireAccessibleCase(CaseFixtures.CASE_ID, CaseFixtures.outsider()))
                .isInstanceOf(CaseworkException.class)
                .hasFieldOrPropertyWithValue("code", "CASE_NOT_FOUND");
    }
}
