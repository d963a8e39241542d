package com.jreinhal.caseflow.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.caseflow.filter.CorrelationIdFilter;
import com.jreinhal.caseflow.model.AuditEvent;
import com.jreinhal.caseflow.model.User;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.util.ReflectionTestUtils;

class AuditServiceTest {
    private static final String CASE_ID = "65a000000000000000000001";

    private MongoTemplate mongoTemplate;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        auditService = new AuditService(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        MDC.remove(CorrelationIdFilter.MDC_KEY);
    }

    @Test
    void caseUpdateCarriesActorResourceAndCorrelationId() {
        MDC.put(CorrelationIdFilter.MDC_KEY, "req-42");
        User actor = new User("5f00000000000000000000a1", "lawyer", "5f0000000000000000000001");

        auditService.logCaseUpdate(CASE_ID, actor, "stage_change", Map.of("oldStage", "filing", "newStage", "appeal"));

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(mongoTemplate).save(event.capture(), eq("audit_log"));
        assertEquals(AuditEvent.EventType.CASE_UPDATED, event.getValue().getEventType());
        assertEquals("stage_change", event.getValue().getAction());
        assertEquals("CASE", event.getValue().getResourceType());
        assertEquals(CASE_ID, event.getValue().getResourceId());
        assertEquals("5f0000000000000000000001", event.getValue().getFirmId());
        assertEquals("req-42", event.getValue().getCorrelationId());
        assertEquals("appeal", event.getValue().getMetadata().get("newStage"));
    }

    @Test
    void authFailureRecordsForwardedClientIp() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/cases/pipeline");
        request.addHeader("X-Forwarded-For", "10.0.0.7, 10.0.0.1");

        auditService.logAuthFailure("No valid gateway identity", request);

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(mongoTemplate).save(event.capture(), eq("audit_log"));
        assertEquals(AuditEvent.Outcome.FAILURE, event.getValue().getOutcome());
        assertEquals("10.0.0.7", event.getValue().getMetadata().get("sourceIp"));
        assertEquals("/api/cases/pipeline", event.getValue().getResourceId());
    }

    @Test
    void accessDeniedHandlesMissingUser() {
        auditService.logAccessDenied(null, "CASE", CASE_ID, "outside firm");

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(mongoTemplate).save(event.capture(), eq("audit_log"));
        assertEquals("ANONYMOUS", event.getValue().getUserId());
        assertEquals(AuditEvent.Outcome.DENIED, event.getValue().getOutcome());
    }

    @Test
    void persistenceFailureIsSwallowedUnlessFailClosed() {
        when(mongoTemplate.save(any(AuditEvent.class), eq("audit_log"))).thenThrow(new IllegalStateException("mongo down"));

        assertDoesNotThrow(() -> auditService.logCaseUpdate(CASE_ID, null, "case_ended", Map.of()));

        ReflectionTestUtils.setField(auditService, "failClosed", true);
        assertThrows(AuditService.AuditFailureException.class,
                () -> auditService.logCaseUpdate(CASE_ID, null, "case_ended", Map.of()));
    }
}
