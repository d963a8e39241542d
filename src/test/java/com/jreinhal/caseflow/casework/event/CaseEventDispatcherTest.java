package com.jreinhal.caseflow.casework.event;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.jreinhal.caseflow.casework.CaseFixtures;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

class CaseEventDispatcherTest {

    @Test
    void publishesEvent() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        CaseStageChangedEvent event = new CaseStageChangedEvent(CaseFixtures.CASE_ID, CaseFixtures.lawyer(), "filing", "appeal", null, Instant.EPOCH);

        new CaseEventDispatcher(publisher).dispatch(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void listenerFailureDoesNotReachCaller() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener down")).when(publisher).publishEvent(any(Object.class));
        CaseEventDispatcher dispatcher = new CaseEventDispatcher(publisher);

        assertDoesNotThrow(() -> dispatcher.dispatch(
                new CaseStageChangedEvent(CaseFixtures.CASE_ID, CaseFixtures.lawyer(), "filing", "appeal", null, Instant.EPOCH)));
    }
}
