package com.jreinhal.caseflow.casework.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes pipeline events once the case write has succeeded. A failing listener is
 * logged and never reaches the command's caller.
 */
@Component
public class CaseEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CaseEventDispatcher.class);
    private final ApplicationEventPublisher publisher;

    public CaseEventDispatcher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void dispatch(CasePipelineEvent event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Pipeline event {} for case {} was not fully handled: {}", event.action(), event.caseId(), e.getMessage());
        }
    }
}
