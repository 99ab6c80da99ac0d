package com.relaybox.application.service;

import com.relaybox.application.port.in.AppendEventUseCase;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.domain.event.EventPayload;
import com.relaybox.domain.event.OutboxEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OutboxService implements AppendEventUseCase {

    private static final Logger log = LoggerFactory.getLogger(OutboxService.class);

    private final OutboxRepository outboxRepository;
    private final MetricsPort metrics;

    public OutboxService(OutboxRepository outboxRepository, MetricsPort metrics) {
        this.outboxRepository = outboxRepository;
        this.metrics = metrics;
    }

    /**
     * Joins the caller's transaction and refuses to run without one, so the event can
     * never be visible without the business change it announces.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(EventPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Event payload is required");
        }
        OutboxEvent event = outboxRepository.append(payload);
        metrics.incrementEventsAppended(payload.eventType());
        log.debug("Event appended: id={}, type={}, workspaceId={}", event.id(), event.eventType(), event.workspaceId());
        return event;
    }
}
