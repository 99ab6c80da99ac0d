package com.relaybox.application.service;

import com.relaybox.application.port.in.QueueClient;
import com.relaybox.application.port.in.SendOptions;
import com.relaybox.domain.event.EventPayload;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.domain.event.Unrecognized;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.infrastructure.config.AppProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Turns configured event types into queue jobs for the event's workspace. The dedupe key
 * ties each job to its event, so redelivering an event never enqueues twice.
 */
@Component
@ConditionalOnProperty(prefix = "app.relay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueRelayConsumer extends AbstractOutboxConsumer {

    public static final String CONSUMER_ID = "queue-relay";

    private final QueueClient queueClient;
    private final Map<String, String> routes;

    public QueueRelayConsumer(OutboxConsumerSupport support, QueueClient queueClient, AppProperties appProperties) {
        super(CONSUMER_ID, true, support);
        this.queueClient = queueClient;
        this.routes = Map.copyOf(appProperties.getRelay().getRoutes());
    }

    @Override
    protected void handle(OutboxEvent event) {
        String queueName = routes.get(event.eventType());
        if (queueName == null) {
            return;
        }
        if (event.payload() instanceof Unrecognized) {
            log.warn("Routed event has an unrecognized payload, relaying raw: eventId={}, eventType={}",
                event.id(), event.eventType());
        }
        String workspaceId = event.workspaceId() != null ? event.workspaceId() : CronSchedule.SYSTEM_WORKSPACE;
        queueClient.send(
            queueName,
            workspaceId,
            new RelayedEvent(event.id(), event.eventType(), workspaceId, event.createdAt(), event.payload()),
            SendOptions.dedupe(dedupeKey(event.id(), queueName)));
    }

    static String dedupeKey(long eventId, String queueName) {
        return "outbox:" + eventId + ":" + queueName;
    }

    /** Job payload produced for a relayed event. */
    public record RelayedEvent(
        long eventId,
        String eventType,
        String workspaceId,
        Instant createdAt,
        EventPayload payload
    ) {}
}
