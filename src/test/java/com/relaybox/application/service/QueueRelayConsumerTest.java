package com.relaybox.application.service;

import com.relaybox.application.port.in.QueueClient;
import com.relaybox.application.port.in.SendOptions;
import com.relaybox.domain.event.MessageCreated;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.domain.event.StreamArchived;
import com.relaybox.domain.event.Unrecognized;
import com.relaybox.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueueRelayConsumer")
class QueueRelayConsumerTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T10:00:00Z");

    @Mock
    private OutboxConsumerSupport support;

    @Mock
    private QueueClient queueClient;

    private QueueRelayConsumer consumer;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRelay().setRoutes(Map.of(
            "message:created", "message-created",
            "agent:run", "agent-runs"));
        consumer = new QueueRelayConsumer(support, queueClient, appProperties);
    }

    @Test
    @DisplayName("Should enqueue routed events for the event's workspace with an event-scoped dedupe key")
    void shouldEnqueueRoutedEvent() throws Exception {
        // Given
        MessageCreated payload = new MessageCreated("ws-1", "stream-1", "msg-1", "user-1", "hello");
        OutboxEvent event = new OutboxEvent(42, "message:created", payload, CREATED);

        // When
        consumer.handle(event);

        // Then
        ArgumentCaptor<Object> job = ArgumentCaptor.forClass(Object.class);
        verify(queueClient).send(eq("message-created"), eq("ws-1"), job.capture(),
            eq(SendOptions.dedupe("outbox:42:message-created")));
        QueueRelayConsumer.RelayedEvent relayed = assertInstanceOf(QueueRelayConsumer.RelayedEvent.class, job.getValue());
        assertEquals(42, relayed.eventId());
        assertEquals(payload, relayed.payload());
    }

    @Test
    @DisplayName("Should skip event types without a route")
    void shouldSkipUnroutedEvent() throws Exception {
        consumer.handle(new OutboxEvent(7, "stream:archived", new StreamArchived("ws-1", "stream-1"), CREATED));

        verifyNoInteractions(queueClient);
    }

    @Test
    @DisplayName("Should relay unrecognized payloads under the system workspace when none is known")
    void shouldRelayUnrecognizedPayload() throws Exception {
        // Given
        Unrecognized payload = new Unrecognized("agent:run", null, "{\"sessionId\":\"s-1\"}");

        // When
        consumer.handle(new OutboxEvent(9, "agent:run", payload, CREATED));

        // Then
        verify(queueClient).send(eq("agent-runs"), eq("system"), any(), eq(SendOptions.dedupe("outbox:9:agent-runs")));
    }

    @Test
    @DisplayName("Should use a stable consumer id")
    void shouldExposeConsumerId() {
        assertEquals("queue-relay", consumer.consumerId());
    }
}
