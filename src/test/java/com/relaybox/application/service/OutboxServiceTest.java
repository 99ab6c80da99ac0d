package com.relaybox.application.service;

import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.domain.event.ReactionAdded;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxService")
class OutboxServiceTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private MetricsPort metrics;

    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        outboxService = new OutboxService(outboxRepository, metrics);
    }

    @Test
    @DisplayName("Should append the event and count it by type")
    void shouldAppendEvent() {
        // Given
        ReactionAdded payload = new ReactionAdded("ws-1", "stream-1", "msg-1", "user-1", ":+1:");
        OutboxEvent stored = new OutboxEvent(12, "reaction:added", payload, Instant.now());
        when(outboxRepository.append(payload)).thenReturn(stored);

        // When
        OutboxEvent result = outboxService.append(payload);

        // Then
        assertEquals(12, result.id());
        verify(metrics).incrementEventsAppended("reaction:added");
    }

    @Test
    @DisplayName("Should reject a null payload")
    void shouldRejectNullPayload() {
        assertThrows(IllegalArgumentException.class, () -> outboxService.append(null));
        verifyNoInteractions(outboxRepository);
    }
}
