package com.relaybox.adapter.in.web;

import com.relaybox.application.port.in.InspectRelayUseCase;
import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.cursor.ProcessedIds;
import com.relaybox.domain.queue.QueueMessage;
import com.relaybox.infrastructure.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(OpsController.class)
class OpsControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InspectRelayUseCase inspectRelayUseCase;

    @MockBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(NOW);
    }

    @Test
    void shouldListConsumers() throws Exception {
        ConsumerCursor cursor = new ConsumerCursor("queue-relay", 41,
            ProcessedIds.of(Map.of(43L, NOW.minusMillis(200))), 1, NOW.plusSeconds(2), "timeout",
            NOW.plusSeconds(5), "run_1", NOW.minusSeconds(1), NOW);
        when(inspectRelayUseCase.listConsumers()).thenReturn(List.of(cursor));

        mockMvc.perform(get("/api/v1/ops/consumers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].consumerId").value("queue-relay"))
            .andExpect(jsonPath("$[0].cursor").value(41))
            .andExpect(jsonPath("$[0].pendingIds[0]").value(43))
            .andExpect(jsonPath("$[0].retryCount").value(1))
            .andExpect(jsonPath("$[0].locked").value(true));
    }

    @Test
    void shouldReturnNotFoundForUnknownConsumer() throws Exception {
        when(inspectRelayUseCase.getConsumer("ghost")).thenThrow(new NotFoundException("Consumer", "ghost"));

        mockMvc.perform(get("/api/v1/ops/consumers/ghost").header("X-Request-Id", "req-42"))
            .andExpect(status().isNotFound())
            .andExpect(header().string("X-Request-Id", "req-42"))
            .andExpect(jsonPath("$.error").value("NOT_FOUND"))
            .andExpect(jsonPath("$.requestId").value("req-42"));
    }

    @Test
    void shouldListConsumerDeadLettersWithDefaultLimit() throws Exception {
        when(inspectRelayUseCase.listConsumerDeadLetters("queue-relay", 50))
            .thenReturn(List.of(new DeadLetter("queue-relay", 9, "message:created", "boom", NOW)));

        mockMvc.perform(get("/api/v1/ops/consumers/queue-relay/dead-letters"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].eventId").value(9))
            .andExpect(jsonPath("$[0].error").value("boom"));
    }

    @Test
    void shouldRejectLimitOutOfRange() throws Exception {
        when(inspectRelayUseCase.listQueueDeadLetters(isNull(), eq(1000)))
            .thenThrow(new IllegalArgumentException("limit must be between 1 and 500"));

        mockMvc.perform(get("/api/v1/ops/queues/dead-letters").param("limit", "1000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.requestId", notNullValue()));
    }

    @Test
    void shouldShowDeadLetteredMessage() throws Exception {
        UUID id = UUID.randomUUID();
        QueueMessage message = new QueueMessage(id, "emails", "ws-1", "{}", null, NOW, NOW,
            null, null, 5, 5, "bounced", null, NOW);
        when(inspectRelayUseCase.getMessage(id)).thenReturn(message);

        mockMvc.perform(get("/api/v1/ops/queues/messages/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEAD_LETTERED"))
            .andExpect(jsonPath("$.lastError").value("bounced"));
    }

    @Test
    void shouldRejectMalformedMessageId() throws Exception {
        mockMvc.perform(get("/api/v1/ops/queues/messages/not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldRedriveMessage() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(post("/api/v1/ops/queues/messages/{id}/redrive", id))
            .andExpect(status().isNoContent());

        verify(inspectRelayUseCase).redrive(id);
    }

    @Test
    void shouldDisableAndDeleteSchedule() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(post("/api/v1/ops/schedules/{id}/disable", id))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/ops/schedules/{id}", id))
            .andExpect(status().isNoContent());

        verify(inspectRelayUseCase).disableSchedule(id);
        verify(inspectRelayUseCase).deleteSchedule(id);
    }

    @Test
    void shouldReportDispatcherState() throws Exception {
        when(inspectRelayUseCase.dispatcherState()).thenReturn(NotificationSource.State.LISTENING);

        mockMvc.perform(get("/api/v1/ops/dispatcher"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("LISTENING"));
    }

    @Test
    void shouldHideInternalErrors() throws Exception {
        when(inspectRelayUseCase.listSchedules()).thenThrow(new IllegalStateException("pool exhausted"));

        mockMvc.perform(get("/api/v1/ops/schedules"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
