package com.relaybox.adapter.out.persistence;

import com.relaybox.domain.event.MessageCreated;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.domain.event.StreamArchived;
import com.relaybox.domain.event.Unrecognized;
import com.relaybox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcOutboxRepositoryTest extends PostgresTestBase {

    @Autowired
    private JdbcOutboxRepository outboxRepository;

    @Test
    void shouldAppendAndReadBackTypedPayload() {
        // Given
        MessageCreated payload = new MessageCreated("ws-1", "stream-1", "msg-1", "user-1", "hello");

        // When
        OutboxEvent appended = outboxRepository.append(payload);
        List<OutboxEvent> fetched = outboxRepository.fetchAfter(0, 10, List.of());

        // Then
        assertEquals(1, fetched.size());
        assertEquals(appended.id(), fetched.get(0).id());
        assertEquals("message:created", fetched.get(0).eventType());
        assertEquals(payload, fetched.get(0).payload());
        assertEquals("ws-1", fetched.get(0).workspaceId());
    }

    @Test
    void shouldFetchInIdOrderSkippingExcludedIds() {
        // Given
        long first = outboxRepository.append(new StreamArchived("ws-1", "s-1")).id();
        long second = outboxRepository.append(new StreamArchived("ws-1", "s-2")).id();
        long third = outboxRepository.append(new StreamArchived("ws-1", "s-3")).id();

        // When
        List<OutboxEvent> fetched = outboxRepository.fetchAfter(first, 10, List.of(second));

        // Then
        assertEquals(List.of(third), fetched.stream().map(OutboxEvent::id).toList());
        assertEquals(OptionalLong.of(third), outboxRepository.nextEventId(first, List.of(second)));
        assertEquals(third, outboxRepository.latestId());
    }

    @Test
    void shouldDecodeUnknownTypesAsUnrecognized() {
        // Given
        jdbcTemplate.update(
            "INSERT INTO outbox (event_type, workspace_id, payload) VALUES ('legacy:thing', 'ws-9', '{\"a\":1}'::jsonb)");

        // When
        OutboxEvent event = outboxRepository.fetchAfter(0, 10, List.of()).get(0);

        // Then
        Unrecognized payload = assertInstanceOf(Unrecognized.class, event.payload());
        assertEquals("legacy:thing", payload.eventType());
        assertEquals("ws-9", payload.workspaceId());
    }

    @Test
    void shouldOnlyDeleteEventsAtOrBelowWatermark() {
        // Given
        long first = outboxRepository.append(new StreamArchived("ws-1", "s-1")).id();
        long second = outboxRepository.append(new StreamArchived("ws-1", "s-2")).id();
        outboxRepository.append(new StreamArchived("ws-1", "s-3"));

        // When
        int deleted = outboxRepository.deleteRetained(second, Instant.now().plusSeconds(60), 100);

        // Then
        assertEquals(2, deleted);
        assertEquals(1, outboxRepository.count());
        assertTrue(outboxRepository.fetchAfter(0, 10, List.of()).stream().noneMatch(e -> e.id() == first));
    }

    @Test
    void shouldKeepRecentEventsEvenBelowWatermark() {
        // Given
        long id = outboxRepository.append(new StreamArchived("ws-1", "s-1")).id();

        // When
        int deleted = outboxRepository.deleteRetained(id, Instant.now().minusSeconds(3600), 100);

        // Then
        assertEquals(0, deleted);
        assertEquals(1, outboxRepository.count());
    }
}
