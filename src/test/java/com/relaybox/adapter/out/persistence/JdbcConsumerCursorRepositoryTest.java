package com.relaybox.adapter.out.persistence;

import com.relaybox.domain.cursor.ClaimedCursor;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.CursorState;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.cursor.ProcessedIds;
import com.relaybox.domain.event.StreamArchived;
import com.relaybox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcConsumerCursorRepositoryTest extends PostgresTestBase {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @Autowired
    private JdbcConsumerCursorRepository cursorRepository;

    @Autowired
    private JdbcOutboxRepository outboxRepository;

    private Optional<ClaimedCursor> claim(String owner, Instant now) {
        return cursorRepository.tryClaim("billing", owner, now, now.plusSeconds(10), now.plusMillis(100));
    }

    @Test
    void shouldNotMoveExistingCursorOnEnsure() {
        // Given
        cursorRepository.ensure("billing", 0);
        String owner = "run_1";
        claim(owner, NOW);
        cursorRepository.saveProgress("billing", owner, CursorState.at(7), NOW);

        // When
        cursorRepository.ensure("billing", 0);
        cursorRepository.ensureFromLatest("billing");

        // Then
        assertEquals(7, cursorRepository.findById("billing").orElseThrow().cursor());
    }

    @Test
    void shouldStartNewConsumerAtLatestEvent() {
        // Given
        outboxRepository.append(new StreamArchived("ws-1", "s-1"));
        long latest = outboxRepository.append(new StreamArchived("ws-1", "s-2")).id();

        // When
        cursorRepository.ensureFromLatest("analytics");

        // Then
        assertEquals(latest, cursorRepository.findById("analytics").orElseThrow().cursor());
    }

    @Test
    void shouldGrantLockToOneOwnerAtATime() {
        // Given
        cursorRepository.ensure("billing", 0);

        // When
        Optional<ClaimedCursor> first = claim("run_1", NOW);
        Optional<ClaimedCursor> second = claim("run_2", NOW.plusSeconds(1));

        // Then
        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, cursorRepository.countHeldLocks(NOW.plusSeconds(1)));
    }

    @Test
    void shouldLetAnotherOwnerTakeOverAnExpiredLock() {
        // Given
        cursorRepository.ensure("billing", 0);
        claim("run_1", NOW);

        // When
        Optional<ClaimedCursor> takeover = claim("run_2", NOW.plusSeconds(11));

        // Then
        assertTrue(takeover.isPresent());
        assertFalse(cursorRepository.refresh("billing", "run_1", NOW.plusSeconds(20), NOW.plusSeconds(11)));
        assertFalse(cursorRepository.saveProgress("billing", "run_1", CursorState.at(3), NOW.plusSeconds(11)));
        assertEquals("run_2", cursorRepository.findById("billing").orElseThrow().lockOwner());
    }

    @Test
    void shouldRefuseClaimWhileBackingOff() {
        // Given
        cursorRepository.ensure("billing", 0);
        claim("run_1", NOW);
        cursorRepository.recordRetry("billing", "run_1", 1, NOW.plusSeconds(30), "timeout", NOW);
        cursorRepository.release("billing", "run_1", NOW);

        // When / Then
        assertTrue(claim("run_2", NOW.plusSeconds(5)).isEmpty());
        Optional<ClaimedCursor> afterBackoff = claim("run_2", NOW.plusSeconds(31));
        assertTrue(afterBackoff.isPresent());
        assertEquals(1, afterBackoff.get().retryCount());
    }

    @Test
    void shouldPersistProcessedIdsAndClearRetryState() {
        // Given
        cursorRepository.ensure("billing", 0);
        claim("run_1", NOW);
        cursorRepository.recordRetry("billing", "run_1", 2, NOW, "boom", NOW);
        CursorState state = new CursorState(5, ProcessedIds.of(Map.of(7L, NOW, 9L, NOW.plusMillis(5))));

        // When
        assertTrue(cursorRepository.saveProgress("billing", "run_1", state, NOW));
        cursorRepository.release("billing", "run_1", NOW);

        // Then
        ConsumerCursor cursor = cursorRepository.findById("billing").orElseThrow();
        assertEquals(5, cursor.cursor());
        assertEquals(List.of(7L, 9L), cursor.processedIds().ids());
        assertEquals(0, cursor.retryCount());
        assertNull(cursor.lastError());
        assertFalse(cursor.isLocked(NOW));
        ClaimedCursor reclaimed = claim("run_2", NOW).orElseThrow();
        assertEquals(state.processedIds().asMap(), reclaimed.state().processedIds().asMap());
    }

    @Test
    void shouldListDeadLettersWithEventType() {
        // Given
        long eventId = outboxRepository.append(new StreamArchived("ws-1", "s-1")).id();
        cursorRepository.ensure("billing", 0);

        // When
        cursorRepository.insertDeadLetter("billing", eventId, "bad payload", NOW);
        cursorRepository.insertDeadLetter("billing", eventId, "again", NOW);

        // Then
        List<DeadLetter> deadLetters = cursorRepository.findDeadLetters("billing", 10);
        assertEquals(1, deadLetters.size());
        assertEquals("stream:archived", deadLetters.get(0).eventType());
        assertEquals("bad payload", deadLetters.get(0).error());
    }

    @Test
    void shouldReportNoWatermarkUntilEveryConsumerExists() {
        // Given
        cursorRepository.ensure("billing", 12);

        // When / Then
        assertEquals(OptionalLong.empty(), cursorRepository.findRetentionWatermark(List.of("billing", "search")));
        cursorRepository.ensure("search", 4);
        assertEquals(OptionalLong.of(4), cursorRepository.findRetentionWatermark(List.of("billing", "search")));
    }
}
