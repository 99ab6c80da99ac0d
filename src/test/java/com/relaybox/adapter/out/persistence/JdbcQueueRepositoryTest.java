package com.relaybox.adapter.out.persistence;

import com.relaybox.application.port.out.QueueRepository.NewMessage;
import com.relaybox.domain.queue.MessageStatus;
import com.relaybox.domain.queue.QueueMessage;
import com.relaybox.infrastructure.exception.LeaseLostException;
import com.relaybox.infrastructure.exception.NotFoundException;
import com.relaybox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcQueueRepositoryTest extends PostgresTestBase {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @Autowired
    private JdbcQueueRepository queueRepository;

    private UUID send(String queue, String workspace, String dedupeKey, Instant processAfter) {
        return queueRepository.insert(new NewMessage(
            UUID.randomUUID(), queue, workspace, "{\"n\":1}", dedupeKey, processAfter, NOW));
    }

    @Test
    void shouldReturnOriginalIdForDuplicateDedupeKey() {
        // Given
        UUID original = send("emails", "ws-1", "welcome:u-1", NOW);

        // When
        UUID duplicate = send("emails", "ws-1", "welcome:u-1", NOW);
        UUID otherQueue = send("sms", "ws-1", "welcome:u-1", NOW);

        // Then
        assertEquals(original, duplicate);
        assertNotEquals(original, otherQueue);
        assertEquals(2, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM queue_messages", Integer.class));
    }

    @Test
    void shouldClaimOnlyDueMessagesOfOneWorkspace() {
        // Given
        UUID due = send("emails", "ws-1", null, NOW.minusSeconds(1));
        send("emails", "ws-1", null, NOW.plusSeconds(60));
        send("emails", "ws-2", null, NOW.minusSeconds(1));

        // When
        List<QueueMessage> claimed = queueRepository.claimBatch("emails", "ws-1", "wkr_1", NOW, NOW.plusSeconds(10), 10);

        // Then
        assertEquals(1, claimed.size());
        assertEquals(due, claimed.get(0).id());
        assertEquals(1, claimed.get(0).claimedCount());
        assertEquals(MessageStatus.CLAIMED, claimed.get(0).status(NOW));
        assertTrue(queueRepository.claimBatch("emails", "ws-1", "wkr_2", NOW, NOW.plusSeconds(10), 10).isEmpty());
    }

    @Test
    void shouldGiveEachMessageToExactlyOneConcurrentClaimer() throws Exception {
        // Given
        for (int i = 0; i < 50; i++) {
            send("emails", "ws-1", null, NOW.minusSeconds(1));
        }
        int claimers = 5;
        ExecutorService pool = Executors.newFixedThreadPool(claimers);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<List<QueueMessage>>> tasks = new ArrayList<>();
        for (int i = 0; i < claimers; i++) {
            String worker = "wkr_" + i;
            tasks.add(() -> {
                start.await();
                return queueRepository.claimBatch("emails", "ws-1", worker, NOW, NOW.plusSeconds(10), 20);
            });
        }

        // When
        List<Future<List<QueueMessage>>> futures = new ArrayList<>();
        for (Callable<List<QueueMessage>> task : tasks) {
            futures.add(pool.submit(task));
        }
        start.countDown();
        List<UUID> all = new ArrayList<>();
        for (Future<List<QueueMessage>> future : futures) {
            future.get().forEach(m -> all.add(m.id()));
        }
        pool.shutdown();

        // Then
        Set<UUID> unique = new HashSet<>(all);
        assertEquals(all.size(), unique.size());
        assertEquals(50, unique.size());
    }

    @Test
    void shouldReclaimAfterClaimExpires() {
        // Given
        UUID id = send("emails", "ws-1", null, NOW.minusSeconds(1));
        queueRepository.claimBatch("emails", "ws-1", "wkr_1", NOW, NOW.plusSeconds(10), 10);

        // When
        List<QueueMessage> reclaimed = queueRepository.claimBatch(
            "emails", "ws-1", "wkr_2", NOW.plusSeconds(11), NOW.plusSeconds(21), 10);

        // Then
        assertEquals(1, reclaimed.size());
        assertEquals(2, reclaimed.get(0).claimedCount());
        assertThrows(LeaseLostException.class, () -> queueRepository.complete(id, "wkr_1", NOW.plusSeconds(12)));
        queueRepository.complete(id, "wkr_2", NOW.plusSeconds(12));
        assertEquals(MessageStatus.COMPLETED, queueRepository.findById(id).orElseThrow().status(NOW.plusSeconds(12)));
    }

    @Test
    void shouldRescheduleOnFailureAndRedriveAfterDeadLetter() {
        // Given
        UUID id = send("emails", "ws-1", null, NOW.minusSeconds(1));
        queueRepository.claimBatch("emails", "ws-1", "wkr_1", NOW, NOW.plusSeconds(10), 10);
        queueRepository.fail(id, "wkr_1", "smtp down", NOW.plusSeconds(5));
        assertTrue(queueRepository.claimBatch("emails", "ws-1", "wkr_2", NOW.plusSeconds(1), NOW.plusSeconds(11), 10).isEmpty());
        queueRepository.claimBatch("emails", "ws-1", "wkr_2", NOW.plusSeconds(6), NOW.plusSeconds(16), 10);

        // When
        queueRepository.markDeadLettered(id, "wkr_2", "bounced", NOW.plusSeconds(7));

        // Then
        QueueMessage dead = queueRepository.findById(id).orElseThrow();
        assertEquals(MessageStatus.DEAD_LETTERED, dead.status(NOW.plusSeconds(7)));
        assertEquals(2, dead.failedCount());
        assertEquals("bounced", dead.lastError());
        assertEquals(List.of(id), queueRepository.findDeadLettered("emails", 10).stream().map(QueueMessage::id).toList());
        assertTrue(queueRepository.claimBatch("emails", "ws-1", "wkr_3", NOW.plusSeconds(60), NOW.plusSeconds(70), 10).isEmpty());

        queueRepository.redrive(id, NOW.plusSeconds(8));
        QueueMessage redriven = queueRepository.findById(id).orElseThrow();
        assertEquals(MessageStatus.PENDING, redriven.status(NOW.plusSeconds(8)));
        assertEquals(0, redriven.failedCount());
        assertEquals(1, queueRepository.claimBatch("emails", "ws-1", "wkr_3", NOW.plusSeconds(9), NOW.plusSeconds(19), 10).size());
    }

    @Test
    void shouldRejectRedriveOfLiveMessage() {
        UUID id = send("emails", "ws-1", null, NOW);

        assertThrows(NotFoundException.class, () -> queueRepository.redrive(id, NOW));
    }

    @Test
    void shouldDeleteOnlyOldTerminalMessages() {
        // Given
        UUID done = send("emails", "ws-1", null, NOW.minusSeconds(2));
        send("emails", "ws-1", null, NOW.minusSeconds(1));
        queueRepository.claimBatch("emails", "ws-1", "wkr_1", NOW, NOW.plusSeconds(10), 1);
        queueRepository.complete(done, "wkr_1", NOW);

        // When
        int deleted = queueRepository.deleteCompletedBefore(NOW.plusSeconds(1));

        // Then
        assertEquals(1, deleted);
        assertTrue(queueRepository.findById(done).isEmpty());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM queue_messages", Integer.class));
    }
}
