package com.relaybox.adapter.out.persistence;

import com.relaybox.application.port.out.QueueRepository.NewMessage;
import com.relaybox.domain.queue.QueueToken;
import com.relaybox.infrastructure.exception.LeaseLostException;
import com.relaybox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcTokenPoolRepositoryTest extends PostgresTestBase {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @Autowired
    private JdbcTokenPoolRepository tokenPoolRepository;

    @Autowired
    private JdbcQueueRepository queueRepository;

    private void send(String queue, String workspace, Instant processAfter) {
        queueRepository.insert(new NewMessage(UUID.randomUUID(), queue, workspace, "{}", null, processAfter, NOW));
    }

    @Test
    void shouldLeaseOneTokenPerWorkspaceRegardlessOfBacklog() {
        // Given
        for (int i = 0; i < 1000; i++) {
            send("emails", "ws-a", NOW.minusSeconds(30));
        }
        send("emails", "ws-b", NOW.minusSeconds(1));

        // When
        List<QueueToken> tokens = tokenPoolRepository.leaseTokens(Set.of("emails"), "mgr_1", NOW, NOW.plusSeconds(10), 5);

        // Then
        assertEquals(Set.of("ws-a", "ws-b"), tokens.stream().map(QueueToken::workspaceId).collect(Collectors.toSet()));
    }

    @Test
    void shouldLeaseOldestDueWorkFirst() {
        // Given
        send("emails", "ws-a", NOW.minusSeconds(5));
        send("emails", "ws-b", NOW.minusSeconds(50));

        // When
        List<QueueToken> tokens = tokenPoolRepository.leaseTokens(Set.of("emails"), "mgr_1", NOW, NOW.plusSeconds(10), 1);

        // Then
        assertEquals(1, tokens.size());
        assertEquals("ws-b", tokens.get(0).workspaceId());
    }

    @Test
    void shouldNotLeaseAPairTwiceWhileTheTokenIsActive() {
        // Given
        send("emails", "ws-a", NOW.minusSeconds(1));
        send("reports", "ws-a", NOW.minusSeconds(1));
        send("emails", "ws-c", NOW.plusSeconds(60));
        tokenPoolRepository.leaseTokens(Set.of("emails"), "mgr_1", NOW, NOW.plusSeconds(10), 5);

        // When
        List<QueueToken> second = tokenPoolRepository.leaseTokens(Set.of("emails", "reports"), "mgr_2", NOW, NOW.plusSeconds(10), 5);

        // Then
        assertEquals(1, second.size());
        assertEquals("reports", second.get(0).queueName());
        assertEquals(2, tokenPoolRepository.countActive(NOW));
    }

    @Test
    void shouldTakeOverAnExpiredToken() {
        // Given
        send("emails", "ws-a", NOW.minusSeconds(1));
        QueueToken first = tokenPoolRepository.leaseTokens(Set.of("emails"), "mgr_1", NOW, NOW.plusSeconds(10), 5).get(0);

        // When
        List<QueueToken> takeover = tokenPoolRepository.leaseTokens(
            Set.of("emails"), "mgr_2", NOW.plusSeconds(11), NOW.plusSeconds(21), 5);

        // Then
        assertEquals(1, takeover.size());
        assertEquals("mgr_2", takeover.get(0).leasedBy());
        assertFalse(tokenPoolRepository.renew(first.id(), "mgr_1", NOW.plusSeconds(30)));
        assertThrows(LeaseLostException.class, () -> tokenPoolRepository.release(first.id(), "mgr_1"));
        tokenPoolRepository.release(takeover.get(0).id(), "mgr_2");
        assertEquals(0, tokenPoolRepository.countActive(NOW.plusSeconds(12)));
    }

    @Test
    void shouldDeleteExpiredTokens() {
        // Given
        send("emails", "ws-a", NOW.minusSeconds(1));
        tokenPoolRepository.leaseTokens(Set.of("emails"), "mgr_1", NOW, NOW.plusSeconds(10), 5);

        // When / Then
        assertEquals(0, tokenPoolRepository.deleteExpired(NOW.plusSeconds(5)));
        assertEquals(1, tokenPoolRepository.deleteExpired(NOW.plusSeconds(11)));
    }
}
