package com.relaybox.adapter.out.persistence;

import com.relaybox.application.port.out.QueueRepository;
import com.relaybox.domain.queue.QueueMessage;
import com.relaybox.infrastructure.exception.LeaseLostException;
import com.relaybox.infrastructure.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.relaybox.adapter.out.persistence.JdbcSupport.instant;
import static com.relaybox.adapter.out.persistence.JdbcSupport.placeholders;
import static com.relaybox.adapter.out.persistence.JdbcSupport.timestamp;
import static com.relaybox.adapter.out.persistence.JdbcSupport.uuid;

@Repository
public class JdbcQueueRepository implements QueueRepository {

    private static final String COLUMNS = """
        id, queue_name, workspace_id, payload, dedupe_key, process_after, inserted_at,
        claimed_by, claimed_until, claimed_count, failed_count, last_error, completed_at, dlq_at
        """;

    private static final RowMapper<QueueMessage> ROW_MAPPER = (rs, rowNum) -> new QueueMessage(
        uuid(rs, "id"),
        rs.getString("queue_name"),
        rs.getString("workspace_id"),
        rs.getString("payload"),
        rs.getString("dedupe_key"),
        instant(rs, "process_after"),
        instant(rs, "inserted_at"),
        rs.getString("claimed_by"),
        instant(rs, "claimed_until"),
        rs.getInt("claimed_count"),
        rs.getInt("failed_count"),
        rs.getString("last_error"),
        instant(rs, "completed_at"),
        instant(rs, "dlq_at")
    );

    private final JdbcTemplate jdbc;

    public JdbcQueueRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public UUID insert(NewMessage message) {
        List<UUID> inserted = jdbc.query(
            """
            INSERT INTO queue_messages (id, queue_name, workspace_id, payload, dedupe_key, process_after, inserted_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (queue_name, dedupe_key) WHERE dedupe_key IS NOT NULL DO NOTHING
            RETURNING id
            """,
            (rs, rowNum) -> uuid(rs, "id"),
            message.id(),
            message.queueName(),
            message.workspaceId(),
            message.payload(),
            message.dedupeKey(),
            timestamp(message.processAfter()),
            timestamp(message.insertedAt())
        );
        if (!inserted.isEmpty()) {
            return inserted.get(0);
        }
        return jdbc.queryForObject(
            "SELECT id FROM queue_messages WHERE queue_name = ? AND dedupe_key = ?",
            (rs, rowNum) -> uuid(rs, "id"),
            message.queueName(),
            message.dedupeKey()
        );
    }

    @Override
    public List<QueueMessage> claimBatch(String queueName, String workspaceId, String claimedBy,
                                         Instant now, Instant claimedUntil, int limit) {
        return jdbc.query(
            """
            WITH selected AS (
                SELECT id FROM queue_messages
                WHERE queue_name = ?
                  AND workspace_id = ?
                  AND process_after <= ?
                  AND completed_at IS NULL
                  AND dlq_at IS NULL
                  AND (claimed_until IS NULL OR claimed_until < ?)
                ORDER BY process_after
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            UPDATE queue_messages m
            SET claimed_at = ?, claimed_by = ?, claimed_until = ?, claimed_count = m.claimed_count + 1
            FROM selected
            WHERE m.id = selected.id
            RETURNING m.id, m.queue_name, m.workspace_id, m.payload, m.dedupe_key, m.process_after,
                      m.inserted_at, m.claimed_by, m.claimed_until, m.claimed_count, m.failed_count,
                      m.last_error, m.completed_at, m.dlq_at
            """,
            ROW_MAPPER,
            queueName,
            workspaceId,
            timestamp(now),
            timestamp(now),
            limit,
            timestamp(now),
            claimedBy,
            timestamp(claimedUntil)
        );
    }

    @Override
    public int renewClaims(Collection<UUID> messageIds, String claimedBy, Instant claimedUntil) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        List<Object> params = new ArrayList<>();
        params.add(timestamp(claimedUntil));
        params.add(claimedBy);
        params.addAll(messageIds);
        return jdbc.update(
            "UPDATE queue_messages SET claimed_until = ? WHERE claimed_by = ? AND completed_at IS NULL AND dlq_at IS NULL AND id IN ("
                + placeholders(messageIds) + ")",
            params.toArray()
        );
    }

    @Override
    public void complete(UUID messageId, String claimedBy, Instant completedAt) {
        int updated = jdbc.update(
            """
            UPDATE queue_messages
            SET completed_at = ?, process_after = NULL, claimed_by = NULL, claimed_until = NULL
            WHERE id = ? AND claimed_by = ? AND completed_at IS NULL
            """,
            timestamp(completedAt),
            messageId,
            claimedBy
        );
        requireOwned(updated, "complete", messageId);
    }

    @Override
    public void fail(UUID messageId, String claimedBy, String error, Instant processAfter) {
        int updated = jdbc.update(
            """
            UPDATE queue_messages
            SET failed_count = failed_count + 1, last_error = ?, process_after = ?,
                claimed_by = NULL, claimed_until = NULL
            WHERE id = ? AND claimed_by = ? AND completed_at IS NULL AND dlq_at IS NULL
            """,
            error,
            timestamp(processAfter),
            messageId,
            claimedBy
        );
        requireOwned(updated, "fail", messageId);
    }

    @Override
    public void markDeadLettered(UUID messageId, String claimedBy, String error, Instant deadLetteredAt) {
        int updated = jdbc.update(
            """
            UPDATE queue_messages
            SET dlq_at = ?, failed_count = failed_count + 1, last_error = ?, process_after = NULL,
                claimed_by = NULL, claimed_until = NULL
            WHERE id = ? AND claimed_by = ? AND completed_at IS NULL AND dlq_at IS NULL
            """,
            timestamp(deadLetteredAt),
            error,
            messageId,
            claimedBy
        );
        requireOwned(updated, "dead-letter", messageId);
    }

    @Override
    public void redrive(UUID messageId, Instant processAfter) {
        int updated = jdbc.update(
            """
            UPDATE queue_messages
            SET dlq_at = NULL, failed_count = 0, last_error = NULL, process_after = ?
            WHERE id = ? AND dlq_at IS NOT NULL
            """,
            timestamp(processAfter),
            messageId
        );
        if (updated == 0) {
            throw new NotFoundException("Dead-lettered message", messageId);
        }
    }

    @Override
    public int deleteCompletedBefore(Instant before) {
        return jdbc.update(
            "DELETE FROM queue_messages WHERE completed_at IS NOT NULL AND completed_at < ?",
            timestamp(before)
        );
    }

    @Override
    public int deleteDeadLetteredBefore(Instant before) {
        return jdbc.update(
            "DELETE FROM queue_messages WHERE dlq_at IS NOT NULL AND dlq_at < ?",
            timestamp(before)
        );
    }

    @Override
    public Optional<QueueMessage> findById(UUID messageId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM queue_messages WHERE id = ?", ROW_MAPPER, messageId)
            .stream()
            .findFirst();
    }

    @Override
    public List<QueueMessage> findDeadLettered(String queueName, int limit) {
        if (queueName == null) {
            return jdbc.query(
                "SELECT " + COLUMNS + " FROM queue_messages WHERE dlq_at IS NOT NULL ORDER BY dlq_at DESC LIMIT ?",
                ROW_MAPPER,
                limit
            );
        }
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM queue_messages WHERE dlq_at IS NOT NULL AND queue_name = ? ORDER BY dlq_at DESC LIMIT ?",
            ROW_MAPPER,
            queueName,
            limit
        );
    }

    @Override
    public int countClaimed(Instant now) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM queue_messages WHERE claimed_until > ? AND completed_at IS NULL AND dlq_at IS NULL",
            Integer.class,
            timestamp(now)
        );
        return count != null ? count : 0;
    }

    private static void requireOwned(int updated, String action, UUID messageId) {
        if (updated == 0) {
            throw new LeaseLostException("Cannot " + action + " message " + messageId + ": claim lost or already finished");
        }
    }
}
