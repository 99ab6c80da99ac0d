package com.relaybox.adapter.out.persistence;

import com.relaybox.application.port.out.TokenPoolRepository;
import com.relaybox.domain.queue.QueueToken;
import com.relaybox.infrastructure.exception.LeaseLostException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static com.relaybox.adapter.out.persistence.JdbcSupport.instant;
import static com.relaybox.adapter.out.persistence.JdbcSupport.placeholders;
import static com.relaybox.adapter.out.persistence.JdbcSupport.timestamp;
import static com.relaybox.adapter.out.persistence.JdbcSupport.uuid;

@Repository
public class JdbcTokenPoolRepository implements TokenPoolRepository {

    private static final RowMapper<QueueToken> ROW_MAPPER = (rs, rowNum) -> new QueueToken(
        uuid(rs, "id"),
        rs.getString("queue_name"),
        rs.getString("workspace_id"),
        rs.getString("leased_by"),
        instant(rs, "leased_at"),
        instant(rs, "leased_until"),
        instant(rs, "next_process_after")
    );

    private final JdbcTemplate jdbc;

    public JdbcTokenPoolRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Pairs are ordered by their oldest due message, so a workspace with one waiting
     * message competes on age, not on backlog size. A concurrent lease of the same pair
     * loses on the unique (queue, workspace) key; an expired token row is taken over.
     */
    @Override
    public List<QueueToken> leaseTokens(Collection<String> queueNames, String leasedBy,
                                        Instant now, Instant leasedUntil, int limit) {
        if (queueNames.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        params.add(timestamp(now));
        params.add(timestamp(now));
        params.addAll(queueNames);
        params.add(timestamp(now));
        params.add(limit);
        params.add(timestamp(now));
        params.add(leasedBy);
        params.add(timestamp(leasedUntil));
        params.add(timestamp(now));
        params.add(timestamp(now));

        return jdbc.query(
            """
            WITH available_pairs AS (
                SELECT queue_name, workspace_id, MIN(process_after) AS next_process_after
                FROM queue_messages
                WHERE process_after <= ?
                  AND completed_at IS NULL
                  AND dlq_at IS NULL
                  AND (claimed_until IS NULL OR claimed_until < ?)
                  AND queue_name IN (%s)
                GROUP BY queue_name, workspace_id
            ),
            selected_pairs AS (
                SELECT ap.queue_name, ap.workspace_id, ap.next_process_after
                FROM available_pairs ap
                LEFT JOIN queue_tokens qt
                  ON qt.queue_name = ap.queue_name
                 AND qt.workspace_id = ap.workspace_id
                 AND qt.leased_until > ?
                WHERE qt.id IS NULL
                ORDER BY ap.next_process_after
                LIMIT ?
            )
            INSERT INTO queue_tokens (id, queue_name, workspace_id, leased_at, leased_by, leased_until, next_process_after, created_at)
            SELECT gen_random_uuid(), queue_name, workspace_id, ?, ?, ?, next_process_after, ?
            FROM selected_pairs
            ON CONFLICT (queue_name, workspace_id) DO UPDATE
            SET id = EXCLUDED.id,
                leased_at = EXCLUDED.leased_at,
                leased_by = EXCLUDED.leased_by,
                leased_until = EXCLUDED.leased_until,
                next_process_after = EXCLUDED.next_process_after
            WHERE queue_tokens.leased_until <= ?
            RETURNING id, queue_name, workspace_id, leased_by, leased_at, leased_until, next_process_after
            """.formatted(placeholders(queueNames)),
            ROW_MAPPER,
            params.toArray()
        );
    }

    @Override
    public boolean renew(UUID tokenId, String leasedBy, Instant leasedUntil) {
        return jdbc.update(
            "UPDATE queue_tokens SET leased_until = ? WHERE id = ? AND leased_by = ?",
            timestamp(leasedUntil),
            tokenId,
            leasedBy
        ) > 0;
    }

    @Override
    public void release(UUID tokenId, String leasedBy) {
        int deleted = jdbc.update("DELETE FROM queue_tokens WHERE id = ? AND leased_by = ?", tokenId, leasedBy);
        if (deleted == 0) {
            throw new LeaseLostException("Token " + tokenId + " not found or leased by another manager");
        }
    }

    @Override
    public int deleteExpired(Instant now) {
        return jdbc.update("DELETE FROM queue_tokens WHERE leased_until < ?", timestamp(now));
    }

    @Override
    public int countActive(Instant now) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM queue_tokens WHERE leased_until > ?",
            Integer.class,
            timestamp(now)
        );
        return count != null ? count : 0;
    }
}
