package com.relaybox.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.domain.cursor.ClaimedCursor;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.CursorState;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.cursor.ProcessedIds;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

import static com.relaybox.adapter.out.persistence.JdbcSupport.instant;
import static com.relaybox.adapter.out.persistence.JdbcSupport.placeholders;
import static com.relaybox.adapter.out.persistence.JdbcSupport.timestamp;

/**
 * Cursor rows store the processed set as a JSON object of event id to ISO-8601 instant.
 */
@Repository
public class JdbcConsumerCursorRepository implements ConsumerCursorRepository {

    private static final TypeReference<Map<String, String>> PROCESSED_IDS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    private final RowMapper<ConsumerCursor> cursorMapper = (rs, rowNum) -> new ConsumerCursor(
        rs.getString("consumer_id"),
        rs.getLong("last_processed_id"),
        readProcessedIds(rs.getString("processed_ids")),
        rs.getInt("retry_count"),
        instant(rs, "retry_after"),
        rs.getString("last_error"),
        instant(rs, "locked_until"),
        rs.getString("lock_run_id"),
        instant(rs, "last_processed_at"),
        instant(rs, "updated_at")
    );

    private static final RowMapper<DeadLetter> DEAD_LETTER_MAPPER = (rs, rowNum) -> new DeadLetter(
        rs.getString("consumer_id"),
        rs.getLong("event_id"),
        rs.getString("event_type"),
        rs.getString("error"),
        instant(rs, "created_at")
    );

    public JdbcConsumerCursorRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void ensure(String consumerId, long startId) {
        jdbc.update(
            "INSERT INTO consumer_cursors (consumer_id, last_processed_id) VALUES (?, ?) ON CONFLICT (consumer_id) DO NOTHING",
            consumerId,
            startId
        );
    }

    @Override
    public void ensureFromLatest(String consumerId) {
        jdbc.update(
            """
            INSERT INTO consumer_cursors (consumer_id, last_processed_id)
            SELECT ?, COALESCE(MAX(id), 0) FROM outbox
            ON CONFLICT (consumer_id) DO NOTHING
            """,
            consumerId
        );
    }

    @Override
    public Optional<ClaimedCursor> tryClaim(String consumerId, String owner, Instant now,
                                            Instant lockedUntil, Instant expiredBefore) {
        List<ClaimedCursor> rows = jdbc.query(
            """
            UPDATE consumer_cursors
            SET locked_until = ?, lock_run_id = ?, updated_at = ?
            WHERE consumer_id = ?
              AND (locked_until IS NULL OR locked_until < ?)
              AND (retry_after IS NULL OR retry_after <= ?)
            RETURNING last_processed_id, processed_ids, retry_count
            """,
            (rs, rowNum) -> new ClaimedCursor(
                new CursorState(rs.getLong("last_processed_id"), readProcessedIds(rs.getString("processed_ids"))),
                rs.getInt("retry_count")
            ),
            timestamp(lockedUntil),
            owner,
            timestamp(now),
            consumerId,
            timestamp(expiredBefore),
            timestamp(now)
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean refresh(String consumerId, String owner, Instant lockedUntil, Instant now) {
        return jdbc.update(
            "UPDATE consumer_cursors SET locked_until = ?, updated_at = ? WHERE consumer_id = ? AND lock_run_id = ?",
            timestamp(lockedUntil),
            timestamp(now),
            consumerId,
            owner
        ) > 0;
    }

    @Override
    public boolean release(String consumerId, String owner, Instant now) {
        return jdbc.update(
            "UPDATE consumer_cursors SET locked_until = NULL, lock_run_id = NULL, updated_at = ? WHERE consumer_id = ? AND lock_run_id = ?",
            timestamp(now),
            consumerId,
            owner
        ) > 0;
    }

    @Override
    public boolean saveProgress(String consumerId, String owner, CursorState state, Instant now) {
        return jdbc.update(
            """
            UPDATE consumer_cursors
            SET last_processed_id = ?,
                processed_ids = ?::jsonb,
                last_processed_at = ?,
                retry_count = 0,
                retry_after = NULL,
                last_error = NULL,
                updated_at = ?
            WHERE consumer_id = ? AND lock_run_id = ?
            """,
            state.cursor(),
            writeProcessedIds(state.processedIds()),
            timestamp(now),
            timestamp(now),
            consumerId,
            owner
        ) > 0;
    }

    @Override
    public void resetRetryState(String consumerId, Instant now) {
        jdbc.update(
            """
            UPDATE consumer_cursors
            SET retry_count = 0, retry_after = NULL, last_error = NULL, updated_at = ?
            WHERE consumer_id = ?
              AND (retry_count > 0 OR retry_after IS NOT NULL OR last_error IS NOT NULL)
            """,
            timestamp(now),
            consumerId
        );
    }

    @Override
    public boolean recordRetry(String consumerId, String owner, int retryCount, Instant retryAfter,
                               String error, Instant now) {
        return jdbc.update(
            """
            UPDATE consumer_cursors
            SET retry_count = ?, retry_after = ?, last_error = ?, updated_at = ?
            WHERE consumer_id = ? AND lock_run_id = ?
            """,
            retryCount,
            timestamp(retryAfter),
            error,
            timestamp(now),
            consumerId,
            owner
        ) > 0;
    }

    @Override
    public void insertDeadLetter(String consumerId, long eventId, String error, Instant now) {
        jdbc.update(
            """
            INSERT INTO outbox_dead_letters (consumer_id, event_id, error, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (consumer_id, event_id) DO NOTHING
            """,
            consumerId,
            eventId,
            error,
            timestamp(now)
        );
    }

    @Override
    public Optional<ConsumerCursor> findById(String consumerId) {
        return jdbc.query("SELECT * FROM consumer_cursors WHERE consumer_id = ?", cursorMapper, consumerId)
            .stream()
            .findFirst();
    }

    @Override
    public List<ConsumerCursor> findAll() {
        return jdbc.query("SELECT * FROM consumer_cursors ORDER BY consumer_id", cursorMapper);
    }

    @Override
    public List<DeadLetter> findDeadLetters(String consumerId, int limit) {
        return jdbc.query(
            """
            SELECT d.consumer_id, d.event_id, o.event_type, d.error, d.created_at
            FROM outbox_dead_letters d
            LEFT JOIN outbox o ON o.id = d.event_id
            WHERE d.consumer_id = ?
            ORDER BY d.created_at DESC
            LIMIT ?
            """,
            DEAD_LETTER_MAPPER,
            consumerId,
            limit
        );
    }

    @Override
    public OptionalLong findRetentionWatermark(Collection<String> consumerIds) {
        Set<String> ids = new LinkedHashSet<>(consumerIds);
        if (ids.isEmpty()) {
            return OptionalLong.empty();
        }
        return jdbc.queryForObject(
            "SELECT COUNT(*) AS found, MIN(last_processed_id) AS watermark FROM consumer_cursors WHERE consumer_id IN ("
                + placeholders(ids) + ")",
            (rs, rowNum) -> rs.getInt("found") < ids.size()
                ? OptionalLong.empty()
                : OptionalLong.of(rs.getLong("watermark")),
            ids.toArray()
        );
    }

    @Override
    public int countHeldLocks(Instant now) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM consumer_cursors WHERE locked_until > ?",
            Integer.class,
            timestamp(now)
        );
        return count != null ? count : 0;
    }

    private ProcessedIds readProcessedIds(String json) {
        if (json == null || json.isBlank()) {
            return ProcessedIds.empty();
        }
        try {
            Map<String, String> raw = objectMapper.readValue(json, PROCESSED_IDS_TYPE);
            Map<Long, Instant> entries = new TreeMap<>();
            raw.forEach((id, processedAt) -> entries.put(Long.parseLong(id), Instant.parse(processedAt)));
            return ProcessedIds.of(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt processed_ids column", e);
        }
    }

    private String writeProcessedIds(ProcessedIds processedIds) {
        Map<String, String> raw = new LinkedHashMap<>();
        processedIds.asMap().forEach((id, processedAt) -> raw.put(id.toString(), processedAt.toString()));
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize processed ids", e);
        }
    }
}
