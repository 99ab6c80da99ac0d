package com.relaybox.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.domain.event.EventPayload;
import com.relaybox.domain.event.EventType;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.domain.event.Unrecognized;
import com.relaybox.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static com.relaybox.adapter.out.persistence.JdbcSupport.instant;
import static com.relaybox.adapter.out.persistence.JdbcSupport.placeholders;
import static com.relaybox.adapter.out.persistence.JdbcSupport.timestamp;

@Repository
public class JdbcOutboxRepository implements OutboxRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOutboxRepository.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final String channel;

    private final RowMapper<OutboxEvent> rowMapper = (rs, rowNum) -> new OutboxEvent(
        rs.getLong("id"),
        rs.getString("event_type"),
        decode(rs.getString("event_type"), rs.getString("workspace_id"), rs.getString("payload")),
        instant(rs, "created_at")
    );

    public JdbcOutboxRepository(JdbcTemplate jdbc, ObjectMapper objectMapper, AppProperties appProperties) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.channel = appProperties.getOutbox().getChannel();
    }

    @Override
    public OutboxEvent append(EventPayload payload) {
        String json = encode(payload);
        OutboxEvent event = jdbc.queryForObject(
            """
            INSERT INTO outbox (event_type, workspace_id, payload)
            VALUES (?, ?, ?::jsonb)
            RETURNING id, created_at
            """,
            (rs, rowNum) -> new OutboxEvent(rs.getLong("id"), payload.eventType(), payload, instant(rs, "created_at")),
            payload.eventType(),
            payload.workspaceId(),
            json
        );
        // Delivered by Postgres when the surrounding transaction commits
        jdbc.queryForList("SELECT pg_notify(?, ?)", channel, String.valueOf(event.id()));
        return event;
    }

    @Override
    public List<OutboxEvent> fetchAfter(long afterId, int limit, Collection<Long> excludeIds) {
        List<Object> params = new ArrayList<>();
        params.add(afterId);
        String exclusion = "";
        if (!excludeIds.isEmpty()) {
            exclusion = " AND id NOT IN (" + placeholders(excludeIds) + ")";
            params.addAll(excludeIds);
        }
        params.add(limit);
        return jdbc.query(
            "SELECT id, event_type, workspace_id, payload, created_at FROM outbox WHERE id > ?"
                + exclusion + " ORDER BY id LIMIT ?",
            rowMapper,
            params.toArray()
        );
    }

    @Override
    public OptionalLong nextEventId(long afterId, Collection<Long> excludeIds) {
        List<Object> params = new ArrayList<>();
        params.add(afterId);
        String exclusion = "";
        if (!excludeIds.isEmpty()) {
            exclusion = " AND id NOT IN (" + placeholders(excludeIds) + ")";
            params.addAll(excludeIds);
        }
        List<Long> ids = jdbc.queryForList(
            "SELECT id FROM outbox WHERE id > ?" + exclusion + " ORDER BY id LIMIT 1",
            Long.class,
            params.toArray()
        );
        return ids.isEmpty() ? OptionalLong.empty() : OptionalLong.of(ids.get(0));
    }

    @Override
    public long latestId() {
        Long id = jdbc.queryForObject("SELECT COALESCE(MAX(id), 0) FROM outbox", Long.class);
        return id != null ? id : 0;
    }

    @Override
    public int deleteRetained(long watermark, Instant createdBefore, int limit) {
        return jdbc.update(
            """
            WITH candidates AS (
                SELECT id FROM outbox
                WHERE id <= ? AND created_at < ?
                ORDER BY id
                LIMIT ?
            )
            DELETE FROM outbox WHERE id IN (SELECT id FROM candidates)
            """,
            watermark,
            timestamp(createdBefore),
            limit
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM outbox", Long.class);
        return count != null ? count : 0;
    }

    private String encode(EventPayload payload) {
        if (payload instanceof Unrecognized unrecognized) {
            return unrecognized.rawPayload();
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + payload.eventType(), e);
        }
    }

    private EventPayload decode(String eventType, String workspaceId, String json) {
        Optional<EventType> type = EventType.fromWireName(eventType);
        if (type.isEmpty()) {
            return new Unrecognized(eventType, workspaceId, json);
        }
        try {
            return objectMapper.readValue(json, type.get().payloadType());
        } catch (JsonProcessingException e) {
            log.error("Undecodable event payload, passing it on unrecognized: eventType={}, error={}", eventType, e.getMessage());
            return new Unrecognized(eventType, workspaceId, json);
        }
    }
}
