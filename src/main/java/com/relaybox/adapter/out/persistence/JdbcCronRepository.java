package com.relaybox.adapter.out.persistence;

import com.relaybox.application.port.out.CronRepository;
import com.relaybox.application.port.out.IdGenerator;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.CronTick;
import com.relaybox.domain.queue.ScheduleResult;
import com.relaybox.infrastructure.exception.LeaseLostException;
import com.relaybox.infrastructure.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.relaybox.adapter.out.persistence.JdbcSupport.instant;
import static com.relaybox.adapter.out.persistence.JdbcSupport.timestamp;
import static com.relaybox.adapter.out.persistence.JdbcSupport.uuid;

@Repository
public class JdbcCronRepository implements CronRepository {

    private static final String SCHEDULE_COLUMNS = """
        id, queue_name, interval_seconds, payload, workspace_id,
        next_tick_needed_at, enabled, created_at, updated_at
        """;

    private static final RowMapper<CronSchedule> SCHEDULE_MAPPER = (rs, rowNum) -> new CronSchedule(
        uuid(rs, "id"),
        rs.getString("queue_name"),
        rs.getInt("interval_seconds"),
        rs.getString("payload"),
        rs.getString("workspace_id"),
        instant(rs, "next_tick_needed_at"),
        rs.getBoolean("enabled"),
        instant(rs, "created_at"),
        instant(rs, "updated_at")
    );

    private static final RowMapper<CronTick> TICK_MAPPER = (rs, rowNum) -> new CronTick(
        uuid(rs, "id"),
        uuid(rs, "schedule_id"),
        rs.getString("queue_name"),
        rs.getString("payload"),
        rs.getString("workspace_id"),
        instant(rs, "execute_at"),
        rs.getString("leased_by"),
        instant(rs, "leased_until")
    );

    private final JdbcTemplate jdbc;
    private final IdGenerator idGenerator;

    public JdbcCronRepository(JdbcTemplate jdbc, IdGenerator idGenerator) {
        this.jdbc = jdbc;
        this.idGenerator = idGenerator;
    }

    @Override
    public ScheduleResult ensureSchedule(UUID newId, String queueName, int intervalSeconds,
                                         String payload, String workspaceId, Instant now) {
        // In DO UPDATE, unqualified cron_schedules columns still hold the pre-update row
        return jdbc.queryForObject(
            """
            INSERT INTO cron_schedules (id, queue_name, interval_seconds, payload, workspace_id,
                                        next_tick_needed_at, enabled, created_at, updated_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?, TRUE, ?, ?)
            ON CONFLICT (queue_name, workspace_key) DO UPDATE
            SET payload = EXCLUDED.payload,
                next_tick_needed_at = CASE
                    WHEN cron_schedules.interval_seconds <> EXCLUDED.interval_seconds
                        THEN EXCLUDED.next_tick_needed_at
                    ELSE cron_schedules.next_tick_needed_at
                END,
                interval_seconds = EXCLUDED.interval_seconds,
                updated_at = EXCLUDED.updated_at
            RETURNING %s, (xmax = 0) AS inserted
            """.formatted(SCHEDULE_COLUMNS),
            (rs, rowNum) -> new ScheduleResult(SCHEDULE_MAPPER.mapRow(rs, rowNum), rs.getBoolean("inserted")),
            newId,
            queueName,
            intervalSeconds,
            payload,
            workspaceId,
            timestamp(now),
            timestamp(now),
            timestamp(now)
        );
    }

    /**
     * Schedules are row-locked with SKIP LOCKED for the duration of the transaction, so two
     * managers never generate ticks for the same schedule at once. A schedule that fell
     * behind restarts from {@code now} rather than replaying missed ticks.
     */
    @Override
    @Transactional
    public List<CronTick> generateTicks(Instant now, Duration lookahead, int limit) {
        List<CronSchedule> due = jdbc.query(
            "SELECT " + SCHEDULE_COLUMNS + """
             FROM cron_schedules
            WHERE enabled = TRUE AND next_tick_needed_at <= ?
            ORDER BY next_tick_needed_at
            LIMIT ?
            FOR UPDATE SKIP LOCKED
            """,
            SCHEDULE_MAPPER,
            timestamp(now.plus(lookahead)),
            limit
        );
        if (due.isEmpty()) {
            return List.of();
        }

        List<CronTick> ticks = new ArrayList<>();
        List<Object[]> tickRows = new ArrayList<>();
        List<Object[]> scheduleRows = new ArrayList<>();
        for (CronSchedule schedule : due) {
            Instant executeAt = schedule.nextTickNeededAt().isBefore(now) ? now : schedule.nextTickNeededAt();
            CronTick tick = new CronTick(idGenerator.generate(), schedule.id(), schedule.queueName(),
                schedule.payload(), schedule.workspaceId(), executeAt, null, null);
            ticks.add(tick);
            tickRows.add(new Object[] {
                tick.id(), tick.scheduleId(), tick.queueName(), tick.payload(), tick.workspaceId(),
                timestamp(executeAt), timestamp(now)
            });
            scheduleRows.add(new Object[] {
                timestamp(executeAt.plusSeconds(schedule.intervalSeconds())), timestamp(now), schedule.id()
            });
        }

        int[] inserted = jdbc.batchUpdate(
            """
            INSERT INTO cron_ticks (id, schedule_id, queue_name, payload, workspace_id, execute_at, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (schedule_id, execute_at) DO NOTHING
            """,
            tickRows
        );
        jdbc.batchUpdate(
            "UPDATE cron_schedules SET next_tick_needed_at = ?, updated_at = ? WHERE id = ?",
            scheduleRows
        );

        List<CronTick> created = new ArrayList<>();
        for (int i = 0; i < ticks.size(); i++) {
            if (inserted[i] != 0) {
                created.add(ticks.get(i));
            }
        }
        return created;
    }

    @Override
    public List<CronTick> leaseTicks(String leasedBy, Instant now, Instant leasedUntil, int limit) {
        return jdbc.query(
            """
            WITH available AS (
                SELECT id FROM cron_ticks
                WHERE execute_at <= ?
                  AND (leased_until IS NULL OR leased_until < ?)
                ORDER BY execute_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            UPDATE cron_ticks t
            SET leased_at = ?, leased_by = ?, leased_until = ?
            FROM available
            WHERE t.id = available.id
            RETURNING t.id, t.schedule_id, t.queue_name, t.payload, t.workspace_id,
                      t.execute_at, t.leased_by, t.leased_until
            """,
            TICK_MAPPER,
            timestamp(now),
            timestamp(now),
            limit,
            timestamp(now),
            leasedBy,
            timestamp(leasedUntil)
        );
    }

    @Override
    public void deleteTick(UUID tickId, String leasedBy) {
        int deleted = jdbc.update("DELETE FROM cron_ticks WHERE id = ? AND leased_by = ?", tickId, leasedBy);
        if (deleted == 0) {
            throw new LeaseLostException("Tick " + tickId + " not found or leased by another manager");
        }
    }

    @Override
    public int deleteExpiredTicks(Instant expiredBefore) {
        return jdbc.update(
            "DELETE FROM cron_ticks WHERE leased_until IS NOT NULL AND leased_until < ?",
            timestamp(expiredBefore)
        );
    }

    @Override
    public int deleteOrphanedTicks() {
        return jdbc.update(
            "DELETE FROM cron_ticks t WHERE NOT EXISTS (SELECT 1 FROM cron_schedules s WHERE s.id = t.schedule_id)"
        );
    }

    @Override
    public void disable(UUID scheduleId, Instant now) {
        int updated = jdbc.update(
            "UPDATE cron_schedules SET enabled = FALSE, updated_at = ? WHERE id = ?",
            timestamp(now),
            scheduleId
        );
        requireFound(updated, scheduleId);
    }

    @Override
    public void enable(UUID scheduleId, Instant now) {
        int updated = jdbc.update(
            "UPDATE cron_schedules SET enabled = TRUE, next_tick_needed_at = ?, updated_at = ? WHERE id = ?",
            timestamp(now),
            timestamp(now),
            scheduleId
        );
        requireFound(updated, scheduleId);
    }

    @Override
    @Transactional
    public void delete(UUID scheduleId) {
        // Leased ticks are finishing right now; orphan cleanup removes anything left
        jdbc.update("DELETE FROM cron_ticks WHERE schedule_id = ? AND leased_until IS NULL", scheduleId);
        int deleted = jdbc.update("DELETE FROM cron_schedules WHERE id = ?", scheduleId);
        requireFound(deleted, scheduleId);
    }

    @Override
    public List<CronSchedule> findAll() {
        return jdbc.query("SELECT " + SCHEDULE_COLUMNS + " FROM cron_schedules ORDER BY queue_name, workspace_key", SCHEDULE_MAPPER);
    }

    private static void requireFound(int updated, UUID scheduleId) {
        if (updated == 0) {
            throw new NotFoundException("Cron schedule", scheduleId);
        }
    }
}
