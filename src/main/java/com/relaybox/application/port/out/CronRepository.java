package com.relaybox.application.port.out;

import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.CronTick;
import com.relaybox.domain.queue.ScheduleResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface CronRepository {

    /**
     * Creates the schedule for (queue, workspace) or updates it in place. An interval
     * change makes the next tick due immediately.
     */
    ScheduleResult ensureSchedule(UUID newId, String queueName, int intervalSeconds,
                                  String payload, String workspaceId, Instant now);

    /**
     * Materializes the next tick of up to {@code limit} enabled schedules whose next tick
     * falls inside {@code now + lookahead}, and moves their next-tick time forward.
     */
    List<CronTick> generateTicks(Instant now, Duration lookahead, int limit);

    List<CronTick> leaseTicks(String leasedBy, Instant now, Instant leasedUntil, int limit);

    void deleteTick(UUID tickId, String leasedBy);

    int deleteExpiredTicks(Instant expiredBefore);

    int deleteOrphanedTicks();

    void disable(UUID scheduleId, Instant now);

    void enable(UUID scheduleId, Instant now);

    void delete(UUID scheduleId);

    List<CronSchedule> findAll();
}
