package com.relaybox.domain.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * Materialized future execution of a schedule. Payload and target are copied from the
 * schedule so executing the tick needs no join.
 */
public record CronTick(
    UUID id,
    UUID scheduleId,
    String queueName,
    String payload,
    String workspaceId,
    Instant executeAt,
    String leasedBy,
    Instant leasedUntil
) {
}
