package com.relaybox.domain.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * Recurring job definition. A null workspace means the schedule is system-wide.
 */
public record CronSchedule(
    UUID id,
    String queueName,
    int intervalSeconds,
    String payload,
    String workspaceId,
    Instant nextTickNeededAt,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt
) {

    public static final String SYSTEM_WORKSPACE = "system";

    public String effectiveWorkspaceId() {
        return workspaceId != null ? workspaceId : SYSTEM_WORKSPACE;
    }
}
