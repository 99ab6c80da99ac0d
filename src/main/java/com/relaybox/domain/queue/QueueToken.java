package com.relaybox.domain.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * Lease granting one manager the right to claim messages for a (queue, workspace) pair.
 * At most one unexpired token exists per pair, which is what spreads workers across tenants.
 */
public record QueueToken(
    UUID id,
    String queueName,
    String workspaceId,
    String leasedBy,
    Instant leasedAt,
    Instant leasedUntil,
    Instant nextProcessAfter
) {
}
