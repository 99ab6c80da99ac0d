package com.relaybox.domain.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of background work for one workspace on one named queue.
 * Terminal once {@code completedAt} or {@code deadLetteredAt} is set.
 */
public record QueueMessage(
    UUID id,
    String queueName,
    String workspaceId,
    String payload,
    String dedupeKey,
    Instant processAfter,
    Instant insertedAt,
    String claimedBy,
    Instant claimedUntil,
    int claimedCount,
    int failedCount,
    String lastError,
    Instant completedAt,
    Instant deadLetteredAt
) {

    public MessageStatus status(Instant now) {
        if (completedAt != null) {
            return MessageStatus.COMPLETED;
        }
        if (deadLetteredAt != null) {
            return MessageStatus.DEAD_LETTERED;
        }
        if (claimedUntil != null && claimedUntil.isAfter(now)) {
            return MessageStatus.CLAIMED;
        }
        if (failedCount > 0) {
            return MessageStatus.RETRYING;
        }
        return MessageStatus.PENDING;
    }
}
