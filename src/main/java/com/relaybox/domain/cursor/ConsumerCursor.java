package com.relaybox.domain.cursor;

import java.time.Instant;

/**
 * Full row of a consumer's cursor bookkeeping, used for inspection.
 */
public record ConsumerCursor(
    String consumerId,
    long cursor,
    ProcessedIds processedIds,
    int retryCount,
    Instant retryAfter,
    String lastError,
    Instant lockedUntil,
    String lockOwner,
    Instant lastProcessedAt,
    Instant updatedAt
) {

    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isBackingOff(Instant now) {
        return retryAfter != null && retryAfter.isAfter(now);
    }
}
