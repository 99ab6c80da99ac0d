package com.relaybox.domain.cursor;

import java.time.Instant;

/**
 * Event that exhausted its retries for one consumer. Other consumers are unaffected.
 */
public record DeadLetter(
    String consumerId,
    long eventId,
    String eventType,
    String error,
    Instant createdAt
) {
}
