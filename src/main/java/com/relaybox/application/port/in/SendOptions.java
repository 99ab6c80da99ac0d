package com.relaybox.application.port.in;

import java.time.Instant;

/**
 * Optional parameters of {@link QueueClient#send}. Null fields mean "not set".
 */
public record SendOptions(Instant processAfter, String dedupeKey) {

    public static SendOptions none() {
        return new SendOptions(null, null);
    }

    public static SendOptions dedupe(String dedupeKey) {
        return new SendOptions(null, dedupeKey);
    }

    public static SendOptions delayedUntil(Instant processAfter) {
        return new SendOptions(processAfter, null);
    }
}
