package com.relaybox.application.service;

import com.relaybox.infrastructure.concurrent.Backoff;
import com.relaybox.infrastructure.config.AppProperties;

import java.time.Duration;

public record CursorLockSettings(
    Duration lockDuration,
    Duration refreshInterval,
    int maxRetries,
    Backoff backoff,
    Duration gapWindow,
    Duration clockDriftPad
) {

    public static CursorLockSettings from(AppProperties.Cursor cursor) {
        return new CursorLockSettings(
            Duration.ofMillis(cursor.getLockDurationMs()),
            Duration.ofMillis(cursor.getRefreshIntervalMs()),
            cursor.getMaxRetries(),
            new Backoff(Duration.ofMillis(cursor.getBaseBackoffMs()), Duration.ofMillis(cursor.getMaxBackoffMs())),
            Duration.ofMillis(cursor.getGapWindowMs()),
            Duration.ofMillis(cursor.getClockDriftPadMs())
        );
    }
}
