package com.relaybox.infrastructure.concurrent;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff {@code base * 2^retries}, jittered by up to 20% either way and
 * capped at {@code max}.
 */
public final class Backoff {

    static final double JITTER = 0.2;
    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration max;
    private final DoubleSupplier random;

    public Backoff(Duration base, Duration max) {
        this(base, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    Backoff(Duration base, Duration max, DoubleSupplier random) {
        this.base = base;
        this.max = max;
        this.random = random;
    }

    public Duration delayFor(int retries) {
        long shift = Math.min(Math.max(retries, 0), MAX_SHIFT);
        double raw = (double) base.toMillis() * (1L << shift);
        double factor = 1 + JITTER * (2 * random.getAsDouble() - 1);
        long jittered = Math.round(raw * factor);
        return Duration.ofMillis(Math.min(jittered, max.toMillis()));
    }
}
