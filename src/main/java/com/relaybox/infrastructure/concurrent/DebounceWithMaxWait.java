package com.relaybox.infrastructure.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Collapses bursts of triggers into one action. The action fires after {@code wait}
 * of quiet, or at the latest {@code maxWait} after the first trigger of the burst.
 */
public final class DebounceWithMaxWait {

    private static final Logger log = LoggerFactory.getLogger(DebounceWithMaxWait.class);

    private final long waitNanos;
    private final long maxWaitNanos;
    private final ScheduledExecutorService scheduler;
    private final Runnable action;

    private ScheduledFuture<?> pending;
    private long burstStartNanos = -1;

    public DebounceWithMaxWait(Duration wait, Duration maxWait, ScheduledExecutorService scheduler, Runnable action) {
        if (maxWait.compareTo(wait) < 0) {
            throw new IllegalArgumentException("maxWait must not be shorter than wait");
        }
        this.waitNanos = wait.toNanos();
        this.maxWaitNanos = maxWait.toNanos();
        this.scheduler = scheduler;
        this.action = action;
    }

    public synchronized void trigger() {
        long now = System.nanoTime();
        if (burstStartNanos < 0) {
            burstStartNanos = now;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        long untilCeiling = maxWaitNanos - (now - burstStartNanos);
        long delay = Math.max(0, Math.min(waitNanos, untilCeiling));
        pending = scheduler.schedule(this::fire, delay, TimeUnit.NANOSECONDS);
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        burstStartNanos = -1;
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    private void fire() {
        synchronized (this) {
            pending = null;
            burstStartNanos = -1;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Debounced action failed: {}", e.getMessage(), e);
        }
    }
}
