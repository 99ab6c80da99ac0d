package com.relaybox.infrastructure.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cancellable periodic task with explicit start/stop.
 *
 * <p>Ticks never overlap. {@link #stop()} waits for a tick that is already running,
 * so once it returns no further side effect of the task can happen. Lease renewals
 * rely on this to never race the release that follows.
 */
public final class Ticker {

    private static final Logger log = LoggerFactory.getLogger(Ticker.class);

    private final String name;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile boolean running;
    private ScheduledFuture<?> future;

    public Ticker(String name, Duration interval, ScheduledExecutorService scheduler) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Ticker interval must be positive: " + name);
        }
        this.name = name;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    public synchronized void start(Runnable task) {
        if (running) {
            throw new IllegalStateException("Ticker already running: " + name);
        }
        running = true;
        long periodMs = interval.toMillis();
        future = scheduler.scheduleWithFixedDelay(() -> tick(task), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
        // Blocks until an in-flight tick has finished
        tickLock.lock();
        tickLock.unlock();
    }

    public boolean isRunning() {
        return running;
    }

    public String name() {
        return name;
    }

    private void tick(Runnable task) {
        tickLock.lock();
        try {
            if (!running) {
                return;
            }
            task.run();
        } catch (RuntimeException e) {
            log.warn("Ticker task failed: ticker={}, error={}", name, e.getMessage(), e);
        } finally {
            tickLock.unlock();
        }
    }
}
