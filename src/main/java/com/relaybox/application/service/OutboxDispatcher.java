package com.relaybox.application.service;

import com.relaybox.application.port.in.OutboxConsumer;
import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.infrastructure.concurrent.Ticker;
import com.relaybox.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wakes every registered consumer when the event log changes. One subscription per
 * process feeds all consumers; a fallback ticker wakes them anyway in case a
 * notification was lost.
 */
@Service
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final NotificationSource notificationSource;
    private final Ticker fallbackPoll;
    private final List<OutboxConsumer> consumers = new CopyOnWriteArrayList<>();

    private volatile boolean started;

    public OutboxDispatcher(
            NotificationSource notificationSource,
            ScheduledExecutorService scheduler,
            AppProperties appProperties) {
        this.notificationSource = notificationSource;
        this.fallbackPoll = new Ticker(
            "dispatcher-fallback",
            Duration.ofMillis(appProperties.getDispatcher().getFallbackPollMs()),
            scheduler);
    }

    public synchronized void register(OutboxConsumer consumer) {
        if (started) {
            throw new IllegalStateException("Cannot register consumer " + consumer.consumerId() + ": dispatcher already started");
        }
        boolean duplicate = consumers.stream().anyMatch(c -> c.consumerId().equals(consumer.consumerId()));
        if (duplicate) {
            throw new IllegalArgumentException("Consumer already registered: " + consumer.consumerId());
        }
        consumers.add(consumer);
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Dispatcher already started");
        }
        started = true;
        for (OutboxConsumer consumer : consumers) {
            consumer.initialize();
        }
        notificationSource.start(this::wakeAll);
        fallbackPoll.start(this::wakeAll);
        wakeAll();
        log.info("Outbox dispatcher started: consumers={}", consumerIds());
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        fallbackPoll.stop();
        notificationSource.stop();
        for (OutboxConsumer consumer : consumers) {
            consumer.shutdown();
        }
        log.info("Outbox dispatcher stopped");
    }

    public void wakeAll() {
        for (OutboxConsumer consumer : consumers) {
            try {
                consumer.wake();
            } catch (RuntimeException e) {
                log.error("Failed to wake consumer: consumerId={}, error={}", consumer.consumerId(), e.getMessage(), e);
            }
        }
    }

    public boolean isStarted() {
        return started;
    }

    public NotificationSource.State state() {
        return notificationSource.state();
    }

    public List<String> consumerIds() {
        return consumers.stream().map(OutboxConsumer::consumerId).toList();
    }
}
