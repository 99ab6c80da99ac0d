package com.relaybox.infrastructure.metrics;

import com.relaybox.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;
    private final AtomicInteger messagesInFlight = new AtomicInteger();
    private final Counter retentionDeleted;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.retentionDeleted = Counter.builder("relay_retention_deleted_total")
            .description("Total number of event log rows deleted by retention")
            .register(registry);

        Gauge.builder("relay_queue_messages_in_flight", messagesInFlight, AtomicInteger::get)
            .description("Queue messages currently being handled")
            .register(registry);
    }

    @Override
    public void incrementEventsAppended(String eventType) {
        counter("relay_events_appended_total", "Total number of events appended to the outbox", "type", eventType).increment();
    }

    @Override
    public void incrementEventsProcessed(String consumerId, int count) {
        counter("relay_consumer_events_processed_total", "Total number of events processed per consumer", "consumer", consumerId)
            .increment(count);
    }

    @Override
    public void incrementConsumerRetries(String consumerId) {
        counter("relay_consumer_retries_total", "Total number of failed consumer batches scheduled for retry", "consumer", consumerId)
            .increment();
    }

    @Override
    public void incrementConsumerDeadLetters(String consumerId) {
        counter("relay_consumer_dead_letters_total", "Total number of events dead-lettered per consumer", "consumer", consumerId)
            .increment();
    }

    @Override
    public void incrementLockContention(String consumerId) {
        counter("relay_consumer_lock_contention_total", "Total number of cursor lock claims refused", "consumer", consumerId)
            .increment();
    }

    @Override
    public void incrementMessagesEnqueued(String queueName) {
        counter("relay_queue_messages_enqueued_total", "Total number of queue messages enqueued", "queue", queueName).increment();
    }

    @Override
    public void incrementMessagesCompleted(String queueName) {
        counter("relay_queue_messages_completed_total", "Total number of queue messages completed", "queue", queueName).increment();
    }

    @Override
    public void incrementMessagesRetried(String queueName) {
        counter("relay_queue_messages_retried_total", "Total number of queue message failures scheduled for retry", "queue", queueName)
            .increment();
    }

    @Override
    public void incrementMessagesDeadLettered(String queueName) {
        counter("relay_queue_messages_dead_lettered_total", "Total number of queue messages dead-lettered", "queue", queueName)
            .increment();
    }

    @Override
    public void incrementRetentionDeleted(int count) {
        retentionDeleted.increment(count);
    }

    @Override
    public void recordHandlerDuration(String queueName, Duration duration) {
        Timer.builder("relay_queue_handler_duration_seconds")
            .description("Time spent in queue job handlers")
            .tag("queue", queueName)
            .register(registry)
            .record(duration);
    }

    @Override
    public void messageStarted() {
        messagesInFlight.incrementAndGet();
    }

    @Override
    public void messageFinished() {
        messagesInFlight.decrementAndGet();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
            .description(description)
            .tag(tagKey, tagValue)
            .register(registry);
    }
}
