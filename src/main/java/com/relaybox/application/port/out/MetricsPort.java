package com.relaybox.application.port.out;

import java.time.Duration;

/**
 * Port for recording relay metrics.
 * Abstracts the metrics infrastructure from the engines.
 */
public interface MetricsPort {

    void incrementEventsAppended(String eventType);

    void incrementEventsProcessed(String consumerId, int count);

    void incrementConsumerRetries(String consumerId);

    void incrementConsumerDeadLetters(String consumerId);

    void incrementLockContention(String consumerId);

    void incrementMessagesEnqueued(String queueName);

    void incrementMessagesCompleted(String queueName);

    void incrementMessagesRetried(String queueName);

    void incrementMessagesDeadLettered(String queueName);

    void incrementRetentionDeleted(int count);

    void recordHandlerDuration(String queueName, Duration duration);

    void messageStarted();

    void messageFinished();
}
