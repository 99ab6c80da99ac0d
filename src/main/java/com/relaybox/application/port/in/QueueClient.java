package com.relaybox.application.port.in;

import java.util.UUID;

/**
 * Client surface of the job queue.
 */
public interface QueueClient {

    /**
     * Enqueues {@code payload} for {@code workspaceId}. With a dedupe key that is already
     * taken on this queue, nothing is enqueued and the original message id is returned.
     */
    UUID send(String queueName, String workspaceId, Object payload, SendOptions options);

    default UUID send(String queueName, String workspaceId, Object payload) {
        return send(queueName, workspaceId, payload, SendOptions.none());
    }

    /**
     * Creates or updates the recurring schedule for (queue, workspace). A null workspace
     * makes the schedule system-wide.
     */
    void schedule(String queueName, int intervalSeconds, Object payload, String workspaceId);

    /**
     * Registers the handler of a queue. Must happen before the manager starts.
     */
    void registerHandler(String queueName, JobHandler handler, DeadLetterHook onDeadLetter);

    default void registerHandler(String queueName, JobHandler handler) {
        registerHandler(queueName, handler, null);
    }
}
