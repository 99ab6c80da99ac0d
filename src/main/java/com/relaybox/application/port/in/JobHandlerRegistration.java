package com.relaybox.application.port.in;

/**
 * Declares a queue handler as a bean; the lifecycle registers every declaration before
 * the queue manager starts.
 */
public record JobHandlerRegistration(String queueName, JobHandler handler, DeadLetterHook onDeadLetter) {

    public static JobHandlerRegistration of(String queueName, JobHandler handler) {
        return new JobHandlerRegistration(queueName, handler, null);
    }
}
