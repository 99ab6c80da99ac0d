package com.relaybox.application.port.in;

/**
 * Runs inside the transaction that dead-letters a message, in its own savepoint.
 * A failing hook is rolled back alone; the dead-letter transition still commits.
 */
@FunctionalInterface
public interface DeadLetterHook {

    void onDeadLetter(Job job, Exception error);
}
