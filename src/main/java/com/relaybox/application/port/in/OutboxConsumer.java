package com.relaybox.application.port.in;

/**
 * A consumer of the event log, registered with the dispatcher before it starts.
 */
public interface OutboxConsumer {

    String consumerId();

    /** Creates the consumer's cursor row if missing. Called once before the first wake. */
    void initialize();

    /**
     * Requests a drain. Safe to call arbitrarily often from any thread; never blocks.
     */
    void wake();

    /** Cancels pending drains and waits for a running one to finish. */
    void shutdown();
}
