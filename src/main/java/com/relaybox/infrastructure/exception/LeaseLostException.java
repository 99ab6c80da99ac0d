package com.relaybox.infrastructure.exception;

/**
 * A conditional update keyed by an owner token matched no row: the lease expired and
 * was taken by someone else, or the row already reached a terminal state.
 */
public class LeaseLostException extends RelayException {

    public LeaseLostException(String message) {
        super("LEASE_LOST", message);
    }
}
