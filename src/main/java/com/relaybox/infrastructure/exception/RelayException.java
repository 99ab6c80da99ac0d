package com.relaybox.infrastructure.exception;

/**
 * Base of the service's unchecked exceptions, carrying a stable error code for clients.
 */
public abstract class RelayException extends RuntimeException {

    private final String errorCode;

    protected RelayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
