package com.relaybox.infrastructure.exception;

public class NotFoundException extends RelayException {

    public NotFoundException(String what, Object id) {
        super("NOT_FOUND", what + " not found: " + id);
    }
}
