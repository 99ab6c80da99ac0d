package com.relaybox.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new time-ordered identifier (UUIDv7).
     */
    UUID generate();

    /**
     * Random token identifying one lease holder, e.g. {@code run_0190...}.
     */
    String ownerToken(String prefix);
}
