package com.relaybox.application.port.in;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A claimed queue message as seen by its handler.
 */
public record Job(
    UUID id,
    String queueName,
    String workspaceId,
    JsonNode data,
    int failedCount,
    Instant insertedAt
) {
}
