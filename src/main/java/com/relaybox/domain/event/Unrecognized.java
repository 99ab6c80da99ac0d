package com.relaybox.domain.event;

/**
 * Event whose type tag is unknown to this build (written by a newer producer).
 * The raw JSON is kept so consumers can skip it without failing the batch.
 */
public record Unrecognized(
    String eventType,
    String workspaceId,
    String rawPayload
) implements EventPayload {
}
