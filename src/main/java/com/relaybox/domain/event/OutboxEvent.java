package com.relaybox.domain.event;

import java.time.Instant;

/**
 * Immutable row of the event log. The id is allocated at insert but only becomes
 * visible at commit, so ids can appear out of order to readers.
 */
public record OutboxEvent(
    long id,
    String eventType,
    EventPayload payload,
    Instant createdAt
) {

    public String workspaceId() {
        return payload.workspaceId();
    }
}
