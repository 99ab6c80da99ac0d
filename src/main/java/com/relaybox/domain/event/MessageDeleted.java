package com.relaybox.domain.event;

import java.time.Instant;

public record MessageDeleted(
    String workspaceId,
    String streamId,
    String messageId,
    Instant deletedAt
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.MESSAGE_DELETED.wireName();
    }
}
