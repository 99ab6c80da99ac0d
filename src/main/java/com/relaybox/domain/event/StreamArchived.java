package com.relaybox.domain.event;

public record StreamArchived(
    String workspaceId,
    String streamId
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.STREAM_ARCHIVED.wireName();
    }
}
