package com.relaybox.domain.event;

public record StreamCreated(
    String workspaceId,
    String streamId,
    String displayName,
    String visibility
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.STREAM_CREATED.wireName();
    }
}
