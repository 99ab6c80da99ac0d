package com.relaybox.domain.event;

public record MessageCreated(
    String workspaceId,
    String streamId,
    String messageId,
    String authorId,
    String content
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.MESSAGE_CREATED.wireName();
    }
}
