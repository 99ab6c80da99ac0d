package com.relaybox.domain.event;

public record MessageEdited(
    String workspaceId,
    String streamId,
    String messageId,
    String content
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.MESSAGE_EDITED.wireName();
    }
}
