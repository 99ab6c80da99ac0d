package com.relaybox.domain.event;

public record ReactionRemoved(
    String workspaceId,
    String streamId,
    String messageId,
    String memberId,
    String emoji
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.REACTION_REMOVED.wireName();
    }
}
