package com.relaybox.domain.event;

public record MemberAdded(
    String workspaceId,
    String memberId,
    String displayName
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.MEMBER_ADDED.wireName();
    }
}
