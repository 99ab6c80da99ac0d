package com.relaybox.domain.event;

public record MemberRemoved(
    String workspaceId,
    String memberId
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.MEMBER_REMOVED.wireName();
    }
}
