package com.relaybox.domain.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Wire tags of the event log. The tag decides which payload record a row decodes to.
 */
public enum EventType {
    MESSAGE_CREATED("message:created", MessageCreated.class),
    MESSAGE_EDITED("message:edited", MessageEdited.class),
    MESSAGE_DELETED("message:deleted", MessageDeleted.class),
    REACTION_ADDED("reaction:added", ReactionAdded.class),
    REACTION_REMOVED("reaction:removed", ReactionRemoved.class),
    STREAM_CREATED("stream:created", StreamCreated.class),
    STREAM_ARCHIVED("stream:archived", StreamArchived.class),
    MEMBER_ADDED("workspace_member:added", MemberAdded.class),
    MEMBER_REMOVED("workspace_member:removed", MemberRemoved.class),
    ATTACHMENT_UPLOADED("attachment:uploaded", AttachmentUploaded.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(wireName))
            .findFirst();
    }
}
