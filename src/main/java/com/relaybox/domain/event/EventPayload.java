package com.relaybox.domain.event;

/**
 * Strongly-typed payload of an outbox event, keyed by its wire type tag.
 * Consumers switch on the concrete record type.
 */
public sealed interface EventPayload permits
        MessageCreated, MessageEdited, MessageDeleted,
        ReactionAdded, ReactionRemoved,
        StreamCreated, StreamArchived,
        MemberAdded, MemberRemoved,
        AttachmentUploaded, Unrecognized {

    String workspaceId();

    String eventType();
}
