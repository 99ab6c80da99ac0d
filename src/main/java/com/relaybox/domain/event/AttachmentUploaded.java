package com.relaybox.domain.event;

public record AttachmentUploaded(
    String workspaceId,
    String attachmentId,
    String filename,
    String mimeType,
    long sizeBytes,
    String storagePath
) implements EventPayload {

    @Override
    public String eventType() {
        return EventType.ATTACHMENT_UPLOADED.wireName();
    }
}
