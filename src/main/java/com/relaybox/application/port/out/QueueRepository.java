package com.relaybox.application.port.out;

import com.relaybox.domain.queue.QueueMessage;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface QueueRepository {

    /**
     * Inserts the message. When a message with the same queue and dedupe key
     * already exists, nothing is written and the existing id is returned.
     */
    UUID insert(NewMessage message);

    /**
     * Claims up to {@code limit} due messages of one (queue, workspace) pair in a single
     * statement, skipping rows locked by concurrent claimers.
     */
    List<QueueMessage> claimBatch(String queueName, String workspaceId, String claimedBy,
                                  Instant now, Instant claimedUntil, int limit);

    int renewClaims(Collection<UUID> messageIds, String claimedBy, Instant claimedUntil);

    void complete(UUID messageId, String claimedBy, Instant completedAt);

    void fail(UUID messageId, String claimedBy, String error, Instant processAfter);

    void markDeadLettered(UUID messageId, String claimedBy, String error, Instant deadLetteredAt);

    void redrive(UUID messageId, Instant processAfter);

    int deleteCompletedBefore(Instant before);

    int deleteDeadLetteredBefore(Instant before);

    Optional<QueueMessage> findById(UUID messageId);

    List<QueueMessage> findDeadLettered(String queueName, int limit);

    int countClaimed(Instant now);

    record NewMessage(
        UUID id,
        String queueName,
        String workspaceId,
        String payload,
        String dedupeKey,
        Instant processAfter,
        Instant insertedAt
    ) {}
}
