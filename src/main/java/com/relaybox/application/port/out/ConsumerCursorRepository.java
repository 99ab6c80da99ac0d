package com.relaybox.application.port.out;

import com.relaybox.domain.cursor.ClaimedCursor;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.CursorState;
import com.relaybox.domain.cursor.DeadLetter;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Storage of per-consumer cursors, their processing locks and their dead letters.
 * Every mutation of a held lock is conditioned on the owner token.
 */
public interface ConsumerCursorRepository {

    /** Creates the cursor row at {@code startId} unless it exists. */
    void ensure(String consumerId, long startId);

    /** Creates the cursor row at the newest event id unless it exists. */
    void ensureFromLatest(String consumerId);

    /**
     * Takes the lock if it is free or expired before {@code expiredBefore} and the
     * consumer is not backing off at {@code now}. Empty when either condition fails.
     */
    Optional<ClaimedCursor> tryClaim(String consumerId, String owner, Instant now, Instant lockedUntil, Instant expiredBefore);

    boolean refresh(String consumerId, String owner, Instant lockedUntil, Instant now);

    boolean release(String consumerId, String owner, Instant now);

    /** Persists compacted progress and clears retry state. False if the lock was lost. */
    boolean saveProgress(String consumerId, String owner, CursorState state, Instant now);

    void resetRetryState(String consumerId, Instant now);

    boolean recordRetry(String consumerId, String owner, int retryCount, Instant retryAfter, String error, Instant now);

    void insertDeadLetter(String consumerId, long eventId, String error, Instant now);

    Optional<ConsumerCursor> findById(String consumerId);

    List<ConsumerCursor> findAll();

    List<DeadLetter> findDeadLetters(String consumerId, int limit);

    /**
     * Minimum cursor across {@code consumerIds}; empty if any of them has no row.
     */
    OptionalLong findRetentionWatermark(Collection<String> consumerIds);

    int countHeldLocks(Instant now);
}
