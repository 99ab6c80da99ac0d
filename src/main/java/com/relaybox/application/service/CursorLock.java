package com.relaybox.application.service;

import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.IdGenerator;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.domain.cursor.ClaimedCursor;
import com.relaybox.domain.cursor.Compaction;
import com.relaybox.domain.cursor.CursorState;
import com.relaybox.domain.cursor.ProcessResult;
import com.relaybox.infrastructure.concurrent.Ticker;
import com.relaybox.infrastructure.exception.LeaseLostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Exclusive, time-leased processing slot of one consumer, shared by every process that
 * runs the consumer.
 *
 * <p>A run claims the lock with a single conditional update (which also refuses while
 * the consumer is backing off), renews it on a background ticker, feeds batches to the
 * caller until it reports no more events or fails, compacts and persists progress after
 * every batch, and always releases the lock. No transaction or connection is held
 * while the caller processes a batch.
 */
public class CursorLock {

    private static final Logger log = LoggerFactory.getLogger(CursorLock.class);

    /** Processes the batch following {@code state} and reports what happened. */
    @FunctionalInterface
    public interface BatchProcessor {
        ProcessResult process(CursorState state);
    }

    private final String consumerId;
    private final ConsumerCursorRepository cursors;
    private final OutboxRepository outbox;
    private final TransactionTemplate transactionTemplate;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final CursorLockSettings settings;

    public CursorLock(
            String consumerId,
            ConsumerCursorRepository cursors,
            OutboxRepository outbox,
            TransactionTemplate transactionTemplate,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock,
            ScheduledExecutorService scheduler,
            CursorLockSettings settings) {
        this.consumerId = consumerId;
        this.cursors = cursors;
        this.outbox = outbox;
        this.transactionTemplate = transactionTemplate;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    public String consumerId() {
        return consumerId;
    }

    /**
     * @return whether any batch was processed; false when the lock was held elsewhere,
     *         the consumer is backing off, or there was nothing to do
     */
    public boolean run(BatchProcessor processor) {
        Instant now = clock.instant();
        String owner = idGenerator.ownerToken("run");
        Optional<ClaimedCursor> claimed = cursors.tryClaim(
            consumerId, owner, now, now.plus(settings.lockDuration()), now.plus(settings.clockDriftPad()));
        if (claimed.isEmpty()) {
            metrics.incrementLockContention(consumerId);
            log.debug("Cursor lock not acquired: consumerId={}", consumerId);
            return false;
        }

        CursorState state = claimed.get().state();
        int retryCount = claimed.get().retryCount();
        boolean didWork = false;
        Ticker refresher = new Ticker("cursor-refresh-" + consumerId, settings.refreshInterval(), scheduler);

        MDC.put("consumerId", consumerId);
        try {
            refresher.start(() -> refresh(owner));
            boolean more = true;
            while (more) {
                ProcessResult result = processor.process(state);
                if (result instanceof ProcessResult.Processed processed) {
                    if (!advances(state, processed)) {
                        break;
                    }
                    CursorState next = Compaction.compact(state, processed.ids(), clock.instant(), settings.gapWindow());
                    if (!persist(owner, next)) {
                        break;
                    }
                    metrics.incrementEventsProcessed(consumerId, processed.ids().size());
                    state = next;
                    retryCount = 0;
                    didWork = true;
                } else if (result instanceof ProcessResult.NoEvents) {
                    cursors.resetRetryState(consumerId, clock.instant());
                    more = false;
                } else if (result instanceof ProcessResult.Failed failed) {
                    if (!failed.processedIds().isEmpty()) {
                        CursorState next = Compaction.compact(state, failed.processedIds(), clock.instant(), settings.gapWindow());
                        if (persist(owner, next)) {
                            metrics.incrementEventsProcessed(consumerId, failed.processedIds().size());
                            state = next;
                            retryCount = 0;
                            didWork = true;
                        }
                    }
                    handleFailure(owner, state, retryCount, failed.error());
                    more = false;
                }
            }
        } finally {
            refresher.stop();
            release(owner);
            MDC.remove("consumerId");
        }
        return didWork;
    }

    private boolean advances(CursorState state, ProcessResult.Processed processed) {
        if (processed.ids().isEmpty()) {
            log.error("Processor reported an empty processed batch, aborting drain: consumerId={}", consumerId);
            return false;
        }
        boolean anyNew = processed.ids().stream()
            .anyMatch(id -> id > state.cursor() && !state.processedIds().contains(id));
        if (!anyNew) {
            log.error("Processor reported only already-consumed ids, aborting drain: consumerId={}, cursor={}, ids={}",
                consumerId, state.cursor(), processed.ids());
        }
        return anyNew;
    }

    private boolean persist(String owner, CursorState next) {
        if (cursors.saveProgress(consumerId, owner, next, clock.instant())) {
            log.debug("Cursor advanced: consumerId={}, cursor={}, pending={}",
                consumerId, next.cursor(), next.processedIds().size());
            return true;
        }
        log.warn("Cursor lock lost during drain, abandoning run: consumerId={}", consumerId);
        return false;
    }

    private void handleFailure(String owner, CursorState state, int retryCount, Exception error) {
        int newRetryCount = retryCount + 1;
        String message = describe(error);
        if (newRetryCount >= settings.maxRetries()) {
            deadLetterFirstPending(owner, state, message);
            return;
        }

        Instant now = clock.instant();
        Instant retryAfter = now.plus(settings.backoff().delayFor(newRetryCount));
        if (cursors.recordRetry(consumerId, owner, newRetryCount, retryAfter, message, now)) {
            metrics.incrementConsumerRetries(consumerId);
            log.warn("Consumer batch failed, retry scheduled: consumerId={}, retryCount={}, retryAfter={}, error={}",
                consumerId, newRetryCount, retryAfter, message);
        } else {
            log.warn("Cursor lock lost before recording failure: consumerId={}", consumerId);
        }
    }

    private void deadLetterFirstPending(String owner, CursorState state, String message) {
        OptionalLong eventId = outbox.nextEventId(state.cursor(), state.processedIds().ids());
        if (eventId.isEmpty()) {
            log.warn("Retries exhausted but no pending event to dead-letter: consumerId={}, cursor={}",
                consumerId, state.cursor());
            return;
        }

        long deadId = eventId.getAsLong();
        Instant now = clock.instant();
        CursorState advanced = Compaction.skip(state, deadId, now, settings.gapWindow());
        try {
            transactionTemplate.executeWithoutResult(status -> {
                cursors.insertDeadLetter(consumerId, deadId, message, now);
                if (!cursors.saveProgress(consumerId, owner, advanced, now)) {
                    throw new LeaseLostException("Cursor lock of " + consumerId + " lost while dead-lettering " + deadId);
                }
            });
        } catch (LeaseLostException e) {
            log.warn("{}", e.getMessage());
            return;
        }
        metrics.incrementConsumerDeadLetters(consumerId);
        log.error("Event moved to dead letters after retries exhausted: consumerId={}, eventId={}, cursor={}, error={}",
            consumerId, deadId, advanced.cursor(), message);
    }

    private void refresh(String owner) {
        Instant now = clock.instant();
        if (!cursors.refresh(consumerId, owner, now.plus(settings.lockDuration()), now)) {
            log.warn("Cursor lock refresh matched no row, lease lost: consumerId={}", consumerId);
        }
    }

    private void release(String owner) {
        try {
            cursors.release(consumerId, owner, clock.instant());
        } catch (DataAccessException e) {
            log.warn("Failed to release cursor lock, it will expire on its own: consumerId={}, error={}",
                consumerId, e.getMessage());
        }
    }

    static String describe(Exception error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
