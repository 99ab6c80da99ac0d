package com.relaybox.application.service;

import com.relaybox.application.port.in.OutboxConsumer;
import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.domain.cursor.CursorState;
import com.relaybox.domain.cursor.ProcessResult;
import com.relaybox.domain.event.OutboxEvent;
import com.relaybox.infrastructure.concurrent.DebounceWithMaxWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base of event log consumers: debounced wake-ups, one drain at a time per process,
 * batches handled event by event under the consumer's cursor lock.
 *
 * <p>Subclasses implement {@link #handle(OutboxEvent)}. It must be idempotent: an event
 * is redelivered if the process dies before its batch is recorded.
 */
public abstract class AbstractOutboxConsumer implements OutboxConsumer {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String consumerId;
    private final boolean startFromLatest;
    private final OutboxRepository outboxRepository;
    private final ConsumerCursorRepository cursorRepository;
    private final ExecutorService drainExecutor;
    private final CursorLock cursorLock;
    private final DebounceWithMaxWait debouncer;
    private final int batchSize;

    private final ReentrantLock drainLock = new ReentrantLock();
    private final AtomicBoolean rerunRequested = new AtomicBoolean();
    private volatile boolean stopped;

    protected AbstractOutboxConsumer(String consumerId, boolean startFromLatest, OutboxConsumerSupport support) {
        this.consumerId = consumerId;
        this.startFromLatest = startFromLatest;
        this.outboxRepository = support.outboxRepository();
        this.cursorRepository = support.cursorRepository();
        this.drainExecutor = support.drainExecutor();
        this.cursorLock = support.newCursorLock(consumerId);
        this.debouncer = support.newDebouncer(this::scheduleDrain);
        this.batchSize = support.batchSize();
    }

    /**
     * Applies one event. Throwing stops the batch; events handled before it still count.
     */
    protected abstract void handle(OutboxEvent event) throws Exception;

    @Override
    public String consumerId() {
        return consumerId;
    }

    @Override
    public void initialize() {
        if (startFromLatest) {
            cursorRepository.ensureFromLatest(consumerId);
        } else {
            cursorRepository.ensure(consumerId, 0);
        }
        log.info("Consumer initialized: consumerId={}, startFromLatest={}", consumerId, startFromLatest);
    }

    @Override
    public void wake() {
        if (!stopped) {
            debouncer.trigger();
        }
    }

    @Override
    public void shutdown() {
        stopped = true;
        debouncer.cancel();
        // Waits for a running drain
        drainLock.lock();
        drainLock.unlock();
    }

    private void scheduleDrain() {
        if (stopped) {
            return;
        }
        try {
            drainExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.debug("Drain rejected, executor shutting down: consumerId={}", consumerId);
        }
    }

    void drain() {
        if (!drainLock.tryLock()) {
            rerunRequested.set(true);
            return;
        }
        try {
            boolean again;
            do {
                rerunRequested.set(false);
                boolean didWork = cursorLock.run(this::processBatch);
                again = !stopped && (didWork || rerunRequested.get());
            } while (again);
        } catch (RuntimeException e) {
            log.error("Drain failed: consumerId={}, error={}", consumerId, e.getMessage(), e);
        } finally {
            drainLock.unlock();
        }
        if (rerunRequested.get()) {
            wake();
        }
    }

    ProcessResult processBatch(CursorState state) {
        // Storage errors propagate so they never count against the cursor's retry state.
        List<OutboxEvent> events = outboxRepository.fetchAfter(state.cursor(), batchSize, state.processedIds().ids());
        if (events.isEmpty()) {
            return ProcessResult.noEvents();
        }

        List<Long> done = new ArrayList<>(events.size());
        for (OutboxEvent event : events) {
            try {
                handle(event);
                done.add(event.id());
            } catch (Exception e) {
                log.warn("Event handling failed: consumerId={}, eventId={}, eventType={}, error={}",
                    consumerId, event.id(), event.eventType(), e.getMessage());
                return ProcessResult.failed(e, done);
            }
        }
        log.debug("Batch processed: consumerId={}, count={}, lastId={}", consumerId, done.size(), done.get(done.size() - 1));
        return ProcessResult.processed(done);
    }
}
