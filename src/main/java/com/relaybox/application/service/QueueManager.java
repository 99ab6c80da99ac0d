package com.relaybox.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaybox.application.port.in.DeadLetterHook;
import com.relaybox.application.port.in.Job;
import com.relaybox.application.port.in.JobHandler;
import com.relaybox.application.port.in.QueueClient;
import com.relaybox.application.port.in.SendOptions;
import com.relaybox.application.port.out.CronRepository;
import com.relaybox.application.port.out.IdGenerator;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.QueueRepository;
import com.relaybox.application.port.out.QueueRepository.NewMessage;
import com.relaybox.application.port.out.TokenPoolRepository;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.CronTick;
import com.relaybox.domain.queue.QueueMessage;
import com.relaybox.domain.queue.QueueToken;
import com.relaybox.domain.queue.ScheduleResult;
import com.relaybox.infrastructure.concurrent.Backoff;
import com.relaybox.infrastructure.concurrent.DebounceWithMaxWait;
import com.relaybox.infrastructure.concurrent.Ticker;
import com.relaybox.infrastructure.config.AppProperties;
import com.relaybox.infrastructure.exception.LeaseLostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Multi-tenant job queue engine.
 *
 * <p>Each polling cycle leases up to {@code maxActiveTokens} tokens, one per
 * (queue, workspace) pair with due work, so a single busy workspace cannot occupy every
 * worker. Per token, a batch of messages is claimed in one statement, their claims are
 * renewed together on a ticker, and handlers run with bounded concurrency. When a token
 * finishes its slot is refilled after a short debounce; a cycle that finds no tokens
 * sleeps out the rest of the poll interval. Cron ticks are generated, leased and turned
 * into ordinary messages inside the same cycle.
 */
@Service
public class QueueManager implements QueueClient {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    private final QueueRepository queueRepository;
    private final TokenPoolRepository tokenPoolRepository;
    private final CronRepository cronRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate savepointTemplate;
    private final ObjectMapper objectMapper;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AppProperties.Queue settings;
    private final Backoff backoff;
    private final String managerId;

    private final Map<String, Registration> handlers = new ConcurrentHashMap<>();
    private final Map<UUID, Future<?>> activeTokens = new ConcurrentHashMap<>();
    private final Set<Future<?>> activeCronWork = ConcurrentHashMap.newKeySet();
    private final Object cycleMonitor = new Object();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final DebounceWithMaxWait refill;

    private final ExecutorService cycleExecutor;
    private final ExecutorService tokenExecutor;
    private final ExecutorService messageExecutor;
    private final ExecutorService cronExecutor;

    private volatile boolean started;
    private volatile boolean stopping;
    private volatile boolean cycleExhausted;

    public QueueManager(
            QueueRepository queueRepository,
            TokenPoolRepository tokenPoolRepository,
            CronRepository cronRepository,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock,
            ScheduledExecutorService scheduler,
            AppProperties appProperties) {
        this.queueRepository = queueRepository;
        this.tokenPoolRepository = tokenPoolRepository;
        this.cronRepository = cronRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.savepointTemplate = new TransactionTemplate(transactionManager);
        this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.objectMapper = objectMapper;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        this.settings = appProperties.getQueue();
        this.backoff = new Backoff(Duration.ofMillis(settings.getBaseBackoffMs()), Duration.ofMillis(settings.getMaxBackoffMs()));
        this.managerId = idGenerator.ownerToken("mgr");
        this.refill = new DebounceWithMaxWait(
            Duration.ofMillis(settings.getRefillDebounceMs()),
            Duration.ofMillis(Math.max(settings.getRefillDebounceMs(), settings.getPollIntervalMs())),
            scheduler,
            this::refillSlots);

        this.cycleExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("relay-queue-cycle-"));
        this.tokenExecutor = Executors.newFixedThreadPool(settings.getMaxActiveTokens(), new CustomizableThreadFactory("relay-queue-token-"));
        this.messageExecutor = Executors.newFixedThreadPool(
            settings.getMaxActiveTokens() * settings.getProcessingConcurrency(), new CustomizableThreadFactory("relay-queue-worker-"));
        this.cronExecutor = Executors.newFixedThreadPool(2, new CustomizableThreadFactory("relay-queue-cron-"));
    }

    // --- client API ---

    @Override
    public UUID send(String queueName, String workspaceId, Object payload, SendOptions options) {
        requireText(queueName, "queueName");
        requireText(workspaceId, "workspaceId");
        SendOptions effective = options != null ? options : SendOptions.none();

        UUID messageId = idGenerator.generate();
        Instant now = clock.instant();
        Instant processAfter = effective.processAfter() != null ? effective.processAfter() : now;
        UUID stored = queueRepository.insert(new NewMessage(
            messageId, queueName, workspaceId, toJson(payload), effective.dedupeKey(), processAfter, now));

        if (!stored.equals(messageId)) {
            log.info("Duplicate send ignored: queue={}, dedupeKey={}, messageId={}", queueName, effective.dedupeKey(), stored);
            return stored;
        }
        metrics.incrementMessagesEnqueued(queueName);
        log.debug("Message enqueued: queue={}, workspaceId={}, messageId={}, processAfter={}",
            queueName, workspaceId, messageId, processAfter);
        return messageId;
    }

    @Override
    public void schedule(String queueName, int intervalSeconds, Object payload, String workspaceId) {
        requireText(queueName, "queueName");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive");
        }
        ScheduleResult result = cronRepository.ensureSchedule(
            idGenerator.generate(), queueName, intervalSeconds, toJson(payload), workspaceId, clock.instant());
        if (result.created()) {
            log.info("Cron schedule created: scheduleId={}, queue={}, intervalSeconds={}, workspaceId={}",
                result.schedule().id(), queueName, intervalSeconds, workspaceId);
        } else {
            log.debug("Cron schedule updated: scheduleId={}, queue={}, intervalSeconds={}",
                result.schedule().id(), queueName, intervalSeconds);
        }
    }

    @Override
    public void registerHandler(String queueName, JobHandler handler, DeadLetterHook onDeadLetter) {
        requireText(queueName, "queueName");
        if (started) {
            throw new IllegalStateException("Cannot register handler for " + queueName + ": queue manager already started");
        }
        handlers.put(queueName, new Registration(handler, onDeadLetter));
    }

    // --- lifecycle ---

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Queue manager already started");
        }
        started = true;
        cycleExecutor.execute(this::pollLoop);
        log.info("Queue manager started: managerId={}, queues={}", managerId, handlers.keySet());
    }

    /**
     * Stops polling and waits up to the shutdown timeout for in-flight token and cron work.
     */
    public void stop() {
        synchronized (this) {
            if (stopping) {
                return;
            }
            stopping = true;
        }
        log.info("Queue manager stopping: activeTokens={}, activeCron={}", activeTokens.size(), activeCronWork.size());
        stopSignal.countDown();
        refill.cancel();
        synchronized (cycleMonitor) {
            cycleMonitor.notifyAll();
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getShutdownTimeoutMs());
        List<Future<?>> inFlight = new ArrayList<>(activeTokens.values());
        inFlight.addAll(activeCronWork);
        for (Future<?> work : inFlight) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                work.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.warn("Queue work ended with error during shutdown: {}", e.getCause().getMessage());
            }
        }
        long unfinished = inFlight.stream().filter(f -> !f.isDone()).count();
        if (unfinished > 0) {
            log.warn("Queue work did not finish before shutdown timeout: remaining={}, timeoutMs={}",
                unfinished, settings.getShutdownTimeoutMs());
        }

        cycleExecutor.shutdownNow();
        tokenExecutor.shutdown();
        messageExecutor.shutdown();
        cronExecutor.shutdown();
        log.info("Queue manager stopped: managerId={}", managerId);
    }

    public boolean isStarted() {
        return started && !stopping;
    }

    public int activeTokenCount() {
        return activeTokens.size();
    }

    public String managerId() {
        return managerId;
    }

    // --- polling cycle ---

    private void pollLoop() {
        long pollNanos = TimeUnit.MILLISECONDS.toNanos(settings.getPollIntervalMs());
        while (!stopping) {
            long cycleStart = System.nanoTime();
            try {
                runCycle();
            } catch (RuntimeException e) {
                log.error("Polling cycle failed: {}", e.getMessage(), e);
            }
            long sleepNanos = Math.max(0, pollNanos - (System.nanoTime() - cycleStart));
            try {
                if (stopSignal.await(sleepNanos, TimeUnit.NANOSECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    void runCycle() {
        if (stopping || handlers.isEmpty()) {
            return;
        }
        cycleExhausted = false;
        fillSlots();
        processCronTicks();
        awaitCycleComplete();
    }

    void fillSlots() {
        synchronized (activeTokens) {
            if (stopping || cycleExhausted) {
                return;
            }
            int slots = settings.getMaxActiveTokens() - activeTokens.size();
            if (slots <= 0) {
                return;
            }

            Instant now = clock.instant();
            List<QueueToken> tokens = tokenPoolRepository.leaseTokens(
                handlers.keySet(), managerId, now, now.plus(lockDuration()), slots);
            if (tokens.isEmpty()) {
                cycleExhausted = true;
                log.debug("No claimable tokens, cycle exhausted");
                return;
            }

            log.debug("Tokens leased: count={}, active={}", tokens.size(), activeTokens.size());
            for (QueueToken token : tokens) {
                FutureTask<Void> task = new FutureTask<>(() -> {
                    try {
                        processToken(token);
                    } finally {
                        activeTokens.remove(token.id());
                        synchronized (cycleMonitor) {
                            cycleMonitor.notifyAll();
                        }
                        if (!stopping && !cycleExhausted) {
                            refill.trigger();
                        }
                    }
                }, null);
                activeTokens.put(token.id(), task);
                try {
                    tokenExecutor.execute(task);
                } catch (RejectedExecutionException e) {
                    activeTokens.remove(token.id());
                    releaseToken(token);
                }
            }
        }
    }

    private void refillSlots() {
        try {
            fillSlots();
        } catch (RuntimeException e) {
            log.error("Refilling token slots failed, cycle marked exhausted: {}", e.getMessage(), e);
            cycleExhausted = true;
        }
    }

    private void awaitCycleComplete() {
        synchronized (cycleMonitor) {
            while (!activeTokens.isEmpty() && !stopping) {
                try {
                    cycleMonitor.wait(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    // --- token processing ---

    void processToken(QueueToken token) {
        Ticker renewal = new Ticker("token-renewal-" + token.id(), refreshInterval(), scheduler);
        MDC.put("queue", token.queueName());
        MDC.put("workspaceId", token.workspaceId());
        try {
            renewal.start(() -> {
                if (!tokenPoolRepository.renew(token.id(), managerId, clock.instant().plus(lockDuration()))) {
                    log.warn("Token lease lost: tokenId={}, queue={}, workspaceId={}", token.id(), token.queueName(), token.workspaceId());
                }
            });
            processMessagesForToken(token);
        } catch (RuntimeException e) {
            log.error("Token processing failed: tokenId={}, queue={}, workspaceId={}, error={}",
                token.id(), token.queueName(), token.workspaceId(), e.getMessage(), e);
        } finally {
            renewal.stop();
            releaseToken(token);
            MDC.remove("queue");
            MDC.remove("workspaceId");
        }
    }

    private void processMessagesForToken(QueueToken token) {
        String workerId = idGenerator.ownerToken("wkr");
        Instant now = clock.instant();
        List<QueueMessage> messages = queueRepository.claimBatch(
            token.queueName(), token.workspaceId(), workerId, now, now.plus(lockDuration()), settings.getClaimBatchSize());
        if (messages.isEmpty()) {
            return;
        }
        log.debug("Messages claimed: count={}, queue={}, workspaceId={}", messages.size(), token.queueName(), token.workspaceId());

        Set<UUID> unfinished = ConcurrentHashMap.newKeySet();
        messages.forEach(m -> unfinished.add(m.id()));
        Ticker claimRenewal = new Ticker("claim-renewal-" + workerId, refreshInterval(), scheduler);
        claimRenewal.start(() -> {
            if (!unfinished.isEmpty()) {
                int renewed = queueRepository.renewClaims(List.copyOf(unfinished), workerId, clock.instant().plus(lockDuration()));
                log.debug("Claims renewed: renewed={}, requested={}", renewed, unfinished.size());
            }
        });

        Semaphore limiter = new Semaphore(settings.getProcessingConcurrency());
        List<Future<?>> running = new ArrayList<>(messages.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            for (QueueMessage message : messages) {
                limiter.acquire();
                try {
                    running.add(messageExecutor.submit(() -> {
                        if (mdc != null) {
                            MDC.setContextMap(mdc);
                        }
                        try {
                            processMessage(message, workerId);
                        } finally {
                            unfinished.remove(message.id());
                            limiter.release();
                            MDC.clear();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    limiter.release();
                    throw e;
                }
            }
            for (Future<?> future : running) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while processing token: tokenId={}", token.id());
        } catch (ExecutionException e) {
            log.error("Message worker failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
        } finally {
            claimRenewal.stop();
        }
    }

    void processMessage(QueueMessage message, String workerId) {
        Registration registration = handlers.get(message.queueName());
        if (registration == null) {
            log.error("No handler for claimed message: messageId={}, queue={}", message.id(), message.queueName());
            return;
        }

        Job job = toJob(message);
        long startNanos = System.nanoTime();
        metrics.messageStarted();
        try {
            registration.handler().handle(job);
        } catch (Exception e) {
            recordHandlerDuration(message, startNanos);
            onFailure(message, workerId, job, e, registration.onDeadLetter());
            return;
        } finally {
            metrics.messageFinished();
        }
        recordHandlerDuration(message, startNanos);

        try {
            queueRepository.complete(message.id(), workerId, clock.instant());
            metrics.incrementMessagesCompleted(message.queueName());
            log.debug("Message completed: messageId={}, queue={}", message.id(), message.queueName());
        } catch (LeaseLostException e) {
            log.warn("Message finished after its claim was lost: messageId={}, queue={}", message.id(), message.queueName());
        } catch (RuntimeException e) {
            log.error("Failed to mark message completed: messageId={}, error={}", message.id(), e.getMessage(), e);
        }
    }

    private void onFailure(QueueMessage message, String workerId, Job job, Exception error, DeadLetterHook hook) {
        int failedCount = message.failedCount() + 1;
        String reason = CursorLock.describe(error);
        try {
            if (failedCount >= settings.getMaxRetries()) {
                deadLetter(message, workerId, job, error, reason, hook);
                metrics.incrementMessagesDeadLettered(message.queueName());
                log.error("Message moved to dead letters after retries exhausted: messageId={}, queue={}, workspaceId={}, failedCount={}, error={}",
                    message.id(), message.queueName(), message.workspaceId(), failedCount, reason);
            } else {
                Instant retryAt = clock.instant().plus(backoff.delayFor(failedCount));
                queueRepository.fail(message.id(), workerId, reason, retryAt);
                metrics.incrementMessagesRetried(message.queueName());
                log.warn("Message failed, retry scheduled: messageId={}, queue={}, failedCount={}, retryAt={}, error={}",
                    message.id(), message.queueName(), failedCount, retryAt, reason);
            }
        } catch (LeaseLostException e) {
            log.warn("Message claim lost before its failure was recorded: messageId={}, queue={}", message.id(), message.queueName());
        } catch (RuntimeException e) {
            log.error("Failed to record message failure: messageId={}, error={}", message.id(), e.getMessage(), e);
        }
    }

    private void deadLetter(QueueMessage message, String workerId, Job job, Exception error, String reason, DeadLetterHook hook) {
        Instant now = clock.instant();
        if (hook == null) {
            queueRepository.markDeadLettered(message.id(), workerId, reason, now);
            return;
        }
        transactionTemplate.executeWithoutResult(status -> {
            queueRepository.markDeadLettered(message.id(), workerId, reason, now);
            try {
                savepointTemplate.executeWithoutResult(savepoint -> hook.onDeadLetter(job, error));
            } catch (RuntimeException hookError) {
                log.error("Dead-letter hook failed, dead-letter transition still commits: messageId={}, queue={}, error={}",
                    message.id(), message.queueName(), hookError.getMessage(), hookError);
            }
        });
    }

    private void releaseToken(QueueToken token) {
        try {
            tokenPoolRepository.release(token.id(), managerId);
        } catch (LeaseLostException e) {
            log.warn("Token already gone at release: tokenId={}", token.id());
        } catch (RuntimeException e) {
            log.warn("Failed to release token, it will expire: tokenId={}, error={}", token.id(), e.getMessage());
        }
    }

    // --- cron ---

    void processCronTicks() {
        if (stopping) {
            return;
        }
        Instant now = clock.instant();
        try {
            List<CronTick> generated = cronRepository.generateTicks(
                now, Duration.ofSeconds(settings.getCronLookaheadSeconds()), settings.getCronLeaseLimit());
            if (!generated.isEmpty()) {
                log.debug("Cron ticks generated: count={}", generated.size());
            }
        } catch (RuntimeException e) {
            log.error("Cron tick generation failed: {}", e.getMessage(), e);
        }

        List<CronTick> ticks = cronRepository.leaseTicks(managerId, now, now.plus(lockDuration()), settings.getCronLeaseLimit());
        for (CronTick tick : ticks) {
            FutureTask<Void> task = new FutureTask<>(() -> executeTick(tick), null);
            activeCronWork.add(task);
            try {
                cronExecutor.execute(() -> {
                    try {
                        task.run();
                    } finally {
                        activeCronWork.remove(task);
                    }
                });
            } catch (RejectedExecutionException e) {
                activeCronWork.remove(task);
            }
        }
    }

    void executeTick(CronTick tick) {
        try {
            String workspaceId = tick.workspaceId() != null ? tick.workspaceId() : CronSchedule.SYSTEM_WORKSPACE;
            Instant now = clock.instant();
            UUID candidateId = idGenerator.generate();
            UUID messageId = queueRepository.insert(new NewMessage(
                candidateId, tick.queueName(), workspaceId, tick.payload(),
                "cron:" + tick.id(), tick.executeAt(), now));
            if (messageId.equals(candidateId)) {
                metrics.incrementMessagesEnqueued(tick.queueName());
            }
            log.debug("Cron tick enqueued: scheduleId={}, queue={}, executeAt={}, messageId={}",
                tick.scheduleId(), tick.queueName(), tick.executeAt(), messageId);
        } catch (RuntimeException e) {
            log.error("Cron tick execution failed: scheduleId={}, tickId={}, error={}", tick.scheduleId(), tick.id(), e.getMessage(), e);
        } finally {
            try {
                cronRepository.deleteTick(tick.id(), managerId);
            } catch (RuntimeException e) {
                log.warn("Failed to delete cron tick: tickId={}, error={}", tick.id(), e.getMessage());
            }
        }
    }

    // --- helpers ---

    private Job toJob(QueueMessage message) {
        JsonNode data;
        try {
            data = objectMapper.readTree(message.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not JSON: " + message.id(), e);
        }
        return new Job(message.id(), message.queueName(), message.workspaceId(), data, message.failedCount(), message.insertedAt());
    }

    private String toJson(Object payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private void recordHandlerDuration(QueueMessage message, long startNanos) {
        metrics.recordHandlerDuration(message.queueName(), Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private Duration lockDuration() {
        return Duration.ofMillis(settings.getLockDurationMs());
    }

    private Duration refreshInterval() {
        return Duration.ofMillis(settings.getRefreshIntervalMs());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private record Registration(JobHandler handler, DeadLetterHook onDeadLetter) {}
}
