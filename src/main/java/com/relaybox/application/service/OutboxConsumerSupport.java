package com.relaybox.application.service;

import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.IdGenerator;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.infrastructure.concurrent.DebounceWithMaxWait;
import com.relaybox.infrastructure.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Everything an event log consumer needs, bundled so subclasses take one constructor argument.
 */
@Component
public class OutboxConsumerSupport {

    private final OutboxRepository outboxRepository;
    private final ConsumerCursorRepository cursorRepository;
    private final TransactionTemplate transactionTemplate;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService drainExecutor;
    private final AppProperties appProperties;

    public OutboxConsumerSupport(
            OutboxRepository outboxRepository,
            ConsumerCursorRepository cursorRepository,
            PlatformTransactionManager transactionManager,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock,
            ScheduledExecutorService scheduler,
            @Qualifier("outboxDrainExecutor") ExecutorService drainExecutor,
            AppProperties appProperties) {
        this.outboxRepository = outboxRepository;
        this.cursorRepository = cursorRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        this.drainExecutor = drainExecutor;
        this.appProperties = appProperties;
    }

    public CursorLock newCursorLock(String consumerId) {
        return new CursorLock(consumerId, cursorRepository, outboxRepository, transactionTemplate,
            idGenerator, metrics, clock, scheduler, CursorLockSettings.from(appProperties.getCursor()));
    }

    public DebounceWithMaxWait newDebouncer(Runnable action) {
        AppProperties.Cursor cursor = appProperties.getCursor();
        return new DebounceWithMaxWait(
            Duration.ofMillis(cursor.getDebounceMs()),
            Duration.ofMillis(cursor.getMaxWaitMs()),
            scheduler,
            action);
    }

    public OutboxRepository outboxRepository() {
        return outboxRepository;
    }

    public ConsumerCursorRepository cursorRepository() {
        return cursorRepository;
    }

    public ExecutorService drainExecutor() {
        return drainExecutor;
    }

    public int batchSize() {
        return appProperties.getOutbox().getBatchSize();
    }
}
