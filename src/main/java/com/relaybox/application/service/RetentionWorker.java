package com.relaybox.application.service;

import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * Deletes event log rows every configured consumer has moved past and that are older
 * than the retention window. Does nothing while any configured consumer has no cursor,
 * since it may later start from the beginning of the log.
 */
@Component
@ConditionalOnProperty(prefix = "app.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionWorker {

    private static final Logger log = LoggerFactory.getLogger(RetentionWorker.class);

    private final OutboxRepository outboxRepository;
    private final ConsumerCursorRepository cursorRepository;
    private final MetricsPort metrics;
    private final Clock clock;
    private final AppProperties.Retention settings;

    public RetentionWorker(
            OutboxRepository outboxRepository,
            ConsumerCursorRepository cursorRepository,
            MetricsPort metrics,
            Clock clock,
            AppProperties appProperties) {
        this.outboxRepository = outboxRepository;
        this.cursorRepository = cursorRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = appProperties.getRetention();
    }

    @Scheduled(fixedDelayString = "${app.retention.interval-ms:3600000}", initialDelayString = "${app.retention.interval-ms:3600000}")
    public void scheduledRun() {
        try {
            runOnce();
        } catch (DataAccessException e) {
            log.error("Retention run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Returns the number of rows deleted in this run.
     */
    public int runOnce() {
        List<String> consumerIds = settings.getConsumerIds();
        if (consumerIds.isEmpty()) {
            log.debug("Retention skipped: no consumer ids configured");
            return 0;
        }

        OptionalLong watermark = cursorRepository.findRetentionWatermark(consumerIds);
        if (watermark.isEmpty()) {
            log.warn("Retention skipped: not every configured consumer has a cursor, consumerIds={}", consumerIds);
            return 0;
        }

        Instant createdBefore = clock.instant().minus(Duration.ofHours(settings.getRetentionHours()));
        int total = 0;
        for (int batch = 0; batch < settings.getMaxBatchesPerRun(); batch++) {
            int deleted = outboxRepository.deleteRetained(watermark.getAsLong(), createdBefore, settings.getBatchSize());
            total += deleted;
            if (deleted < settings.getBatchSize()) {
                break;
            }
        }

        if (total > 0) {
            metrics.incrementRetentionDeleted(total);
            log.info("Retention deleted {} events: watermark={}, createdBefore={}", total, watermark.getAsLong(), createdBefore);
        } else {
            log.debug("Retention found nothing to delete: watermark={}", watermark.getAsLong());
        }
        return total;
    }
}
