package com.relaybox.application.service;

import com.relaybox.application.port.out.CronRepository;
import com.relaybox.application.port.out.QueueRepository;
import com.relaybox.application.port.out.TokenPoolRepository;
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

/**
 * Garbage collection for the job queue: finished messages past retention, expired
 * tokens, and cron ticks that expired or lost their schedule.
 */
@Component
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueMaintenanceWorker {

    private static final Logger log = LoggerFactory.getLogger(QueueMaintenanceWorker.class);

    private final QueueRepository queueRepository;
    private final TokenPoolRepository tokenPoolRepository;
    private final CronRepository cronRepository;
    private final Clock clock;
    private final AppProperties appProperties;

    public QueueMaintenanceWorker(
            QueueRepository queueRepository,
            TokenPoolRepository tokenPoolRepository,
            CronRepository cronRepository,
            Clock clock,
            AppProperties appProperties) {
        this.queueRepository = queueRepository;
        this.tokenPoolRepository = tokenPoolRepository;
        this.cronRepository = cronRepository;
        this.clock = clock;
        this.appProperties = appProperties;
    }

    @Scheduled(fixedDelayString = "${app.maintenance.interval-ms:600000}", initialDelayString = "${app.maintenance.interval-ms:600000}")
    public void scheduledRun() {
        try {
            runOnce();
        } catch (DataAccessException e) {
            log.error("Queue maintenance failed: {}", e.getMessage(), e);
        }
    }

    public MaintenanceReport runOnce() {
        AppProperties.Maintenance settings = appProperties.getMaintenance();
        Instant now = clock.instant();

        int completed = queueRepository.deleteCompletedBefore(now.minus(Duration.ofHours(settings.getCompletedRetentionHours())));
        int deadLettered = queueRepository.deleteDeadLetteredBefore(now.minus(Duration.ofHours(settings.getDeadLetterRetentionHours())));
        int tokens = tokenPoolRepository.deleteExpired(now);
        // an abandoned tick gets one more lease period to be picked up again
        int expiredTicks = cronRepository.deleteExpiredTicks(now.minus(Duration.ofMillis(appProperties.getQueue().getLockDurationMs())));
        int orphanedTicks = cronRepository.deleteOrphanedTicks();

        MaintenanceReport report = new MaintenanceReport(completed, deadLettered, tokens, expiredTicks, orphanedTicks);
        if (report.total() > 0) {
            log.info("Queue maintenance: completedMessages={}, deadLetteredMessages={}, expiredTokens={}, expiredTicks={}, orphanedTicks={}",
                completed, deadLettered, tokens, expiredTicks, orphanedTicks);
        }
        return report;
    }

    public record MaintenanceReport(
        int completedMessages,
        int deadLetteredMessages,
        int expiredTokens,
        int expiredTicks,
        int orphanedTicks
    ) {
        public int total() {
            return completedMessages + deadLetteredMessages + expiredTokens + expiredTicks + orphanedTicks;
        }
    }
}
