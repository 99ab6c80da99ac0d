package com.relaybox.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Time source and the shared thread pools behind the relay's timers and consumer drains.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs tickers, debouncers and lease renewals. Also picked up by {@code @Scheduled}
     * for the retention and maintenance workers.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("relay-timer-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(4, threadFactory);
    }

    @Bean(name = "outboxDrainExecutor", destroyMethod = "shutdown")
    public ExecutorService outboxDrainExecutor(AppProperties appProperties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("relay-drain-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(appProperties.getCursor().getDrainPoolSize(), threadFactory);
    }
}
