package com.relaybox.infrastructure.health;

import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.application.port.out.QueueRepository;
import com.relaybox.application.port.out.TokenPoolRepository;
import com.relaybox.application.service.OutboxDispatcher;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;

/**
 * Reports lock and lease counts, the LISTEN connection state and connection pool
 * saturation. A saturated pool means engines cannot make progress.
 */
@Component("relay")
public class RelayHealthIndicator implements HealthIndicator {

    private final ConsumerCursorRepository cursorRepository;
    private final TokenPoolRepository tokenPoolRepository;
    private final QueueRepository queueRepository;
    private final OutboxDispatcher dispatcher;
    private final DataSource dataSource;
    private final Clock clock;

    public RelayHealthIndicator(
            ConsumerCursorRepository cursorRepository,
            TokenPoolRepository tokenPoolRepository,
            QueueRepository queueRepository,
            OutboxDispatcher dispatcher,
            DataSource dataSource,
            Clock clock) {
        this.cursorRepository = cursorRepository;
        this.tokenPoolRepository = tokenPoolRepository;
        this.queueRepository = queueRepository;
        this.dispatcher = dispatcher;
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Instant now = clock.instant();
        Health.Builder builder;
        try {
            builder = Health.up()
                .withDetail("heldCursorLocks", cursorRepository.countHeldLocks(now))
                .withDetail("activeQueueTokens", tokenPoolRepository.countActive(now))
                .withDetail("claimedMessages", queueRepository.countClaimed(now));
        } catch (DataAccessException e) {
            return Health.down(e).build();
        }

        NotificationSource.State state = dispatcher.state();
        builder.withDetail("dispatcher", state.name());

        if (dataSource instanceof HikariDataSource hikari && hikari.getHikariPoolMXBean() != null) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            int active = pool.getActiveConnections();
            int max = hikari.getMaximumPoolSize();
            int saturation = max > 0 ? active * 100 / max : 0;
            builder.withDetail("poolActive", active)
                .withDetail("poolMax", max)
                .withDetail("poolSaturationPercent", saturation);
            if (saturation >= 100) {
                builder.outOfService();
            }
        }
        return builder.build();
    }
}
