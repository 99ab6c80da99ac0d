package com.relaybox.adapter.in.notify;

import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.infrastructure.config.AppProperties;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Holds one pooled connection in {@code LISTEN} on the outbox channel and runs the
 * callback whenever notifications arrive. The connection is checked after a quiet period
 * so a silently dropped socket is noticed; on failure it reconnects with capped
 * exponential backoff. Each successful (re)connect also runs the callback, since
 * notifications sent while disconnected are lost.
 */
@Component
public class PostgresNotificationSource implements NotificationSource {

    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationSource.class);

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final int POLL_SLICE_MS = 500;

    private final DataSource dataSource;
    private final String channel;
    private final long keepaliveNanos;
    private final long reconnectInitialMs;
    private final long reconnectMaxMs;

    private volatile State state = State.STOPPED;
    private volatile boolean running;
    private Thread listenerThread;

    public PostgresNotificationSource(DataSource dataSource, AppProperties appProperties) {
        String configured = appProperties.getOutbox().getChannel();
        if (configured == null || !CHANNEL_NAME.matcher(configured).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + configured);
        }
        AppProperties.Dispatcher dispatcher = appProperties.getDispatcher();
        this.dataSource = dataSource;
        this.channel = configured;
        this.keepaliveNanos = TimeUnit.MILLISECONDS.toNanos(dispatcher.getKeepaliveMs());
        this.reconnectInitialMs = dispatcher.getReconnectInitialMs();
        this.reconnectMaxMs = dispatcher.getReconnectMaxMs();
    }

    @Override
    public synchronized void start(Runnable onNotification) {
        if (running) {
            throw new IllegalStateException("Notification source already started");
        }
        running = true;
        listenerThread = new Thread(() -> listenLoop(onNotification), "relay-listen-" + channel);
        listenerThread.setDaemon(true);
        listenerThread.start();
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = listenerThread;
            listenerThread = null;
        }
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        transition(State.STOPPED);
    }

    @Override
    public State state() {
        return state;
    }

    private void listenLoop(Runnable onNotification) {
        long reconnectDelayMs = reconnectInitialMs;
        transition(State.CONNECTING);
        while (running) {
            try (Connection connection = dataSource.getConnection()) {
                try (Statement statement = connection.createStatement()) {
                    statement.execute("LISTEN " + channel);
                }
                PGConnection pgConnection = connection.unwrap(PGConnection.class);
                transition(State.LISTENING);
                reconnectDelayMs = reconnectInitialMs;
                notifySafely(onNotification);
                receive(connection, pgConnection, onNotification);
            } catch (SQLException e) {
                if (!running) {
                    break;
                }
                transition(State.RECONNECTING);
                log.warn("Notification connection lost, reconnecting: channel={}, retryInMs={}, error={}",
                    channel, reconnectDelayMs, e.getMessage());
                if (!sleep(reconnectDelayMs)) {
                    break;
                }
                reconnectDelayMs = Math.min(reconnectDelayMs * 2, reconnectMaxMs);
            }
        }
        transition(State.STOPPED);
    }

    private void receive(Connection connection, PGConnection pgConnection, Runnable onNotification) throws SQLException {
        long lastActivity = System.nanoTime();
        while (running) {
            PGNotification[] notifications = pgConnection.getNotifications(POLL_SLICE_MS);
            long now = System.nanoTime();
            if (notifications != null && notifications.length > 0) {
                lastActivity = now;
                log.debug("Notifications received: channel={}, count={}", channel, notifications.length);
                notifySafely(onNotification);
            } else if (now - lastActivity >= keepaliveNanos) {
                try (Statement keepalive = connection.createStatement()) {
                    keepalive.execute("SELECT 1");
                }
                lastActivity = now;
            }
        }
    }

    private void notifySafely(Runnable onNotification) {
        try {
            onNotification.run();
        } catch (RuntimeException e) {
            log.error("Notification callback failed: {}", e.getMessage(), e);
        }
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void transition(State next) {
        State previous = state;
        state = next;
        if (previous != next) {
            log.info("Notification source {} -> {}: channel={}", previous, next, channel);
        }
    }
}
