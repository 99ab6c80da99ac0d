package com.relaybox.application.port.out;

/**
 * A single long-lived subscription to the event log's wake-up channel.
 */
public interface NotificationSource {

    void start(Runnable onNotification);

    void stop();

    State state();

    enum State {
        STOPPED,
        CONNECTING,
        LISTENING,
        RECONNECTING
    }
}
