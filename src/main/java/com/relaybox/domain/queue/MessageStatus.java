package com.relaybox.domain.queue;

public enum MessageStatus {
    PENDING,
    CLAIMED,
    RETRYING,
    COMPLETED,
    DEAD_LETTERED
}
