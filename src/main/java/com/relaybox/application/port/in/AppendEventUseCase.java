package com.relaybox.application.port.in;

import com.relaybox.domain.event.EventPayload;
import com.relaybox.domain.event.OutboxEvent;

public interface AppendEventUseCase {

    /**
     * Appends an event in the caller's transaction. Consumers are woken once it commits.
     */
    OutboxEvent append(EventPayload payload);
}
