package com.relaybox.application.port.out;

import com.relaybox.domain.event.EventPayload;
import com.relaybox.domain.event.OutboxEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;

public interface OutboxRepository {

    /**
     * Inserts the event and queues a wake-up notification. Runs in the caller's
     * transaction; the notification is delivered when that transaction commits.
     */
    OutboxEvent append(EventPayload payload);

    /**
     * Events with id greater than {@code afterId} and not in {@code excludeIds},
     * ascending by id, at most {@code limit}.
     */
    List<OutboxEvent> fetchAfter(long afterId, int limit, Collection<Long> excludeIds);

    /**
     * Id of the first event after {@code afterId} not in {@code excludeIds}. Reads the id
     * column only, so it works for rows whose payload cannot be decoded.
     */
    OptionalLong nextEventId(long afterId, Collection<Long> excludeIds);

    long latestId();

    /**
     * Deletes at most {@code limit} events with id at or below {@code watermark}
     * created before {@code createdBefore}. Returns the number deleted.
     */
    int deleteRetained(long watermark, Instant createdBefore, int limit);

    long count();
}
