package com.relaybox.application.port.out;

import com.relaybox.domain.queue.QueueToken;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface TokenPoolRepository {

    /**
     * Leases one token for each of up to {@code limit} (queue, workspace) pairs that have
     * due messages and no active token, oldest due work first.
     */
    List<QueueToken> leaseTokens(Collection<String> queueNames, String leasedBy,
                                 Instant now, Instant leasedUntil, int limit);

    boolean renew(UUID tokenId, String leasedBy, Instant leasedUntil);

    void release(UUID tokenId, String leasedBy);

    int deleteExpired(Instant now);

    int countActive(Instant now);
}
