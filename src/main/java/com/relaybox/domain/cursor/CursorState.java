package com.relaybox.domain.cursor;

/**
 * Base cursor plus the processed ids above it. Every id in {@code processedIds} is
 * strictly greater than {@code cursor}.
 */
public record CursorState(long cursor, ProcessedIds processedIds) {

    public CursorState {
        if (processedIds == null) {
            processedIds = ProcessedIds.empty();
        }
    }

    public static CursorState at(long cursor) {
        return new CursorState(cursor, ProcessedIds.empty());
    }
}
