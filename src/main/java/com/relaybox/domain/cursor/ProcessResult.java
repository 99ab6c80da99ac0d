package com.relaybox.domain.cursor;

import java.util.List;

/**
 * Outcome of one batch handed to a cursor lock drain loop.
 */
public sealed interface ProcessResult {

    record Processed(List<Long> ids) implements ProcessResult {
        public Processed {
            ids = List.copyOf(ids);
        }
    }

    record NoEvents() implements ProcessResult {
    }

    /** Processing failed; {@code processedIds} holds the ids handled before the failure. */
    record Failed(Exception error, List<Long> processedIds) implements ProcessResult {
        public Failed {
            processedIds = processedIds == null ? List.of() : List.copyOf(processedIds);
        }
    }

    static ProcessResult processed(List<Long> ids) {
        return new Processed(ids);
    }

    static ProcessResult noEvents() {
        return new NoEvents();
    }

    static ProcessResult failed(Exception error, List<Long> processedIds) {
        return new Failed(error, processedIds);
    }
}
