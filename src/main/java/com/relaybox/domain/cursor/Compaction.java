package com.relaybox.domain.cursor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Folds processed ids into the base cursor once they have aged past the gap window.
 *
 * <p>Ids allocated by a sequence become visible at commit time, so a higher id can be
 * read before a lower one. Processed ids are therefore kept aside for the gap window
 * and only then folded into the cursor. Contiguous ids fold immediately. An entry is
 * safe once it is strictly older than the window.
 */
public final class Compaction {

    private Compaction() {
    }

    public static CursorState compact(CursorState state, List<Long> newIds, Instant now, Duration gapWindow) {
        ProcessedIds merged = state.processedIds().with(newIds, now);
        return fold(state.cursor(), merged.asMap(), now.minus(gapWindow));
    }

    /**
     * Moves the cursor past a dead-lettered id. Only that id is treated as already
     * outside the gap window; the other pending ids keep their timestamps.
     */
    public static CursorState skip(CursorState state, long deadLetteredId, Instant now, Duration gapWindow) {
        TreeMap<Long, Instant> merged = new TreeMap<>(state.processedIds().asMap());
        merged.put(deadLetteredId, Instant.MIN);
        return fold(state.cursor(), merged, now.minus(gapWindow));
    }

    private static CursorState fold(long cursor, NavigableMap<Long, Instant> entries, Instant cutoff) {
        long base = cursor;
        for (Map.Entry<Long, Instant> entry : entries.entrySet()) {
            if (entry.getValue().isBefore(cutoff) && entry.getKey() > base) {
                base = entry.getKey();
            }
        }

        TreeMap<Long, Instant> remaining = new TreeMap<>(entries.tailMap(base, false));
        while (remaining.containsKey(base + 1)) {
            remaining.remove(base + 1);
            base++;
        }
        return new CursorState(base, ProcessedIds.of(remaining));
    }
}
