package com.relaybox.domain.cursor;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ids handled above the base cursor, each with the instant it was processed.
 * Immutable; every mutation returns a new instance.
 */
public final class ProcessedIds {

    private static final ProcessedIds EMPTY = new ProcessedIds(new TreeMap<>());

    private final NavigableMap<Long, Instant> entries;

    private ProcessedIds(NavigableMap<Long, Instant> entries) {
        this.entries = entries;
    }

    public static ProcessedIds empty() {
        return EMPTY;
    }

    public static ProcessedIds of(Map<Long, Instant> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        return new ProcessedIds(new TreeMap<>(entries));
    }

    public ProcessedIds with(List<Long> ids, Instant processedAt) {
        TreeMap<Long, Instant> merged = new TreeMap<>(entries);
        for (Long id : ids) {
            merged.put(id, processedAt);
        }
        return new ProcessedIds(merged);
    }

    public boolean contains(long id) {
        return entries.containsKey(id);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** Ids in ascending order. */
    public List<Long> ids() {
        return List.copyOf(entries.keySet());
    }

    public NavigableMap<Long, Instant> asMap() {
        return Collections.unmodifiableNavigableMap(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ProcessedIds other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ProcessedIds" + entries;
    }
}
