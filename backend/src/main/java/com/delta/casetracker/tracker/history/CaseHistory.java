package com.delta.casetracker.tracker.history;

import com.delta.casetracker.tracker.model.HistoryEntry;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable id to entry view of the tracked cases. A run never mutates the loaded value; it builds a
 * replacement and hands that to {@link JsonHistoryRepository#replace(CaseHistory)}.
 */
public final class CaseHistory {
    private static final CaseHistory EMPTY = new CaseHistory(new TreeMap<>());

    private final SortedMap<String, HistoryEntry> entries;

    private CaseHistory(SortedMap<String, HistoryEntry> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public static CaseHistory empty() {
        return EMPTY;
    }

    public static CaseHistory of(Map<String, HistoryEntry> entries) {
        TreeMap<String, HistoryEntry> copy = new TreeMap<>();
        if (entries != null) {
            for (Map.Entry<String, HistoryEntry> entry : entries.entrySet()) {
                HistoryEntry value = entry.getValue();
                if (value == null) {
                    throw new IllegalArgumentException("History entry for key " + entry.getKey() + " is null");
                }
                String id = value.record().id();
                if (!id.equals(entry.getKey())) {
                    throw new IllegalArgumentException(
                        "History key " + entry.getKey() + " does not match record id " + id
                    );
                }
                copy.put(id, value);
            }
        }
        return new CaseHistory(copy);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public HistoryEntry get(String id) {
        return entries.get(id);
    }

    public SortedMap<String, HistoryEntry> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CaseHistory that)) {
            return false;
        }
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "CaseHistory{size=" + entries.size() + "}";
    }
}
