package com.delta.casetracker.tracker.history;

import com.delta.casetracker.tracker.model.HistoryEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * On-disk layout of the history file. Readers ignore fields they do not know so newer writers can add some.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryDocument(int formatVersion, SortedMap<String, HistoryEntry> entries) {
    public static final int CURRENT_FORMAT_VERSION = 1;

    public HistoryDocument {
        entries = entries == null ? new TreeMap<>() : new TreeMap<>(entries);
    }

    public static HistoryDocument of(CaseHistory history) {
        return new HistoryDocument(CURRENT_FORMAT_VERSION, history.entries());
    }
}
