package com.delta.casetracker.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Last known state of a case plus the run timestamps that observed it.
 * Holds {@code firstSeenAt <= lastUpdatedAt <= lastSeenAt}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryEntry(
    CaseRecord record,
    String fingerprint,
    Instant firstSeenAt,
    Instant lastSeenAt,
    Instant lastUpdatedAt
) {
    public HistoryEntry {
        if (record == null) {
            throw new IllegalArgumentException("History entry requires a record");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            fingerprint = record.fingerprint();
        }
        if (firstSeenAt == null || lastSeenAt == null || lastUpdatedAt == null) {
            throw new IllegalArgumentException("History entry timestamps are required for " + record.id());
        }
        if (lastUpdatedAt.isBefore(firstSeenAt) || lastSeenAt.isBefore(lastUpdatedAt)) {
            throw new IllegalArgumentException(
                "History entry timestamps out of order for " + record.id()
                    + " (firstSeenAt=" + firstSeenAt
                    + ", lastUpdatedAt=" + lastUpdatedAt
                    + ", lastSeenAt=" + lastSeenAt + ")"
            );
        }
    }

    public static HistoryEntry firstObservation(CaseRecord record, Instant now) {
        return new HistoryEntry(record, record.fingerprint(), now, now, now);
    }

    public HistoryEntry updated(CaseRecord current, Instant now) {
        return new HistoryEntry(current, current.fingerprint(), firstSeenAt, now, now);
    }

    public HistoryEntry seenAgain(CaseRecord current, Instant now) {
        return new HistoryEntry(current, current.fingerprint(), firstSeenAt, now, lastUpdatedAt);
    }
}
