package com.delta.casetracker.tracker.model;

import java.time.Instant;
import java.util.List;

/**
 * What reporting and notification consume after a persisted run.
 */
public record TrackerRunReport(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    RunState state,
    RunMode runMode,
    RunSummaryCounts counts,
    List<ClassifiedRecord> records
) {
    public List<ClassifiedRecord> skipped() {
        return records.stream()
            .filter(record -> record.skipReason() != null)
            .toList();
    }
}
