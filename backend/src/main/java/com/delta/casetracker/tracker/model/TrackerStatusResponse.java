package com.delta.casetracker.tracker.model;

public record TrackerStatusResponse(
    String historyPath,
    boolean historyPresent,
    int historyEntries,
    boolean runInProgress,
    TrackerRunStatus lastRun
) {
}
