package com.delta.casetracker.tracker.model;

import java.time.Instant;

public record TrackerRunStatus(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    RunState state,
    RunStage lastStage,
    RunMode runMode,
    RunSummaryCounts counts,
    String notes
) {
}
