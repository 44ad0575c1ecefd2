package com.delta.casetracker.tracker.model;

/**
 * Report framing for a run. BASELINE when the history was empty at load time.
 */
public enum RunMode {
    BASELINE,
    INCREMENTAL
}
