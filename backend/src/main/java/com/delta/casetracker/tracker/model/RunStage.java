package com.delta.casetracker.tracker.model;

/**
 * Per-run state machine. PERSISTED and ABORTED are terminal.
 */
public enum RunStage {
    STARTED,
    LOADED,
    CLASSIFIED,
    LIMIT_APPLIED,
    PLANNED,
    RECONCILED,
    PERSISTED,
    ABORTED
}
