package com.delta.casetracker.tracker.model;

public enum RunState {
    RUNNING,
    PERSISTED,
    ABORTED
}
