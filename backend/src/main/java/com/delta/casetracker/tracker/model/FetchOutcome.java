package com.delta.casetracker.tracker.model;

public enum FetchOutcome {
    FETCHED,
    SKIPPED_TOO_LARGE,
    FETCH_ERROR
}
