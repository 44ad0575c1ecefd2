package com.delta.casetracker.tracker.model;

public enum ChangeStatus {
    NEW,
    UPDATED,
    UNCHANGED
}
