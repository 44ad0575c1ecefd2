package com.delta.casetracker.tracker.service;

public class RunAbortedException extends TrackerRunException {
    public RunAbortedException(String message) {
        super(message);
    }
}
