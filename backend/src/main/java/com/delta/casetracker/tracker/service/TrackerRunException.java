package com.delta.casetracker.tracker.service;

/**
 * Run-level failure. The durable history is left exactly as it was before the run, so the run can be retried.
 */
public class TrackerRunException extends RuntimeException {
    public TrackerRunException(String message) {
        super(message);
    }

    public TrackerRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
