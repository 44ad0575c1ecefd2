package com.delta.casetracker.tracker.collect;

public class SnapshotCollectionException extends RuntimeException {
    public SnapshotCollectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public SnapshotCollectionException(String message) {
        super(message);
    }
}
