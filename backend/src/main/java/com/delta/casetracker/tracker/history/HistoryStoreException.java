package com.delta.casetracker.tracker.history;

import com.delta.casetracker.tracker.service.TrackerRunException;

public class HistoryStoreException extends TrackerRunException {
    public HistoryStoreException(String message) {
        super(message);
    }

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
