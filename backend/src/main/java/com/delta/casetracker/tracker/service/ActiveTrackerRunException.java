package com.delta.casetracker.tracker.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveTrackerRunException extends TrackerRunException {
    public ActiveTrackerRunException(String message) {
        super(message);
    }

    public ActiveTrackerRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
