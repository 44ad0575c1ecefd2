package com.delta.casetracker.tracker.api;

import com.delta.casetracker.tracker.collect.SnapshotCollectionException;
import com.delta.casetracker.tracker.history.HistoryStoreException;
import com.delta.casetracker.tracker.service.ActiveTrackerRunException;
import com.delta.casetracker.tracker.service.RunAbortedException;
import com.delta.casetracker.tracker.service.TrackerRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TrackerExceptionHandler {

  @ExceptionHandler(ActiveTrackerRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveTrackerRunException ex) {
    return error(HttpStatus.CONFLICT, "active_tracker_run", ex.getMessage());
  }

  @ExceptionHandler(RunAbortedException.class)
  public ResponseEntity<Map<String, String>> handleAborted(RunAbortedException ex) {
    return error(HttpStatus.CONFLICT, "run_aborted", ex.getMessage());
  }

  @ExceptionHandler(HistoryStoreException.class)
  public ResponseEntity<Map<String, String>> handleHistoryStore(HistoryStoreException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "history_store_failure", ex.getMessage());
  }

  @ExceptionHandler(TrackerRunException.class)
  public ResponseEntity<Map<String, String>> handleRunFailure(TrackerRunException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "tracker_run_failed", ex.getMessage());
  }

  @ExceptionHandler(SnapshotCollectionException.class)
  public ResponseEntity<Map<String, String>> handleCollection(SnapshotCollectionException ex) {
    return error(HttpStatus.BAD_GATEWAY, "snapshot_unavailable", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidSnapshot(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_snapshot", ex.getMessage());
  }

  private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? "" : message));
  }
}
