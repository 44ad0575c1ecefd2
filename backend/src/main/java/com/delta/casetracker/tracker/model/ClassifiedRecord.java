package com.delta.casetracker.tracker.model;

import java.util.List;

public record ClassifiedRecord(
    CaseRecord record,
    ChangeStatus status,
    List<String> changedFields,
    boolean admitted,
    String skipReason,
    FetchOutcome fetchOutcome,
    Long probedSizeBytes,
    String fetchError
) {
    public static final String SKIP_NEW_RECORD_LIMIT = "new-record-limit-exceeded";
    public static final String SKIP_TOO_LARGE = "artifact-exceeds-size-limit";
    public static final String SKIP_PROBE_FAILED = "artifact-probe-failed";
    public static final String SKIP_FETCH_FAILED = "artifact-fetch-failed";

    public ClassifiedRecord {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }

    public static ClassifiedRecord of(CaseRecord record, ChangeStatus status, List<String> changedFields) {
        return new ClassifiedRecord(record, status, changedFields, false, null, null, null, null);
    }

    public String id() {
        return record.id();
    }

    public ClassifiedRecord admit() {
        return new ClassifiedRecord(record, status, changedFields, true, null, fetchOutcome, probedSizeBytes, fetchError);
    }

    public ClassifiedRecord exclude(String reason) {
        return new ClassifiedRecord(record, status, changedFields, false, reason, fetchOutcome, probedSizeBytes, fetchError);
    }

    public ClassifiedRecord withFetch(FetchOutcome outcome, Long sizeBytes, String reason, String error) {
        return new ClassifiedRecord(record, status, changedFields, admitted, reason, outcome, sizeBytes, error);
    }
}
