package com.delta.casetracker.tracker.fetch;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

public record ArtifactFetchResult(
    String caseId,
    Path location,
    long bytesWritten,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static ArtifactFetchResult stored(String caseId, Path location, long bytesWritten, Instant startedAt) {
        Instant now = Instant.now();
        return new ArtifactFetchResult(caseId, location, bytesWritten, now, Duration.between(startedAt, now), null, null);
    }

    public static ArtifactFetchResult failed(String caseId, Instant startedAt, String errorCode, String errorMessage) {
        Instant now = Instant.now();
        return new ArtifactFetchResult(caseId, null, 0, now, Duration.between(startedAt, now), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }
}
