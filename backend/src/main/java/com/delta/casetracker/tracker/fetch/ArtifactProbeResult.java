package com.delta.casetracker.tracker.fetch;

public record ArtifactProbeResult(
    String caseId,
    Long sizeBytes,
    String errorCode,
    String errorMessage
) {
    public static ArtifactProbeResult ofSize(String caseId, long sizeBytes) {
        return new ArtifactProbeResult(caseId, sizeBytes, null, null);
    }

    public static ArtifactProbeResult failed(String caseId, String errorCode, String errorMessage) {
        return new ArtifactProbeResult(caseId, null, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null && sizeBytes != null && sizeBytes >= 0;
    }
}
