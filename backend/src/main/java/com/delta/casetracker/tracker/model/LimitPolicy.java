package com.delta.casetracker.tracker.model;

/**
 * Per-run resource limits. A {@code maxNewPerRun} of zero pauses new intake.
 */
public record LimitPolicy(int maxNewPerRun, long maxArtifactSizeBytes) {
    public LimitPolicy {
        if (maxArtifactSizeBytes <= 0) {
            throw new IllegalArgumentException("maxArtifactSizeBytes must be positive, was " + maxArtifactSizeBytes);
        }
        maxNewPerRun = Math.max(0, maxNewPerRun);
    }
}
