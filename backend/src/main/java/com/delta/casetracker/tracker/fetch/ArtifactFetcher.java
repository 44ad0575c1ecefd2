package com.delta.casetracker.tracker.fetch;

/**
 * Collaborator that knows how to size and retrieve the document bundle of a case. The tracker only calls it for
 * admitted records and at most once per method per record in a run.
 */
public interface ArtifactFetcher {

    ArtifactProbeResult probeSize(String caseId);

    ArtifactFetchResult materialize(String caseId);
}
