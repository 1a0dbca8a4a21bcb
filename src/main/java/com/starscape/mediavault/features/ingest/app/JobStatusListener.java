package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.features.ingest.domain.JobStatus;

/**
 * Receives every status snapshot the orchestrator publishes. Called on the
 * publishing thread; implementations must return quickly.
 */
public interface JobStatusListener {
    
    void onStatus(JobStatus status);
}
