package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.features.ingest.domain.JobKind;
import com.starscape.mediavault.features.ingest.domain.JobStatus;

import java.time.Instant;

/**
 * Durable record of job runs.
 */
public interface JobHistory {
    
    /**
     * @return the id of the new run
     */
    String recordStart(JobKind kind, Instant startedAt);
    
    void recordFinish(String runId, JobStatus finalStatus);
}
