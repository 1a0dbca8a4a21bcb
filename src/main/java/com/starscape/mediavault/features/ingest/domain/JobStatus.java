package com.starscape.mediavault.features.ingest.domain;

import java.time.Instant;
import java.util.List;

/**
 * Common view over the status snapshots of both job kinds.
 */
public interface JobStatus {
    
    JobKind kind();
    
    JobState state();
    
    int totalItems();
    
    int processedItems();
    
    int failedItems();
    
    Instant startedAt();
    
    Instant completedAt();
    
    List<String> errors();
}
