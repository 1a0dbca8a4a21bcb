package com.starscape.mediavault.features.ingest.domain;

import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface JobRunRepository {
    
    JobRun save(JobRun run);
    
    Optional<JobRun> findById(String runId);
    
    List<JobRun> findByStatus(JobState status);
    
    List<JobRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
