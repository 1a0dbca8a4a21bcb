package com.starscape.mediavault.features.ingest.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.mediavault.features.ingest.domain.JobKind;
import com.starscape.mediavault.features.ingest.domain.JobRun;
import com.starscape.mediavault.features.ingest.domain.JobRunRepository;
import com.starscape.mediavault.features.ingest.domain.JobState;
import com.starscape.mediavault.features.ingest.domain.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persists job runs to {@code job_runs}.
 */
@Service
public class JobRunRecorder implements JobHistory {
    
    private static final Logger log = LoggerFactory.getLogger(JobRunRecorder.class);
    
    private final JobRunRepository jobRunRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public JobRunRecorder(JobRunRepository jobRunRepository, ObjectMapper objectMapper, Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }
    
    @Override
    @Transactional
    public String recordStart(JobKind kind, Instant startedAt) {
        String runId = "run_" + UUID.randomUUID().toString().replace("-", "");
        jobRunRepository.save(new JobRun(runId, kind, startedAt));
        return runId;
    }
    
    @Override
    @Transactional
    public void recordFinish(String runId, JobStatus finalStatus) {
        JobRun run = jobRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Job run not found: " + runId));
        run.finish(finalStatus, toJson(finalStatus));
        jobRunRepository.save(run);
    }
    
    /**
     * Runs left in {@code running} belong to a process that stopped mid-job.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void closeAbandonedRuns() {
        List<JobRun> abandoned = jobRunRepository.findByStatus(JobState.RUNNING);
        Instant now = clock.instant();
        for (JobRun run : abandoned) {
            log.warn("Marking {} run {} started at {} as failed: the service stopped while it was running",
                run.getKind().value(), run.getRunId(), run.getStartedAt());
            run.markAbandoned(now);
            jobRunRepository.save(run);
        }
    }
    
    private String toJson(JobStatus status) {
        try {
            return objectMapper.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job status", e);
        }
    }
}
