package com.starscape.mediavault.features.ingest.domain;

import com.starscape.mediavault.common.domain.Entity;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One persisted job run. Written when a job starts and again when it reaches a
 * terminal state; the summary column holds the final status snapshot as JSON.
 */
@jakarta.persistence.Entity
@Table(name = "job_runs")
public class JobRun extends Entity<String> {
    
    @Id
    @Column(name = "run_id")
    private String runId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobKind kind;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState status;
    
    @Column(name = "total_items", nullable = false)
    private int totalItems;
    
    @Column(name = "processed_items", nullable = false)
    private int processedItems;
    
    @Column(name = "succeeded_items", nullable = false)
    private int succeededItems;
    
    @Column(name = "failed_items", nullable = false)
    private int failedItems;
    
    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private String summary;
    
    protected JobRun() {
        // JPA constructor
    }
    
    public JobRun(String runId, JobKind kind, Instant startedAt) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run id cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Job kind cannot be null");
        }
        this.runId = runId;
        this.kind = kind;
        this.status = JobState.RUNNING;
        this.startedAt = startedAt;
    }
    
    @Override
    public String getId() {
        return runId;
    }
    
    // Getters
    public String getRunId() { return runId; }
    public JobKind getKind() { return kind; }
    public JobState getStatus() { return status; }
    public int getTotalItems() { return totalItems; }
    public int getProcessedItems() { return processedItems; }
    public int getSucceededItems() { return succeededItems; }
    public int getFailedItems() { return failedItems; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public String getSummary() { return summary; }
    
    public void finish(JobStatus finalStatus, String summaryJson) {
        if (!finalStatus.state().isTerminal()) {
            throw new IllegalStateException("Cannot record a run that has not finished");
        }
        this.status = finalStatus.state();
        this.totalItems = finalStatus.totalItems();
        this.processedItems = finalStatus.processedItems();
        this.failedItems = finalStatus.failedItems();
        this.succeededItems = finalStatus.processedItems() - finalStatus.failedItems();
        this.completedAt = finalStatus.completedAt();
        this.summary = summaryJson;
    }
    
    /**
     * Close a run left in {@code running} by a process that died mid-job.
     */
    public void markAbandoned(Instant now) {
        if (status == JobState.RUNNING) {
            this.status = JobState.FAILED;
            this.completedAt = now;
        }
    }
}
