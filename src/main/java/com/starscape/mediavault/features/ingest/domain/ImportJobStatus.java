package com.starscape.mediavault.features.ingest.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the import job. Every change produces a new instance,
 * so readers always see a consistent set of counters.
 */
public record ImportJobStatus(
    JobState state,
    ImportSourceType source,
    int totalFiles,
    int processedFiles,
    int successfulImports,
    int failedImports,
    int skippedDuplicates,
    boolean cancelRequested,
    Instant startedAt,
    Instant completedAt,
    List<String> errors
) implements JobStatus {
    
    public ImportJobStatus {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
    
    public static ImportJobStatus idle() {
        return new ImportJobStatus(JobState.IDLE, null, 0, 0, 0, 0, 0, false, null, null, List.of());
    }
    
    public static ImportJobStatus started(ImportSourceType source, Instant now) {
        return new ImportJobStatus(JobState.RUNNING, source, 0, 0, 0, 0, 0, false, now, null, List.of());
    }
    
    public ImportJobStatus withTotal(int total) {
        return new ImportJobStatus(state, source, total, processedFiles, successfulImports, failedImports,
            skippedDuplicates, cancelRequested, startedAt, completedAt, errors);
    }
    
    public ImportJobStatus withImported() {
        return new ImportJobStatus(state, source, totalFiles, processedFiles + 1, successfulImports + 1,
            failedImports, skippedDuplicates, cancelRequested, startedAt, completedAt, errors);
    }
    
    public ImportJobStatus withDuplicate() {
        return new ImportJobStatus(state, source, totalFiles, processedFiles + 1, successfulImports,
            failedImports, skippedDuplicates + 1, cancelRequested, startedAt, completedAt, errors);
    }
    
    public ImportJobStatus withFailure(String error, int maxErrors) {
        return new ImportJobStatus(state, source, totalFiles, processedFiles + 1, successfulImports,
            failedImports + 1, skippedDuplicates, cancelRequested, startedAt, completedAt,
            ErrorLog.append(errors, error, maxErrors));
    }
    
    /**
     * Record an error that does not belong to a single file.
     */
    public ImportJobStatus withError(String error, int maxErrors) {
        return new ImportJobStatus(state, source, totalFiles, processedFiles, successfulImports,
            failedImports, skippedDuplicates, cancelRequested, startedAt, completedAt,
            ErrorLog.append(errors, error, maxErrors));
    }
    
    public ImportJobStatus withCancelRequested() {
        return new ImportJobStatus(state, source, totalFiles, processedFiles, successfulImports,
            failedImports, skippedDuplicates, true, startedAt, completedAt, errors);
    }
    
    public ImportJobStatus finish(JobState finalState, Instant now) {
        return new ImportJobStatus(finalState, source, totalFiles, processedFiles, successfulImports,
            failedImports, skippedDuplicates, cancelRequested, startedAt, now, errors);
    }
    
    @Override
    @JsonProperty("kind")
    public JobKind kind() {
        return JobKind.IMPORT;
    }
    
    @Override
    @JsonIgnore
    public int totalItems() {
        return totalFiles;
    }
    
    @Override
    @JsonIgnore
    public int processedItems() {
        return processedFiles;
    }
    
    @Override
    @JsonIgnore
    public int failedItems() {
        return failedImports;
    }
}
