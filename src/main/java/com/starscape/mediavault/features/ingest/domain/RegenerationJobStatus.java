package com.starscape.mediavault.features.ingest.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the regeneration job.
 */
public record RegenerationJobStatus(
    JobState state,
    boolean missingOnly,
    boolean reset,
    int totalMedia,
    int processedMedia,
    int updatedMetadata,
    int generatedThumbnails,
    int updatedTags,
    int failedMedia,
    boolean cancelRequested,
    Instant startedAt,
    Instant completedAt,
    List<String> errors
) implements JobStatus {
    
    public RegenerationJobStatus {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
    
    public static RegenerationJobStatus idle() {
        return new RegenerationJobStatus(JobState.IDLE, true, false, 0, 0, 0, 0, 0, 0, false, null, null, List.of());
    }
    
    public static RegenerationJobStatus started(boolean missingOnly, boolean reset, Instant now) {
        return new RegenerationJobStatus(JobState.RUNNING, missingOnly, reset, 0, 0, 0, 0, 0, 0, false, now, null, List.of());
    }
    
    public RegenerationJobStatus withTotal(int total) {
        return new RegenerationJobStatus(state, missingOnly, reset, total, processedMedia, updatedMetadata,
            generatedThumbnails, updatedTags, failedMedia, cancelRequested, startedAt, completedAt, errors);
    }
    
    public RegenerationJobStatus withProcessed(boolean metadataUpdated, boolean thumbnailGenerated, int tagsLinked) {
        return new RegenerationJobStatus(state, missingOnly, reset, totalMedia, processedMedia + 1,
            updatedMetadata + (metadataUpdated ? 1 : 0),
            generatedThumbnails + (thumbnailGenerated ? 1 : 0),
            updatedTags + tagsLinked,
            failedMedia, cancelRequested, startedAt, completedAt, errors);
    }
    
    public RegenerationJobStatus withFailure(String error, int maxErrors) {
        return new RegenerationJobStatus(state, missingOnly, reset, totalMedia, processedMedia + 1, updatedMetadata,
            generatedThumbnails, updatedTags, failedMedia + 1, cancelRequested, startedAt, completedAt,
            ErrorLog.append(errors, error, maxErrors));
    }
    
    public RegenerationJobStatus withError(String error, int maxErrors) {
        return new RegenerationJobStatus(state, missingOnly, reset, totalMedia, processedMedia, updatedMetadata,
            generatedThumbnails, updatedTags, failedMedia, cancelRequested, startedAt, completedAt,
            ErrorLog.append(errors, error, maxErrors));
    }
    
    public RegenerationJobStatus withCancelRequested() {
        return new RegenerationJobStatus(state, missingOnly, reset, totalMedia, processedMedia, updatedMetadata,
            generatedThumbnails, updatedTags, failedMedia, true, startedAt, completedAt, errors);
    }
    
    public RegenerationJobStatus finish(JobState finalState, Instant now) {
        return new RegenerationJobStatus(finalState, missingOnly, reset, totalMedia, processedMedia, updatedMetadata,
            generatedThumbnails, updatedTags, failedMedia, cancelRequested, startedAt, now, errors);
    }
    
    @Override
    @JsonProperty("kind")
    public JobKind kind() {
        return JobKind.REGENERATION;
    }
    
    @Override
    @JsonIgnore
    public int totalItems() {
        return totalMedia;
    }
    
    @Override
    @JsonIgnore
    public int processedItems() {
        return processedMedia;
    }
    
    @Override
    @JsonIgnore
    public int failedItems() {
        return failedMedia;
    }
}
