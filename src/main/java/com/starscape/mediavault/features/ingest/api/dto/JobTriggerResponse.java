package com.starscape.mediavault.features.ingest.api.dto;

/**
 * Response DTO for job commands.
 * @param status the job state after the command, e.g. {@code running} or {@code cancelling}
 */
public record JobTriggerResponse(
    String message,
    String status
) {}
