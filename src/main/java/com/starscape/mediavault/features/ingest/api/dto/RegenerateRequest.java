package com.starscape.mediavault.features.ingest.api.dto;

/**
 * Request DTO for starting a regeneration. A missing flag means missing-only.
 */
public record RegenerateRequest(
    Boolean missingOnly
) {
    
    public boolean isMissingOnly() {
        return missingOnly == null || missingOnly;
    }
}
