package com.starscape.mediavault.features.library.domain;

import com.starscape.mediavault.features.metadata.domain.MetadataRecord;

/**
 * Changes applied to one row by a regeneration pass. Null paths and a null
 * hash leave the stored values untouched.
 */
public record MediaPatch(
    MetadataRecord metadata,
    MergePolicy policy,
    String thumbnailPath,
    String previewPath,
    ContentHash contentHash
) {
    
    public MediaPatch {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Merge policy cannot be null");
        }
    }
}
