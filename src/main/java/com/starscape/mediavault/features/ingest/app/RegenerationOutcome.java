package com.starscape.mediavault.features.ingest.app;

public record RegenerationOutcome(
    boolean succeeded,
    boolean metadataUpdated,
    boolean thumbnailGenerated,
    int tagsLinked,
    String error
) {
    
    public static RegenerationOutcome succeeded(boolean metadataUpdated, boolean thumbnailGenerated, int tagsLinked) {
        return new RegenerationOutcome(true, metadataUpdated, thumbnailGenerated, tagsLinked, null);
    }
    
    public static RegenerationOutcome failed(String error) {
        return new RegenerationOutcome(false, false, false, 0, error);
    }
}
