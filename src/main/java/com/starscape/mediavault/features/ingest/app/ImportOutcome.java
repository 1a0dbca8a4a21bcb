package com.starscape.mediavault.features.ingest.app;

/**
 * What happened to one imported file.
 */
public record ImportOutcome(Result result, Long mediaId, String error) {
    
    public enum Result { IMPORTED, DUPLICATE, FAILED }
    
    public static ImportOutcome imported(Long mediaId) {
        return new ImportOutcome(Result.IMPORTED, mediaId, null);
    }
    
    public static ImportOutcome duplicate(Long mediaId) {
        return new ImportOutcome(Result.DUPLICATE, mediaId, null);
    }
    
    public static ImportOutcome failed(String error) {
        return new ImportOutcome(Result.FAILED, null, error);
    }
}
