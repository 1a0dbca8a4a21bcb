package com.starscape.mediavault.features.ingest.app;

/**
 * The import source as a whole cannot be reached or enumerated.
 */
public class SourceUnavailableException extends RuntimeException {
    
    public SourceUnavailableException(String message) {
        super(message);
    }
    
    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
