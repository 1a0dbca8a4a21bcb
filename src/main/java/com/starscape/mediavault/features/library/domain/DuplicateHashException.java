package com.starscape.mediavault.features.library.domain;

/**
 * An insert lost a race against another row with the same content hash.
 * Callers treat this as a duplicate skip, not a failure.
 */
public class DuplicateHashException extends RuntimeException {
    
    private final String contentHash;
    
    public DuplicateHashException(String contentHash, Throwable cause) {
        super("Media with content hash " + contentHash + " already exists", cause);
        this.contentHash = contentHash;
    }
    
    public String getContentHash() {
        return contentHash;
    }
}
