package com.starscape.mediavault.features.library.domain;

/**
 * A repository write violated an invariant other than content-hash uniqueness.
 */
public class StorageIntegrityException extends RuntimeException {
    
    public StorageIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
