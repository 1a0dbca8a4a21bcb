package com.starscape.mediavault.features.library.domain;

import com.starscape.mediavault.common.domain.ValueObject;

/**
 * Digest of a file's full content; the library's deduplication key.
 */
public record ContentHash(
    String algorithm,
    String value
) implements ValueObject {
    
    public static final String SHA_256 = "SHA-256";
    
    public ContentHash {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("Algorithm cannot be blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Value cannot be blank");
        }
    }
    
    public static ContentHash sha256(String value) {
        return new ContentHash(SHA_256, value);
    }
}
