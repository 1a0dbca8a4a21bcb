package com.starscape.mediavault.common.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a library item. Stored and serialised in lower case.
 */
public enum MediaKind {
    IMAGE("image"),
    VIDEO("video");
    
    private final String value;
    
    MediaKind(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String value() {
        return value;
    }
    
    public static MediaKind fromValue(String value) {
        for (MediaKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown media kind: " + value);
    }
}
