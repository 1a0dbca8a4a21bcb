package com.starscape.mediavault.features.ingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two kinds of background job. At most one job of either kind runs at a time.
 */
public enum JobKind {
    IMPORT,
    REGENERATION;
    
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
