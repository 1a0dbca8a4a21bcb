package com.starscape.mediavault.features.ingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
    
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
