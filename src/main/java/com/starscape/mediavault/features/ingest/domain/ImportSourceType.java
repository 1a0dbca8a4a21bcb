package com.starscape.mediavault.features.ingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportSourceType {
    LOCAL,
    WEBDAV;
    
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
