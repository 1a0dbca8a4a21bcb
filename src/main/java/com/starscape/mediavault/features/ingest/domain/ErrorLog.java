package com.starscape.mediavault.features.ingest.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded error list helpers for job status snapshots. Once the cap is reached a
 * single truncation marker is appended and later errors are dropped; counters
 * keep counting regardless.
 */
public final class ErrorLog {
    
    public static final String TRUNCATION_MARKER = "(additional errors truncated)";
    
    private ErrorLog() {
    }
    
    public static List<String> append(List<String> errors, String error, int maxErrors) {
        if (errors.size() > maxErrors) {
            return errors;
        }
        List<String> copy = new ArrayList<>(errors);
        copy.add(errors.size() < maxErrors ? error : TRUNCATION_MARKER);
        return Collections.unmodifiableList(copy);
    }
}
