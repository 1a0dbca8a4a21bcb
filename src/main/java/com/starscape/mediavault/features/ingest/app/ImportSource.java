package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.features.ingest.domain.ImportSourceType;

import java.util.List;

/**
 * A place new media is imported from.
 */
public interface ImportSource {
    
    ImportSourceType type();
    
    /**
     * Cheap reachability check, run before the job is handed to the worker.
     * @throws SourceUnavailableException if the source cannot be used at all
     */
    void verify();
    
    /**
     * List every supported file in the source, in a stable order.
     * @throws SourceUnavailableException if listing fails
     */
    List<ImportCandidate> enumerate();
}
