package com.starscape.mediavault.features.ingest.app;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One file offered by an {@link ImportSource}.
 */
public interface ImportCandidate {
    
    /**
     * Identifies the file in error messages and logs.
     */
    String displayName();
    
    /**
     * File name as the source knows it, recorded as the item's original filename.
     */
    String originalName();
    
    /**
     * Make the file available locally and return its path. The importer moves
     * the file into storage on success, so the path is consumed.
     * @throws IOException with a message naming the file if it cannot be fetched
     */
    Path stage() throws IOException;
    
    /**
     * Called once processing is over, whatever the outcome. Sources that
     * download into a scratch area remove whatever is left of the staged file.
     */
    void release(Path staged);
}
