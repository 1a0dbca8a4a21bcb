package com.starscape.mediavault.features.metadata.app;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;

import java.nio.file.Path;

/**
 * Reads embedded metadata from a media file.
 */
public interface MetadataExtractor {
    
    /**
     * Never throws for a readable file. A file without EXIF, or one whose metadata
     * cannot be parsed, yields a record holding only what the file itself reveals.
     */
    MetadataRecord extract(Path file, MediaKind kind);
}
