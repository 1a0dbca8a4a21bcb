package com.starscape.mediavault.common.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A stored blob made available as a local file. Temporary copies are removed on close.
 */
public final class LocalBlob implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(LocalBlob.class);
    
    private final Path path;
    private final boolean temporary;
    
    private LocalBlob(Path path, boolean temporary) {
        this.path = path;
        this.temporary = temporary;
    }
    
    public static LocalBlob inPlace(Path path) {
        return new LocalBlob(path, false);
    }
    
    public static LocalBlob temporaryCopy(Path path) {
        return new LocalBlob(path, true);
    }
    
    public Path path() {
        return path;
    }
    
    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove temporary copy {}: {}", path, e.getMessage());
        }
    }
}
