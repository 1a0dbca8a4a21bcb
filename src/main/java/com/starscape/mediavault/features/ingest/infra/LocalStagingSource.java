package com.starscape.mediavault.features.ingest.infra;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.config.StorageProperties;
import com.starscape.mediavault.features.ingest.app.ImportCandidate;
import com.starscape.mediavault.features.ingest.app.ImportSource;
import com.starscape.mediavault.features.ingest.app.SourceUnavailableException;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imports files dropped into the staging directory. Files are moved into
 * storage as they are imported, so a finished import leaves behind only the
 * files that failed.
 */
@Component
public class LocalStagingSource implements ImportSource {
    
    private final Path root;
    private final ProcessingProperties processingProperties;
    
    @Autowired
    public LocalStagingSource(StorageProperties storageProperties, ProcessingProperties processingProperties) {
        this(storageProperties.getImportsDir(), processingProperties);
    }
    
    public LocalStagingSource(Path root, ProcessingProperties processingProperties) {
        this.root = root;
        this.processingProperties = processingProperties;
    }
    
    @Override
    public ImportSourceType type() {
        return ImportSourceType.LOCAL;
    }
    
    @Override
    public void verify() {
        if (!Files.isDirectory(root)) {
            throw new SourceUnavailableException("Import directory does not exist: " + root.toAbsolutePath());
        }
        if (!Files.isReadable(root)) {
            throw new SourceUnavailableException("Import directory is not readable: " + root.toAbsolutePath());
        }
    }
    
    @Override
    public List<ImportCandidate> enumerate() {
        verify();
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> !isHidden(path))
                    .filter(processingProperties::isSupported)
                    .sorted()
                    .map(path -> (ImportCandidate) new StagedFile(root, path))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new SourceUnavailableException("Cannot list import directory " + root.toAbsolutePath()
                + ": " + e.getMessage(), e);
        }
    }
    
    private static boolean isHidden(Path path) {
        return path.getFileName().toString().startsWith(".");
    }
    
    private record StagedFile(Path root, Path path) implements ImportCandidate {
        
        @Override
        public String displayName() {
            return root.relativize(path).toString();
        }
        
        @Override
        public String originalName() {
            return path.getFileName().toString();
        }
        
        @Override
        public Path stage() {
            return path;
        }
        
        @Override
        public void release(Path staged) {
            // failed files stay in the staging directory for the next run
        }
    }
}
