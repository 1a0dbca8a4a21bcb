package com.starscape.mediavault.features.ingest.infra;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.features.ingest.app.ImportCandidate;
import com.starscape.mediavault.features.ingest.app.SourceUnavailableException;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalStagingSourceTest {
    
    @TempDir
    Path tempDir;
    
    private final ProcessingProperties processingProperties = new ProcessingProperties();
    
    @Test
    void enumeratesSupportedFilesRecursivelyInPathOrder() throws IOException {
        write("b.JPG");
        write("a.png");
        write("2024/trip/clip.mov");
        write("notes.txt");
        write(".hidden.jpg");
        write("README");
        LocalStagingSource source = new LocalStagingSource(tempDir, processingProperties);
        
        List<String> names = source.enumerate().stream().map(ImportCandidate::displayName).toList();
        
        assertEquals(List.of(
            Path.of("2024", "trip", "clip.mov").toString(),
            "a.png",
            "b.JPG"), names);
        assertEquals(ImportSourceType.LOCAL, source.type());
    }
    
    @Test
    void stagedPathIsTheFileItselfAndReleaseKeepsIt() throws IOException {
        Path file = write("a.jpg");
        LocalStagingSource source = new LocalStagingSource(tempDir, processingProperties);
        ImportCandidate candidate = source.enumerate().get(0);
        
        Path staged = candidate.stage();
        candidate.release(staged);
        
        assertEquals(file, staged);
        assertTrue(Files.exists(file));
        assertEquals("a.jpg", candidate.originalName());
    }
    
    @Test
    void missingDirectoryIsUnavailable() {
        LocalStagingSource source = new LocalStagingSource(tempDir.resolve("nope"), processingProperties);
        
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, source::verify);
        assertTrue(e.getMessage().startsWith("Import directory does not exist"));
        assertThrows(SourceUnavailableException.class, source::enumerate);
    }
    
    @Test
    void emptyDirectoryHasNoCandidates() {
        assertTrue(new LocalStagingSource(tempDir, processingProperties).enumerate().isEmpty());
    }
    
    private Path write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, relative);
    }
}
