package com.starscape.mediavault.features.ingest.infra;

import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.config.WebDavProperties;
import com.starscape.mediavault.common.storage.LocalBlobStore;
import com.starscape.mediavault.features.ingest.app.ImportCandidate;
import com.starscape.mediavault.features.ingest.app.ImportItemProcessor;
import com.starscape.mediavault.features.ingest.app.ImportOutcome;
import com.starscape.mediavault.features.ingest.app.StorageLayout;
import com.starscape.mediavault.features.ingest.app.SourceUnavailableException;
import com.starscape.mediavault.features.library.app.ContentHasher;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.support.FakeMetadataExtractor;
import com.starscape.mediavault.support.FakeRenderer;
import com.starscape.mediavault.support.InMemoryLibraryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebDavImportSourceTest {
    
    private static final String ROOT_URL = "https://dav.example.com/dav/Photos/";
    
    @TempDir
    Path scratchDir;
    
    private Sardine sardine;
    private WebDavImportSource source;
    
    @BeforeEach
    void setUp() {
        sardine = mock(Sardine.class);
        WebDavProperties properties = new WebDavProperties();
        properties.setEnabled(true);
        properties.setUrl("https://dav.example.com/dav/");
        properties.setRemotePath("Photos");
        source = new WebDavImportSource(sardine, properties, scratchDir, new ProcessingProperties());
    }
    
    @Test
    void listsSupportedFilesAcrossSubdirectories() throws IOException {
        List<DavResource> root = List.of(
            directory("/dav/Photos/"),
            file("/dav/Photos/beach.jpg"),
            file("/dav/Photos/notes.txt"),
            directory("/dav/Photos/2024/"));
        List<DavResource> year = List.of(
            directory("/dav/Photos/2024/"),
            file("/dav/Photos/2024/clip.mov"));
        when(sardine.list(ROOT_URL, 1)).thenReturn(root);
        when(sardine.list("https://dav.example.com/dav/Photos/2024/", 1)).thenReturn(year);
        
        List<String> names = source.enumerate().stream().map(ImportCandidate::displayName).toList();
        
        assertEquals(List.of("/dav/Photos/2024/clip.mov", "/dav/Photos/beach.jpg"), names);
    }
    
    @Test
    void listingFailureMakesTheSourceUnavailable() throws IOException {
        when(sardine.list(ROOT_URL, 1)).thenThrow(new IOException("connection reset"));
        
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, source::enumerate);
        assertTrue(e.getMessage().contains("connection reset"));
    }
    
    @Test
    void stageDownloadsIntoScratchAndReleaseRemovesIt() throws IOException {
        List<DavResource> root = List.of(file("/dav/Photos/beach.jpg"));
        when(sardine.list(ROOT_URL, 1)).thenReturn(root);
        when(sardine.get("https://dav.example.com/dav/Photos/beach.jpg"))
            .thenReturn(new ByteArrayInputStream("remote bytes".getBytes(StandardCharsets.UTF_8)));
        ImportCandidate candidate = source.enumerate().get(0);
        
        Path staged = candidate.stage();
        
        assertTrue(staged.startsWith(scratchDir));
        assertTrue(staged.getFileName().toString().endsWith("_beach.jpg"));
        assertEquals("remote bytes", Files.readString(staged));
        
        candidate.release(staged);
        assertFalse(Files.exists(staged));
        verify(sardine, never()).delete(ROOT_URL + "beach.jpg");
    }
    
    @Test
    void importedFileKeepsItsRemoteName() throws IOException {
        List<DavResource> root = List.of(file("/dav/Photos/beach.jpg"));
        when(sardine.list(ROOT_URL, 1)).thenReturn(root);
        when(sardine.get("https://dav.example.com/dav/Photos/beach.jpg"))
            .thenReturn(new ByteArrayInputStream("remote bytes".getBytes(StandardCharsets.UTF_8)));
        InMemoryLibraryRepository library = new InMemoryLibraryRepository();
        ImportItemProcessor processor = new ImportItemProcessor(new ProcessingProperties(), new ContentHasher(),
            library, new FakeMetadataExtractor(), new FakeRenderer(),
            new LocalBlobStore(scratchDir.resolve("library")), new StorageLayout(Clock.systemUTC()));
        ImportCandidate candidate = source.enumerate().get(0);
        
        ImportOutcome outcome = processor.process(candidate);
        
        assertEquals(ImportOutcome.Result.IMPORTED, outcome.result());
        MediaAsset asset = library.findById(outcome.mediaId()).orElseThrow();
        assertEquals("beach.jpg", candidate.originalName());
        assertEquals("beach.jpg", asset.getOriginalFilename());
    }
    
    @Test
    void failedDownloadLeavesNothingBehind() throws IOException {
        List<DavResource> root = List.of(file("/dav/Photos/beach.jpg"));
        when(sardine.list(ROOT_URL, 1)).thenReturn(root);
        when(sardine.get("https://dav.example.com/dav/Photos/beach.jpg")).thenThrow(new IOException("503 Service Unavailable"));
        ImportCandidate candidate = source.enumerate().get(0);
        
        IOException e = assertThrows(IOException.class, candidate::stage);
        
        assertEquals("Failed to download /dav/Photos/beach.jpg: 503 Service Unavailable", e.getMessage());
        try (Stream<Path> files = Files.list(scratchDir)) {
            assertEquals(0, files.count());
        }
    }
    
    @Test
    void verifyReportsMissingRemotePath() throws IOException {
        when(sardine.exists(ROOT_URL)).thenReturn(false);
        
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, source::verify);
        assertEquals("Remote path not found: /Photos", e.getMessage());
    }
    
    @Test
    void verifyReportsUnreachableServer() throws IOException {
        when(sardine.exists(ROOT_URL)).thenThrow(new IOException("Connection refused"));
        
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, source::verify);
        assertTrue(e.getMessage().startsWith("WebDAV server unreachable at https://dav.example.com/dav"));
    }
    
    @Test
    void verifyPassesWhenRemotePathExists() throws IOException {
        when(sardine.exists(ROOT_URL)).thenReturn(true);
        
        assertDoesNotThrow(source::verify);
    }
    
    @Test
    void requiresAServerUrl() {
        WebDavProperties properties = new WebDavProperties();
        properties.setEnabled(true);
        
        assertThrows(IllegalStateException.class,
            () -> new WebDavImportSource(sardine, properties, scratchDir, new ProcessingProperties()));
    }
    
    private static DavResource directory(String path) {
        DavResource resource = mock(DavResource.class);
        when(resource.getHref()).thenReturn(URI.create(path));
        when(resource.isDirectory()).thenReturn(true);
        when(resource.getPath()).thenReturn(path);
        return resource;
    }
    
    private static DavResource file(String path) {
        DavResource resource = mock(DavResource.class);
        when(resource.getHref()).thenReturn(URI.create(path));
        when(resource.isDirectory()).thenReturn(false);
        when(resource.getPath()).thenReturn(path);
        when(resource.getName()).thenReturn(path.substring(path.lastIndexOf('/') + 1));
        return resource;
    }
}
