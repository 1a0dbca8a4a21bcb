package com.starscape.mediavault.features.ingest.app;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StorageLayoutTest {
    
    private final StorageLayout layout = new StorageLayout(
        Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));
    
    @Test
    void groupsOriginalsByCaptureMonth() {
        StorageLayout.Keys keys = layout.keysFor(Path.of("IMG_0001.JPG"), LocalDateTime.of(2023, 7, 14, 10, 20, 30));
        
        assertTrue(keys.filename().matches("20230714_102030_[0-9a-f]{12}\\.jpg"), keys.filename());
        assertEquals("2023-07/" + keys.filename(), keys.original());
        assertEquals("2023-07/" + keys.filename(), keys.derived());
    }
    
    @Test
    void derivedKeysAlwaysUseJpeg() {
        StorageLayout.Keys keys = layout.keysFor(Path.of("clip.MOV"), LocalDateTime.of(2023, 7, 14, 10, 20, 30));
        
        assertTrue(keys.original().endsWith(".mov"));
        assertEquals(keys.original().replace(".mov", ".jpg"), keys.derived());
    }
    
    @Test
    void usesCurrentTimeWithoutCaptureDate() {
        StorageLayout.Keys keys = layout.keysFor(Path.of("scan.png"), null);
        
        assertTrue(keys.original().startsWith("2024-06/20240601_120000_"), keys.original());
    }
    
    @Test
    void sameSecondStillGivesDistinctNames() {
        LocalDateTime taken = LocalDateTime.of(2023, 7, 14, 10, 20, 30);
        
        assertNotEquals(layout.keysFor(Path.of("a.jpg"), taken).original(),
            layout.keysFor(Path.of("b.jpg"), taken).original());
    }
    
    @Test
    void derivedKeyForExistingOriginal() {
        assertEquals("2023-07/20230714_102030_abcdef123456.jpg",
            StorageLayout.derivedKeyFor("2023-07/20230714_102030_abcdef123456.heic"));
        assertEquals("legacy.jpg", StorageLayout.derivedKeyFor("legacy.png"));
        assertEquals("2023-07/noext.jpg", StorageLayout.derivedKeyFor("2023-07/noext"));
    }
}
