package com.starscape.mediavault.features.metadata.app;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import com.starscape.mediavault.features.metadata.domain.Place;
import com.starscape.mediavault.features.metadata.infra.ExifMetadataReader;
import com.starscape.mediavault.features.metadata.infra.FfprobeVideoProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MediaMetadataExtractorTest {
    
    private static final LocalDateTime MODIFIED = LocalDateTime.of(2022, 3, 4, 5, 6, 7);
    
    @TempDir
    Path tempDir;
    
    private ExifMetadataReader exifReader;
    private FfprobeVideoProbe videoProbe;
    private ReverseGeocoder geocoder;
    private MediaMetadataExtractor extractor;
    private Path file;
    
    @BeforeEach
    void setUp() throws IOException {
        exifReader = mock(ExifMetadataReader.class);
        videoProbe = mock(FfprobeVideoProbe.class);
        geocoder = mock(ReverseGeocoder.class);
        extractor = new MediaMetadataExtractor(exifReader, videoProbe, geocoder);
        file = Files.writeString(tempDir.resolve("photo.jpg"), "bytes");
        Files.setLastModifiedTime(file, FileTime.from(MODIFIED.atZone(ZoneId.systemDefault()).toInstant()));
    }
    
    @Test
    void usesCaptureDateWhenPresent() {
        LocalDateTime taken = LocalDateTime.of(2023, 7, 14, 10, 20, 30);
        when(exifReader.read(file)).thenReturn(MetadataRecord.builder().dateTaken(taken).build());
        
        assertEquals(taken, extractor.extract(file, MediaKind.IMAGE).dateTaken());
    }
    
    @Test
    void fallsBackToModificationTime() {
        when(exifReader.read(file)).thenReturn(MetadataRecord.builder().dimensions(10, 10).build());
        
        MetadataRecord record = extractor.extract(file, MediaKind.IMAGE);
        
        assertEquals(MODIFIED, record.dateTaken());
        assertEquals(10, record.width());
    }
    
    @Test
    void videoProbeFailureKeepsFileFacts() throws IOException {
        when(videoProbe.probe(file)).thenThrow(new IOException("ffprobe not installed"));
        
        MetadataRecord record = extractor.extract(file, MediaKind.VIDEO);
        
        assertEquals(MODIFIED, record.dateTaken());
        assertNull(record.durationSeconds());
    }
    
    @Test
    void fillsPlaceFromReverseGeocoding() {
        when(exifReader.read(file)).thenReturn(MetadataRecord.builder().gps(48.8584, 2.2945, null).build());
        when(geocoder.isEnabled()).thenReturn(true);
        when(geocoder.lookup(48.8584, 2.2945)).thenReturn(Optional.of(new Place("Paris", "Île-de-France", "France")));
        
        MetadataRecord record = extractor.extract(file, MediaKind.IMAGE);
        
        assertEquals("Paris", record.locationCity());
        assertEquals("Île-de-France", record.locationState());
        assertEquals("France", record.locationCountry());
    }
    
    @Test
    void skipsGeocodingWhenPlaceIsKnownOrDisabled() {
        when(exifReader.read(file)).thenReturn(MetadataRecord.builder()
            .gps(48.8584, 2.2945, null)
            .locationState("Île-de-France")
            .locationCountry("France")
            .build());
        when(geocoder.isEnabled()).thenReturn(true);
        
        extractor.extract(file, MediaKind.IMAGE);
        
        verify(geocoder, never()).lookup(anyDouble(), anyDouble());
    }
    
    @Test
    void emptyGeocodingResultLeavesPlaceUnset() {
        when(exifReader.read(file)).thenReturn(MetadataRecord.builder().gps(10.0, 10.0, null).build());
        when(geocoder.isEnabled()).thenReturn(true);
        when(geocoder.lookup(10.0, 10.0)).thenReturn(Optional.empty());
        
        MetadataRecord record = extractor.extract(file, MediaKind.IMAGE);
        
        assertNull(record.locationCountry());
        assertTrue(record.hasGps());
    }
}
