package com.starscape.mediavault.features.metadata.app;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import com.starscape.mediavault.features.metadata.domain.Place;
import com.starscape.mediavault.features.metadata.infra.ExifMetadataReader;
import com.starscape.mediavault.features.metadata.infra.FfprobeVideoProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Production {@link MetadataExtractor}:
 * - Images are read with metadata-extractor (EXIF, GPS, IPTC)
 * - Videos are probed with ffprobe
 * - Capture date falls back to the file's modification time
 * - Place names are added by reverse geocoding when enabled
 */
@Service
public class MediaMetadataExtractor implements MetadataExtractor {
    
    private static final Logger log = LoggerFactory.getLogger(MediaMetadataExtractor.class);
    
    private final ExifMetadataReader exifReader;
    private final FfprobeVideoProbe videoProbe;
    private final ReverseGeocoder reverseGeocoder;
    
    public MediaMetadataExtractor(
            ExifMetadataReader exifReader,
            FfprobeVideoProbe videoProbe,
            ReverseGeocoder reverseGeocoder) {
        this.exifReader = exifReader;
        this.videoProbe = videoProbe;
        this.reverseGeocoder = reverseGeocoder;
    }
    
    @Override
    public MetadataRecord extract(Path file, MediaKind kind) {
        MetadataRecord record;
        try {
            record = kind == MediaKind.VIDEO ? videoProbe.probe(file) : exifReader.read(file);
        } catch (IOException | RuntimeException e) {
            log.warn("Metadata extraction failed for {}, keeping file facts only: {}", file.getFileName(), e.getMessage());
            record = MetadataRecord.empty();
        }
        
        if (record.dateTaken() == null) {
            record = record.withDateTaken(modifiedTime(file));
        }
        
        if (record.hasGps() && !record.hasPlace() && reverseGeocoder.isEnabled()) {
            Optional<Place> place = reverseGeocoder.lookup(record.gpsLatitude(), record.gpsLongitude());
            if (place.isPresent() && !place.get().isEmpty()) {
                record = record.withPlace(
                    record.locationCity() != null ? record.locationCity() : place.get().city(),
                    record.locationState() != null ? record.locationState() : place.get().state(),
                    record.locationCountry() != null ? record.locationCountry() : place.get().country());
            }
        }
        return record;
    }
    
    private LocalDateTime modifiedTime(Path file) {
        try {
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
        } catch (IOException e) {
            log.debug("Could not read modification time of {}: {}", file, e.getMessage());
            return null;
        }
    }
}
