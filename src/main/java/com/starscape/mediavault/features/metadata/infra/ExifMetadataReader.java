package com.starscape.mediavault.features.metadata.infra;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.iptc.IptcDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.List;

/**
 * Reads image metadata with metadata-extractor. Dimensions come from the
 * image header when an ImageIO reader exists for the format, otherwise from
 * the metadata directories.
 */
@Component
public class ExifMetadataReader {
    
    private static final Logger log = LoggerFactory.getLogger(ExifMetadataReader.class);
    
    private static final DateTimeFormatter EXIF_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    
    public MetadataRecord read(Path file) {
        MetadataRecord.Builder builder = MetadataRecord.builder();
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            builder = fromMetadata(metadata).toBuilder();
        } catch (ImageProcessingException | IOException e) {
            // Expected for files without a recognisable metadata block
            log.debug("No readable metadata in {}: {}", file.getFileName(), e.getMessage());
        }
        
        Dimension header = readHeaderDimensions(file);
        if (header != null) {
            builder.dimensions(header.width, header.height);
        }
        return builder.build();
    }
    
    /**
     * Map metadata-extractor directories onto a record.
     */
    public MetadataRecord fromMetadata(Metadata metadata) {
        MetadataRecord.Builder builder = MetadataRecord.builder();
        
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        IptcDirectory iptc = metadata.getFirstDirectoryOfType(IptcDirectory.class);
        
        if (ifd0 != null) {
            builder.cameraMake(ifd0.getString(ExifIFD0Directory.TAG_MAKE))
                   .cameraModel(ifd0.getString(ExifIFD0Directory.TAG_MODEL))
                   .dateTaken(parseExifDate(ifd0.getString(ExifIFD0Directory.TAG_DATETIME)));
        }
        
        if (subIfd != null) {
            LocalDateTime original = parseExifDate(subIfd.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
            if (original == null) {
                original = parseExifDate(subIfd.getString(ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED));
            }
            if (original != null) {
                builder.dateTaken(original);
            }
            builder.iso(subIfd.getInteger(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT))
                   .exposureTime(formatExposureTime(subIfd.getRational(ExifSubIFDDirectory.TAG_EXPOSURE_TIME)))
                   .fNumber(toDouble(subIfd.getRational(ExifSubIFDDirectory.TAG_FNUMBER)))
                   .focalLength(toDouble(subIfd.getRational(ExifSubIFDDirectory.TAG_FOCAL_LENGTH)))
                   .focalLength35mm(subIfd.getInteger(ExifSubIFDDirectory.TAG_35MM_FILM_EQUIV_FOCAL_LENGTH))
                   .lensMake(subIfd.getString(ExifSubIFDDirectory.TAG_LENS_MAKE))
                   .lensModel(subIfd.getString(ExifSubIFDDirectory.TAG_LENS_MODEL))
                   .dimensions(subIfd.getInteger(ExifSubIFDDirectory.TAG_EXIF_IMAGE_WIDTH),
                               subIfd.getInteger(ExifSubIFDDirectory.TAG_EXIF_IMAGE_HEIGHT));
        }
        
        JpegDirectory jpeg = metadata.getFirstDirectoryOfType(JpegDirectory.class);
        if (jpeg != null) {
            builder.dimensions(jpeg.getInteger(JpegDirectory.TAG_IMAGE_WIDTH),
                               jpeg.getInteger(JpegDirectory.TAG_IMAGE_HEIGHT));
        }
        PngDirectory png = metadata.getFirstDirectoryOfType(PngDirectory.class);
        if (png != null && png.containsTag(PngDirectory.TAG_IMAGE_WIDTH)) {
            builder.dimensions(png.getInteger(PngDirectory.TAG_IMAGE_WIDTH),
                               png.getInteger(PngDirectory.TAG_IMAGE_HEIGHT));
        }
        
        if (gps != null) {
            GeoLocation location = gps.getGeoLocation();
            if (location != null) {
                builder.gps(location.getLatitude(), location.getLongitude(), readAltitude(gps));
            }
        }
        
        if (iptc != null) {
            List<String> keywords = iptc.getKeywords();
            if (keywords != null && !keywords.isEmpty()) {
                builder.keywords(String.join(",", keywords));
            }
        }
        
        return builder.build();
    }
    
    /**
     * Exposure below one second is written as a fraction ("1/250"), longer
     * exposures as plain seconds ("2", "2.5").
     */
    public static String formatExposureTime(Rational exposure) {
        if (exposure == null || exposure.getDenominator() == 0) {
            return null;
        }
        double seconds = exposure.doubleValue();
        if (seconds <= 0) {
            return null;
        }
        if (seconds < 1.0) {
            return "1/" + Math.round(1.0 / seconds);
        }
        return BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
    }
    
    /**
     * Parse EXIF's "yyyy:MM:dd HH:mm:ss" wall-clock time. Also accepts dashes
     * in the date part and a "T" separator. Zeroed or malformed dates yield null.
     */
    public static LocalDateTime parseExifDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() < 19) {
            return null;
        }
        String normalized = trimmed.substring(0, 10).replace(':', '-')
                + " " + trimmed.substring(11, 19);
        try {
            return LocalDateTime.parse(normalized, EXIF_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Unrecognised EXIF date: {}", value);
            return null;
        }
    }
    
    private static Double readAltitude(Directory gps) {
        Rational altitude = gps.getRational(GpsDirectory.TAG_ALTITUDE);
        if (altitude == null || altitude.getDenominator() == 0) {
            return null;
        }
        Integer reference = gps.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
        double meters = altitude.doubleValue();
        // Reference 1 means below sea level
        return reference != null && reference == 1 ? -meters : meters;
    }
    
    private static Double toDouble(Rational value) {
        if (value == null || value.getDenominator() == 0) {
            return null;
        }
        return value.doubleValue();
    }
    
    private static Dimension readHeaderDimensions(Path file) {
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Could not read image header of {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }
}
