package com.starscape.mediavault.features.metadata.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.process.ExternalCommand;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads video container metadata with ffprobe's JSON output.
 */
@Component
public class FfprobeVideoProbe {
    
    private static final Logger log = LoggerFactory.getLogger(FfprobeVideoProbe.class);
    
    private static final Pattern ISO_6709 = Pattern.compile(
        "^([+-]\\d+(?:\\.\\d+)?)([+-]\\d+(?:\\.\\d+)?)([+-]\\d+(?:\\.\\d+)?)?(?:CRS[^/]*)?/?$");
    
    // ffprobe writes "2023-07-14T10:20:30.000000Z"; QuickTime writes "2023-07-14T10:20:30+0200"
    private static final DateTimeFormatter CREATION_TIME = DateTimeFormatter.ofPattern(
        "yyyy-MM-dd'T'HH:mm:ss[.SSSSSS][.SSS][XXX][XX][X]");
    
    private static final List<String> CREATION_TAGS = List.of(
        "com.apple.quicktime.creationdate", "creation_time", "date");
    private static final List<String> LOCATION_TAGS = List.of(
        "com.apple.quicktime.location.ISO6709", "location", "location-eng");
    
    public record GeoPoint(double latitude, double longitude, Double altitude) {}
    
    private final ExternalCommand externalCommand;
    private final ObjectMapper objectMapper;
    private final ProcessingProperties properties;
    
    public FfprobeVideoProbe(ExternalCommand externalCommand, ObjectMapper objectMapper,
                             ProcessingProperties properties) {
        this.externalCommand = externalCommand;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }
    
    /**
     * @throws IOException if ffprobe is missing, fails or prints unreadable output
     */
    public MetadataRecord probe(Path file) throws IOException {
        List<String> command = List.of(
            properties.getFfprobePath(),
            "-v", "quiet",
            "-print_format", "json",
            "-show_format",
            "-show_streams",
            file.toAbsolutePath().toString()
        );
        ExternalCommand.Result result = externalCommand.run(command, properties.getToolTimeout());
        if (!result.succeeded()) {
            throw new IOException("ffprobe exited with " + result.exitCode() + " for " + file.getFileName());
        }
        return parse(objectMapper.readTree(result.output()));
    }
    
    /**
     * Duration in seconds, or null when ffprobe cannot tell.
     */
    public Double durationOf(Path file) throws IOException {
        return probe(file).durationSeconds();
    }
    
    public MetadataRecord parse(JsonNode root) {
        MetadataRecord.Builder builder = MetadataRecord.builder();
        JsonNode format = root.path("format");
        JsonNode videoStream = firstVideoStream(root.path("streams"));
        
        Double duration = parseDouble(format.path("duration").asText(null));
        if (duration == null && videoStream != null) {
            duration = parseDouble(videoStream.path("duration").asText(null));
        }
        builder.durationSeconds(duration);
        
        if (videoStream != null) {
            int width = videoStream.path("width").asInt(0);
            int height = videoStream.path("height").asInt(0);
            if (width > 0 && height > 0) {
                builder.dimensions(width, height);
            }
            builder.videoCodec(videoStream.path("codec_name").asText(null));
        }
        
        JsonNode formatTags = format.path("tags");
        JsonNode streamTags = videoStream != null ? videoStream.path("tags") : null;
        
        String created = firstTag(formatTags, streamTags, CREATION_TAGS);
        builder.dateTaken(parseCreationTime(created));
        
        String location = firstTag(formatTags, streamTags, LOCATION_TAGS);
        GeoPoint point = parseIso6709(location);
        if (point != null) {
            builder.gps(point.latitude(), point.longitude(), point.altitude());
        }
        
        String make = firstTag(formatTags, streamTags, List.of("com.apple.quicktime.make", "make"));
        String model = firstTag(formatTags, streamTags, List.of("com.apple.quicktime.model", "model"));
        builder.cameraMake(make).cameraModel(model);
        
        return builder.build();
    }
    
    /**
     * Parse an ISO 6709 point such as "+37.7749-122.4194+010.000/".
     */
    public static GeoPoint parseIso6709(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = ISO_6709.matcher(value.trim());
        if (!matcher.matches()) {
            log.debug("Unrecognised ISO 6709 location: {}", value);
            return null;
        }
        double latitude = Double.parseDouble(matcher.group(1));
        double longitude = Double.parseDouble(matcher.group(2));
        Double altitude = matcher.group(3) != null ? Double.parseDouble(matcher.group(3)) : null;
        return new GeoPoint(latitude, longitude, altitude);
    }
    
    public static LocalDateTime parseCreationTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim(), CREATION_TIME).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value.trim(), CREATION_TIME);
            } catch (DateTimeParseException again) {
                log.debug("Unrecognised video creation time: {}", value);
                return null;
            }
        }
    }
    
    private static JsonNode firstVideoStream(JsonNode streams) {
        if (streams == null || !streams.isArray()) {
            return null;
        }
        for (JsonNode stream : streams) {
            if ("video".equals(stream.path("codec_type").asText())) {
                return stream;
            }
        }
        return null;
    }
    
    private static String firstTag(JsonNode formatTags, JsonNode streamTags, List<String> names) {
        for (String name : names) {
            String value = formatTags.path(name).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
            if (streamTags != null) {
                value = streamTags.path(name).asText(null);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }
    
    private static Double parseDouble(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Unparseable number from ffprobe: {}", value);
            return null;
        }
    }
}
