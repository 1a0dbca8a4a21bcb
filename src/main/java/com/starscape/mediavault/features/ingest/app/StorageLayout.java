package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.common.config.ProcessingProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Decides where originals and derived assets live in the blob store.
 *
 * <p>Originals are grouped by capture month and renamed to
 * {@code yyyyMMdd_HHmmss_<12 hex>.<ext>}. Thumbnails, tiny thumbnails and
 * previews share the original's month directory and stem, with a {@code .jpg}
 * extension, each in its own area.
 */
@Component
public class StorageLayout {
    
    private static final DateTimeFormatter MONTH_DIR = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String DERIVED_EXTENSION = ".jpg";
    
    private final Clock clock;
    
    public StorageLayout(Clock clock) {
        this.clock = clock;
    }
    
    public record Keys(String filename, String original, String derived) {}
    
    /**
     * @param source the staged file; only its extension is used
     * @param capturedAt capture date, or null to use the current time
     */
    public Keys keysFor(Path source, LocalDateTime capturedAt) {
        LocalDateTime when = capturedAt != null ? capturedAt : LocalDateTime.now(clock);
        String extension = ProcessingProperties.extensionOf(source);
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        String filename = FILE_STAMP.format(when) + "_" + suffix + (extension.isEmpty() ? "" : "." + extension);
        String original = MONTH_DIR.format(when) + "/" + filename;
        return new Keys(filename, original, derivedKeyFor(original));
    }
    
    /**
     * Key of the thumbnail, tiny thumbnail and preview belonging to an original.
     */
    public static String derivedKeyFor(String originalKey) {
        int slash = originalKey.lastIndexOf('/');
        String directory = slash >= 0 ? originalKey.substring(0, slash + 1) : "";
        String name = originalKey.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return directory + stem + DERIVED_EXTENSION;
    }
}
