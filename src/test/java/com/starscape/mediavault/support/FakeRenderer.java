package com.starscape.mediavault.support;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.rendering.app.DerivedAssetRenderer;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import com.starscape.mediavault.features.rendering.domain.RenderedPreview;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders small byte markers instead of images. Files whose content starts with
 * {@code CORRUPT} fail to decode; videos get a reference preview.
 */
public class FakeRenderer implements DerivedAssetRenderer {
    
    private int thumbnails;
    
    public synchronized int thumbnailsRendered() {
        return thumbnails;
    }
    
    @Override
    public synchronized byte[] renderThumbnail(Path source, MediaKind kind, int maxSize, int quality)
            throws RenderException {
        check(source);
        thumbnails++;
        return ("thumb-" + maxSize).getBytes(StandardCharsets.UTF_8);
    }
    
    @Override
    public RenderedPreview renderPreview(Path source, MediaKind kind) throws RenderException {
        check(source);
        if (kind == MediaKind.VIDEO) {
            return RenderedPreview.originalReference();
        }
        return RenderedPreview.of("preview".getBytes(StandardCharsets.UTF_8));
    }
    
    private static void check(Path source) throws RenderException {
        if (!Files.isRegularFile(source)) {
            throw new RenderException(RenderException.Reason.SOURCE_MISSING, "Source not found: " + source);
        }
        if (startsWith(source, "CORRUPT")) {
            throw new RenderException(RenderException.Reason.DECODE_FAILED, "Cannot decode image: " + source.getFileName());
        }
    }
    
    static boolean startsWith(Path file, String marker) {
        return FakeMetadataExtractor.head(file, marker.length()).equals(marker);
    }
}
