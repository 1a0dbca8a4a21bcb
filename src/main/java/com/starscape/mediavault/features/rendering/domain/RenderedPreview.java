package com.starscape.mediavault.features.rendering.domain;

/**
 * A rendered preview, or a marker that the original should be served as the preview.
 */
public record RenderedPreview(byte[] bytes, boolean referencesOriginal) {
    
    public static RenderedPreview of(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Preview bytes cannot be empty");
        }
        return new RenderedPreview(bytes, false);
    }
    
    public static RenderedPreview originalReference() {
        return new RenderedPreview(null, true);
    }
}
