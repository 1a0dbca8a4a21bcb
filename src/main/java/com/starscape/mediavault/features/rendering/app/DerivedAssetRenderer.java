package com.starscape.mediavault.features.rendering.app;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import com.starscape.mediavault.features.rendering.domain.RenderedPreview;

import java.nio.file.Path;

/**
 * Produces thumbnails and previews. Output is JPEG, fits within the requested
 * size on its longer edge, keeps the source aspect ratio and is never upscaled.
 */
public interface DerivedAssetRenderer {
    
    byte[] renderThumbnail(Path source, MediaKind kind, int maxSize, int quality) throws RenderException;
    
    RenderedPreview renderPreview(Path source, MediaKind kind) throws RenderException;
}
