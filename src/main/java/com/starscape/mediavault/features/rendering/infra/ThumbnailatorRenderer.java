package com.starscape.mediavault.features.rendering.infra;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.rendering.app.DerivedAssetRenderer;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import com.starscape.mediavault.features.rendering.domain.RenderedPreview;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders JPEG thumbnails and previews with Thumbnailator. Images are decoded
 * with their EXIF orientation applied; videos go through an ffmpeg poster frame.
 */
@Component
public class ThumbnailatorRenderer implements DerivedAssetRenderer {
    
    private static final Logger log = LoggerFactory.getLogger(ThumbnailatorRenderer.class);
    
    private final FfmpegFrameGrabber frameGrabber;
    private final ProcessingProperties properties;
    
    public ThumbnailatorRenderer(FfmpegFrameGrabber frameGrabber, ProcessingProperties properties) {
        this.frameGrabber = frameGrabber;
        this.properties = properties;
    }
    
    @Override
    public byte[] renderThumbnail(Path source, MediaKind kind, int maxSize, int quality) throws RenderException {
        requireSource(source);
        if (kind == MediaKind.VIDEO) {
            return renderFromPosterFrame(source, maxSize, quality);
        }
        return encodeBounded(decode(source), maxSize, quality);
    }
    
    @Override
    public RenderedPreview renderPreview(Path source, MediaKind kind) throws RenderException {
        requireSource(source);
        if (kind == MediaKind.VIDEO) {
            if (properties.getVideoPreviewMode() == ProcessingProperties.VideoPreviewMode.REFERENCE) {
                return RenderedPreview.originalReference();
            }
            return RenderedPreview.of(renderFromPosterFrame(source, properties.getPreviewMaxSize(), properties.getPreviewQuality()));
        }
        return RenderedPreview.of(encodeBounded(decode(source), properties.getPreviewMaxSize(), properties.getPreviewQuality()));
    }
    
    private byte[] renderFromPosterFrame(Path video, int maxSize, int quality) throws RenderException {
        Path frame = frameGrabber.grabFrame(video);
        try {
            return encodeBounded(decode(frame), maxSize, quality);
        } finally {
            try {
                Files.deleteIfExists(frame);
            } catch (IOException e) {
                log.warn("Failed to delete temporary frame {}: {}", frame, e.getMessage());
            }
        }
    }
    
    private static void requireSource(Path source) throws RenderException {
        if (!Files.isRegularFile(source)) {
            throw new RenderException(RenderException.Reason.SOURCE_MISSING, "Source file not found: " + source);
        }
    }
    
    /**
     * Decode to an opaque RGB image; JPEG cannot carry alpha.
     */
    static BufferedImage decode(Path source) throws RenderException {
        BufferedImage image;
        try {
            image = Thumbnails.of(source.toFile())
                    .scale(1.0)
                    .useExifOrientation(true)
                    .asBufferedImage();
        } catch (IOException | RuntimeException e) {
            throw new RenderException(RenderException.Reason.DECODE_FAILED,
                "Cannot decode " + source.getFileName() + ": " + e.getMessage(), e);
        }
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new RenderException(RenderException.Reason.DECODE_FAILED, "Cannot decode " + source.getFileName());
        }
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
    
    static byte[] encodeBounded(BufferedImage image, int maxSize, int quality) throws RenderException {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(image);
            if (Math.max(image.getWidth(), image.getHeight()) <= maxSize) {
                builder.scale(1.0);
            } else {
                builder.size(maxSize, maxSize).keepAspectRatio(true);
            }
            builder.outputFormat("jpg")
                   .outputQuality(Math.max(1, Math.min(100, quality)) / 100.0)
                   .toOutputStream(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new RenderException(RenderException.Reason.ENCODE_FAILED, "Cannot encode JPEG: " + e.getMessage(), e);
        }
    }
}
