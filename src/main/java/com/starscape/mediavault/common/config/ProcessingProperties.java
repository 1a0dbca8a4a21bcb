package com.starscape.mediavault.common.config;

import com.starscape.mediavault.common.domain.MediaKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration properties for thumbnail, preview and metadata processing.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {
    
    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("bmp", "image/bmp"),
        Map.entry("tiff", "image/tiff"),
        Map.entry("tif", "image/tiff"),
        Map.entry("webp", "image/webp"),
        Map.entry("heic", "image/heic"),
        Map.entry("heif", "image/heif"),
        Map.entry("mp4", "video/mp4"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("avi", "video/x-msvideo"),
        Map.entry("mkv", "video/x-matroska"),
        Map.entry("webm", "video/webm"),
        Map.entry("m4v", "video/x-m4v")
    );
    
    public enum VideoPreviewMode { REFERENCE, POSTER }
    
    private int thumbnailMaxSize = 400;
    private int thumbnailQuality = 85;
    private int tinyThumbnailSize = 48;
    private int previewMaxSize = 1920;
    private int previewQuality = 85;
    private int videoFrameQuality = 2;
    private VideoPreviewMode videoPreviewMode = VideoPreviewMode.REFERENCE;
    private List<String> imageExtensions = List.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "webp", "heic", "heif");
    private List<String> videoExtensions = List.of("mp4", "mov", "avi", "mkv", "webm", "m4v");
    private String ffprobePath = "ffprobe";
    private String ffmpegPath = "ffmpeg";
    private Duration toolTimeout = Duration.ofSeconds(60);
    
    public int getThumbnailMaxSize() {
        return thumbnailMaxSize;
    }
    
    public void setThumbnailMaxSize(int thumbnailMaxSize) {
        this.thumbnailMaxSize = thumbnailMaxSize;
    }
    
    public int getThumbnailQuality() {
        return thumbnailQuality;
    }
    
    public void setThumbnailQuality(int thumbnailQuality) {
        this.thumbnailQuality = thumbnailQuality;
    }
    
    public int getTinyThumbnailSize() {
        return tinyThumbnailSize;
    }
    
    public void setTinyThumbnailSize(int tinyThumbnailSize) {
        this.tinyThumbnailSize = tinyThumbnailSize;
    }
    
    public int getPreviewMaxSize() {
        return previewMaxSize;
    }
    
    public void setPreviewMaxSize(int previewMaxSize) {
        this.previewMaxSize = previewMaxSize;
    }
    
    public int getPreviewQuality() {
        return previewQuality;
    }
    
    public void setPreviewQuality(int previewQuality) {
        this.previewQuality = previewQuality;
    }
    
    public int getVideoFrameQuality() {
        return videoFrameQuality;
    }
    
    public void setVideoFrameQuality(int videoFrameQuality) {
        this.videoFrameQuality = videoFrameQuality;
    }
    
    public VideoPreviewMode getVideoPreviewMode() {
        return videoPreviewMode;
    }
    
    public void setVideoPreviewMode(VideoPreviewMode videoPreviewMode) {
        this.videoPreviewMode = videoPreviewMode;
    }
    
    public List<String> getImageExtensions() {
        return imageExtensions;
    }
    
    public void setImageExtensions(List<String> imageExtensions) {
        this.imageExtensions = imageExtensions;
    }
    
    public List<String> getVideoExtensions() {
        return videoExtensions;
    }
    
    public void setVideoExtensions(List<String> videoExtensions) {
        this.videoExtensions = videoExtensions;
    }
    
    public String getFfprobePath() {
        return ffprobePath;
    }
    
    public void setFfprobePath(String ffprobePath) {
        this.ffprobePath = ffprobePath;
    }
    
    public String getFfmpegPath() {
        return ffmpegPath;
    }
    
    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }
    
    public Duration getToolTimeout() {
        return toolTimeout;
    }
    
    public void setToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
    }
    
    /**
     * Classify a file by its extension.
     * Performs case-insensitive comparison.
     * @param file The file to classify
     * @return the media kind, or empty if the extension is not supported
     */
    public Optional<MediaKind> mediaKindOf(Path file) {
        String extension = extensionOf(file);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        if (containsIgnoreCase(imageExtensions, extension)) {
            return Optional.of(MediaKind.IMAGE);
        }
        if (containsIgnoreCase(videoExtensions, extension)) {
            return Optional.of(MediaKind.VIDEO);
        }
        return Optional.empty();
    }
    
    public boolean isSupported(Path file) {
        return mediaKindOf(file).isPresent();
    }
    
    public String mimeTypeOf(Path file) {
        return MIME_TYPES.getOrDefault(extensionOf(file), "application/octet-stream");
    }
    
    /**
     * Lower-cased extension without the dot, or an empty string.
     */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == name.length() - 1) {
            return "";
        }
        return name.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }
    
    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (values == null) {
            return false;
        }
        return values.stream()
                .map(value -> value.toLowerCase(Locale.ROOT).trim())
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .anyMatch(value -> value.equals(candidate));
    }
}
