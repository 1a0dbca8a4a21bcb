package com.starscape.mediavault.features.library.domain;

import com.starscape.mediavault.common.domain.Entity;
import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * One unique item in the library, keyed by the hash of its content.
 *
 * <p>Identity fields ({@code id}, {@code contentHash}, {@code filename},
 * {@code filePath}) survive every metadata reset. Rows are soft-deleted via
 * {@code deletedAt} and only removed by an explicit purge.
 */
@jakarta.persistence.Entity
@Table(name = "media")
public class MediaAsset extends Entity<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;
    
    @Column(name = "content_hash", unique = true)
    private String contentHash;
    
    @Column(nullable = false)
    private String filename;
    
    @Column(name = "original_filename")
    private String originalFilename;
    
    @Column(name = "file_path", nullable = false)
    private String filePath;
    
    @Column(name = "thumbnail_path")
    private String thumbnailPath;
    
    @Column(name = "preview_path")
    private String previewPath;
    
    @Column(name = "media_type", nullable = false)
    private MediaKind mediaType;
    
    @Column(name = "mime_type")
    private String mimeType;
    
    @Column(name = "width")
    private Integer width;
    
    @Column(name = "height")
    private Integer height;
    
    @Column(name = "file_size", nullable = false)
    private long fileSize;
    
    @Column(name = "duration")
    private Double durationSeconds;
    
    @Column(name = "date_taken")
    private LocalDateTime dateTaken;
    
    @Column(name = "gps_latitude")
    private Double gpsLatitude;
    
    @Column(name = "gps_longitude")
    private Double gpsLongitude;
    
    @Column(name = "gps_altitude")
    private Double gpsAltitude;
    
    @Column(name = "location_city")
    private String locationCity;
    
    @Column(name = "location_state")
    private String locationState;
    
    @Column(name = "location_country")
    private String locationCountry;
    
    @Column(name = "camera_make")
    private String cameraMake;
    
    @Column(name = "camera_model")
    private String cameraModel;
    
    @Column(name = "lens_make")
    private String lensMake;
    
    @Column(name = "lens_model")
    private String lensModel;
    
    @Column(name = "iso")
    private Integer iso;
    
    @Column(name = "exposure_time")
    private String exposureTime;
    
    @Column(name = "f_number")
    private Double fNumber;
    
    @Column(name = "focal_length")
    private Double focalLength;
    
    @Column(name = "focal_length_35mm")
    private Integer focalLength35mm;
    
    @Column(name = "video_codec")
    private String videoCodec;
    
    @Column(name = "keywords")
    private String keywords;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    protected MediaAsset() {
        // JPA constructor
    }
    
    public MediaAsset(ContentHash contentHash, String filename, String originalFilename,
                      String filePath, MediaKind mediaType, String mimeType, long fileSize) {
        validateInput(contentHash, filename, filePath, mediaType, fileSize);
        
        this.contentHash = contentHash.value();
        this.filename = filename;
        this.originalFilename = originalFilename;
        this.filePath = filePath;
        this.mediaType = mediaType;
        this.mimeType = mimeType;
        this.fileSize = fileSize;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    private void validateInput(ContentHash contentHash, String filename, String filePath,
                               MediaKind mediaType, long fileSize) {
        if (contentHash == null) {
            throw new IllegalArgumentException("Content hash cannot be null");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be blank");
        }
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path cannot be blank");
        }
        if (mediaType == null) {
            throw new IllegalArgumentException("Media type cannot be null");
        }
        if (fileSize < 0) {
            throw new IllegalArgumentException("File size cannot be negative");
        }
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    // Getters
    public String getContentHash() { return contentHash; }
    public String getFilename() { return filename; }
    public String getOriginalFilename() { return originalFilename; }
    public String getFilePath() { return filePath; }
    public String getThumbnailPath() { return thumbnailPath; }
    public String getPreviewPath() { return previewPath; }
    public MediaKind getMediaType() { return mediaType; }
    public String getMimeType() { return mimeType; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public long getFileSize() { return fileSize; }
    public Double getDurationSeconds() { return durationSeconds; }
    public LocalDateTime getDateTaken() { return dateTaken; }
    public Double getGpsLatitude() { return gpsLatitude; }
    public Double getGpsLongitude() { return gpsLongitude; }
    public Double getGpsAltitude() { return gpsAltitude; }
    public String getLocationCity() { return locationCity; }
    public String getLocationState() { return locationState; }
    public String getLocationCountry() { return locationCountry; }
    public String getCameraMake() { return cameraMake; }
    public String getCameraModel() { return cameraModel; }
    public String getLensMake() { return lensMake; }
    public String getLensModel() { return lensModel; }
    public Integer getIso() { return iso; }
    public String getExposureTime() { return exposureTime; }
    public Double getFNumber() { return fNumber; }
    public Double getFocalLength() { return focalLength; }
    public Integer getFocalLength35mm() { return focalLength35mm; }
    public String getVideoCodec() { return videoCodec; }
    public String getKeywords() { return keywords; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getDeletedAt() { return deletedAt; }
    
    public boolean isDeleted() {
        return deletedAt != null;
    }
    
    /**
     * True when the row lacks a thumbnail or its dimensions.
     */
    public boolean needsDerivedData() {
        return thumbnailPath == null || width == null || height == null;
    }
    
    /**
     * The enrichment fields currently stored on this row.
     */
    public MetadataRecord metadata() {
        return MetadataRecord.builder()
                .dimensions(width, height)
                .durationSeconds(durationSeconds)
                .dateTaken(dateTaken)
                .gps(gpsLatitude, gpsLongitude, gpsAltitude)
                .locationCity(locationCity)
                .locationState(locationState)
                .locationCountry(locationCountry)
                .cameraMake(cameraMake)
                .cameraModel(cameraModel)
                .lensMake(lensMake)
                .lensModel(lensModel)
                .iso(iso)
                .exposureTime(exposureTime)
                .fNumber(fNumber)
                .focalLength(focalLength)
                .focalLength35mm(focalLength35mm)
                .videoCodec(videoCodec)
                .keywords(keywords)
                .build();
    }
    
    /**
     * Merge extracted metadata into this row.
     * @return true if any stored field changed
     */
    public boolean applyMetadata(MetadataRecord extracted, MergePolicy policy) {
        MetadataRecord current = metadata();
        MetadataRecord merged = policy == MergePolicy.FILL_MISSING
                ? current.orElse(extracted)
                : extracted.orElse(current);
        if (merged.equals(current)) {
            return false;
        }
        
        this.width = merged.width();
        this.height = merged.height();
        this.durationSeconds = merged.durationSeconds();
        this.dateTaken = merged.dateTaken();
        this.gpsLatitude = merged.gpsLatitude();
        this.gpsLongitude = merged.gpsLongitude();
        this.gpsAltitude = merged.gpsAltitude();
        this.locationCity = merged.locationCity();
        this.locationState = merged.locationState();
        this.locationCountry = merged.locationCountry();
        this.cameraMake = merged.cameraMake();
        this.cameraModel = merged.cameraModel();
        this.lensMake = merged.lensMake();
        this.lensModel = merged.lensModel();
        this.iso = merged.iso();
        this.exposureTime = merged.exposureTime();
        this.fNumber = merged.fNumber();
        this.focalLength = merged.focalLength();
        this.focalLength35mm = merged.focalLength35mm();
        this.videoCodec = merged.videoCodec();
        this.keywords = merged.keywords();
        this.updatedAt = Instant.now();
        return true;
    }
    
    public void attachThumbnail(String thumbnailPath) {
        this.thumbnailPath = thumbnailPath;
        this.updatedAt = Instant.now();
    }
    
    public void attachPreview(String previewPath) {
        this.previewPath = previewPath;
        this.updatedAt = Instant.now();
    }
    
    /**
     * Set the content hash on rows imported before hashing was recorded.
     * An existing hash is never overwritten.
     */
    public boolean backfillContentHash(ContentHash hash) {
        if (this.contentHash != null) {
            return false;
        }
        this.contentHash = hash.value();
        this.updatedAt = Instant.now();
        return true;
    }
    
    /**
     * Null every enrichment field and derived-asset path. MIME type and
     * file size are file facts and are kept, as are all identity fields.
     */
    public void clearDerivedData() {
        this.thumbnailPath = null;
        this.previewPath = null;
        this.width = null;
        this.height = null;
        this.durationSeconds = null;
        this.dateTaken = null;
        this.gpsLatitude = null;
        this.gpsLongitude = null;
        this.gpsAltitude = null;
        this.locationCity = null;
        this.locationState = null;
        this.locationCountry = null;
        this.cameraMake = null;
        this.cameraModel = null;
        this.lensMake = null;
        this.lensModel = null;
        this.iso = null;
        this.exposureTime = null;
        this.fNumber = null;
        this.focalLength = null;
        this.focalLength35mm = null;
        this.videoCodec = null;
        this.keywords = null;
        this.updatedAt = Instant.now();
    }
    
    /**
     * Mark as soft-deleted.
     */
    public void markDeleted() {
        if (this.deletedAt == null) {
            this.deletedAt = Instant.now();
            this.updatedAt = Instant.now();
        }
    }
    
    /**
     * Restore from soft-deleted state.
     */
    public void restore() {
        if (this.deletedAt != null) {
            this.deletedAt = null;
            this.updatedAt = Instant.now();
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
