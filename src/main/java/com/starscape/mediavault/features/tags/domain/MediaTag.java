package com.starscape.mediavault.features.tags.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Junction entity for the many-to-many relationship between media and tags.
 */
@Entity
@Table(name = "media_tags")
@IdClass(MediaTagId.class)
public class MediaTag {
    
    @Id
    @Column(name = "media_id", nullable = false)
    private Long mediaId;
    
    @Id
    @Column(name = "tag_id", nullable = false)
    private String tagId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected MediaTag() {
        // JPA constructor
    }
    
    public MediaTag(Long mediaId, String tagId) {
        if (mediaId == null) {
            throw new IllegalArgumentException("Media ID cannot be null");
        }
        if (tagId == null || tagId.isBlank()) {
            throw new IllegalArgumentException("Tag ID cannot be blank");
        }
        
        this.mediaId = mediaId;
        this.tagId = tagId;
        this.createdAt = Instant.now();
    }
    
    // Getters
    public Long getMediaId() { return mediaId; }
    public String getTagId() { return tagId; }
    public Instant getCreatedAt() { return createdAt; }
}
