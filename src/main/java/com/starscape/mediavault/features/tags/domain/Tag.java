package com.starscape.mediavault.features.tags.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * A library-wide tag. Tags are created from embedded keywords and can be
 * applied to many media items.
 */
@jakarta.persistence.Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_label_unique", columnNames = {"label"})
})
public class Tag extends com.starscape.mediavault.common.domain.Entity<String> {
    
    public static final int MAX_LABEL_LENGTH = 100;
    
    @Id
    @Column(name = "tag_id")
    private String tagId;
    
    @Column(nullable = false, length = MAX_LABEL_LENGTH)
    private String label;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String tagId, String label) {
        validateInput(tagId, label);
        
        this.tagId = tagId;
        this.label = normalizeLabel(label);
        this.createdAt = Instant.now();
    }
    
    private void validateInput(String tagId, String label) {
        if (tagId == null || tagId.isBlank()) {
            throw new IllegalArgumentException("Tag ID cannot be blank");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Tag label cannot be blank");
        }
        if (normalizeLabel(label).length() > MAX_LABEL_LENGTH) {
            throw new IllegalArgumentException("Tag label must be " + MAX_LABEL_LENGTH + " characters or less");
        }
    }
    
    /**
     * Normalize tag label: trim whitespace.
     */
    public static String normalizeLabel(String label) {
        return label.trim();
    }
    
    @Override
    public String getId() {
        return tagId;
    }
    
    // Getters
    public String getTagId() { return tagId; }
    public String getLabel() { return label; }
    public Instant getCreatedAt() { return createdAt; }
}
