package com.starscape.mediavault.features.tags.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for MediaTag entity.
 */
public class MediaTagId implements Serializable {
    
    private Long mediaId;
    private String tagId;
    
    public MediaTagId() {
        // JPA constructor
    }
    
    public MediaTagId(Long mediaId, String tagId) {
        this.mediaId = mediaId;
        this.tagId = tagId;
    }
    
    public Long getMediaId() { return mediaId; }
    public void setMediaId(Long mediaId) { this.mediaId = mediaId; }
    
    public String getTagId() { return tagId; }
    public void setTagId(String tagId) { this.tagId = tagId; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MediaTagId that = (MediaTagId) o;
        return Objects.equals(mediaId, that.mediaId) && Objects.equals(tagId, that.tagId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(mediaId, tagId);
    }
}
