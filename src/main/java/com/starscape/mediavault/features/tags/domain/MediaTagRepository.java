package com.starscape.mediavault.features.tags.domain;

import java.util.List;

/**
 * Repository interface for MediaTag junction entity.
 */
public interface MediaTagRepository {
    MediaTag save(MediaTag mediaTag);
    List<MediaTag> findByMediaId(Long mediaId);
    boolean existsByMediaIdAndTagId(Long mediaId, String tagId);
    void deleteByMediaId(Long mediaId);
}
