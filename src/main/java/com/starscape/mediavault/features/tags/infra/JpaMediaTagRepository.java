package com.starscape.mediavault.features.tags.infra;

import com.starscape.mediavault.features.tags.domain.MediaTag;
import com.starscape.mediavault.features.tags.domain.MediaTagId;
import com.starscape.mediavault.features.tags.domain.MediaTagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository implementation for MediaTag junction entity.
 */
@Repository
public interface JpaMediaTagRepository extends JpaRepository<MediaTag, MediaTagId>, MediaTagRepository {
    
    @Override
    List<MediaTag> findByMediaId(Long mediaId);
    
    @Override
    boolean existsByMediaIdAndTagId(Long mediaId, String tagId);
    
    @Override
    @Modifying
    @Query("DELETE FROM MediaTag mt WHERE mt.mediaId = :mediaId")
    void deleteByMediaId(@Param("mediaId") Long mediaId);
}
