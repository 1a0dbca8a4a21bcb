package com.starscape.mediavault.features.library.infra;

import com.starscape.mediavault.features.library.domain.MediaAsset;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaMediaAssetRepository extends JpaRepository<MediaAsset, Long> {
    
    Optional<MediaAsset> findByContentHash(String contentHash);
    
    @Query("SELECT m FROM MediaAsset m WHERE m.id > :afterId ORDER BY m.id ASC")
    List<MediaAsset> findPageAfter(@Param("afterId") long afterId, Pageable pageable);
    
    @Query("SELECT m FROM MediaAsset m WHERE m.id > :afterId "
            + "AND (m.thumbnailPath IS NULL OR m.width IS NULL OR m.height IS NULL) ORDER BY m.id ASC")
    List<MediaAsset> findMissingDerivedDataPageAfter(@Param("afterId") long afterId, Pageable pageable);
    
    @Query("SELECT COUNT(m) FROM MediaAsset m WHERE m.thumbnailPath IS NULL OR m.width IS NULL OR m.height IS NULL")
    long countMissingDerivedData();
    
    @Query("SELECT m FROM MediaAsset m WHERE m.deletedAt IS NOT NULL AND m.deletedAt < :cutoff ORDER BY m.deletedAt ASC")
    List<MediaAsset> findTrashedBefore(@Param("cutoff") Instant cutoff);
}
