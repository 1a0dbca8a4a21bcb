package com.starscape.mediavault.features.library.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for library items. Every write is its own transaction,
 * and a row is only written after the blobs it references are stored.
 */
public interface LibraryRepository {
    
    Optional<MediaAsset> findById(Long id);
    
    /**
     * Look up a row by content hash, including rows in the trash.
     */
    Optional<MediaAsset> findByHash(ContentHash hash);
    
    /**
     * Insert a new row and link its keyword tags in one transaction.
     * @throws DuplicateHashException if another row with the same hash was committed first
     * @throws StorageIntegrityException if any other constraint is violated
     */
    MediaAsset insert(MediaAsset asset);
    
    /**
     * Apply a regeneration patch and link keyword tags in one transaction.
     * @throws com.starscape.mediavault.common.exception.NotFoundException if the row no longer exists
     * @throws DuplicateHashException if a backfilled hash already belongs to another row
     * @throws StorageIntegrityException if any other constraint is violated
     */
    UpdateOutcome update(Long id, MediaPatch patch);
    
    /**
     * Lazily iterate over every row in id order. Rows are fetched in pages, so
     * the library is never loaded into memory as a whole.
     */
    Iterable<MediaAsset> listAll();
    
    /**
     * Like {@link #listAll()} but limited to rows missing a thumbnail or dimensions.
     */
    Iterable<MediaAsset> listMissingDerivedData();
    
    long countAll();
    
    long countMissingDerivedData();
    
    /**
     * Null all enrichment fields and derived-asset paths on a row.
     */
    void clearDerivedData(Long id);
    
    void moveToTrash(Long id);
    
    void restoreFromTrash(Long id);
    
    List<MediaAsset> findTrashedBefore(Instant cutoff);
    
    /**
     * Remove a row and its tag links for good.
     */
    void purge(Long id);
}
