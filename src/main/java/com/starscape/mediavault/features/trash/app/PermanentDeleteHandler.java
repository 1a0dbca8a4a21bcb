package com.starscape.mediavault.features.trash.app;

import com.starscape.mediavault.common.config.TrashProperties;
import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.trash.infra.MediaBlobCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Handler for permanently deleting library items.
 * Only allows deletion once an item has been in the trash for the retention period.
 * The row and its tag links go first, then every blob of the item.
 */
@Service
public class PermanentDeleteHandler {
    
    private static final Logger log = LoggerFactory.getLogger(PermanentDeleteHandler.class);
    
    private final LibraryRepository library;
    private final MediaBlobCleaner blobCleaner;
    private final TrashProperties trashProperties;
    private final Clock clock;
    
    public PermanentDeleteHandler(
            LibraryRepository library,
            MediaBlobCleaner blobCleaner,
            TrashProperties trashProperties,
            Clock clock) {
        this.library = library;
        this.blobCleaner = blobCleaner;
        this.trashProperties = trashProperties;
        this.clock = clock;
    }
    
    public void handle(Long mediaId) {
        MediaAsset asset = library.findById(mediaId)
                .orElseThrow(() -> new NotFoundException("Media not found: " + mediaId));
        
        if (!asset.isDeleted()) {
            throw new IllegalArgumentException("Media must be in the trash before permanent deletion");
        }
        
        Instant cutoff = clock.instant().minus(trashProperties.getRetentionDays(), ChronoUnit.DAYS);
        if (asset.getDeletedAt().isAfter(cutoff)) {
            long daysRemaining = ChronoUnit.DAYS.between(cutoff, asset.getDeletedAt()) + 1;
            throw new IllegalArgumentException(
                String.format("Media cannot be permanently deleted yet. %d days remaining in retention period.", daysRemaining));
        }
        
        purge(asset);
    }
    
    /**
     * Remove the row, its tag links and its blobs without any retention check.
     */
    void purge(MediaAsset asset) {
        library.purge(asset.getId());
        if (!blobCleaner.deleteAll(asset)) {
            log.warn("Some blobs failed to delete for media {}, the row is already gone", asset.getId());
        }
        log.info("Permanently deleted media {} ({})", asset.getId(), asset.getFilePath());
    }
}
