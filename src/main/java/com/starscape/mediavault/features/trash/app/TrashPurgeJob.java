package com.starscape.mediavault.features.trash.app;

import com.starscape.mediavault.common.config.TrashProperties;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Permanently deletes items whose retention period in the trash has expired.
 */
@Component
public class TrashPurgeJob {
    
    private static final Logger log = LoggerFactory.getLogger(TrashPurgeJob.class);
    
    private final LibraryRepository library;
    private final PermanentDeleteHandler permanentDeleteHandler;
    private final TrashProperties trashProperties;
    private final Clock clock;
    
    public TrashPurgeJob(
            LibraryRepository library,
            PermanentDeleteHandler permanentDeleteHandler,
            TrashProperties trashProperties,
            Clock clock) {
        this.library = library;
        this.permanentDeleteHandler = permanentDeleteHandler;
        this.trashProperties = trashProperties;
        this.clock = clock;
    }
    
    @Scheduled(cron = "${app.trash.purge-cron:0 30 3 * * *}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(trashProperties.getRetentionDays(), ChronoUnit.DAYS);
        List<MediaAsset> expired = library.findTrashedBefore(cutoff);
        if (expired.isEmpty()) {
            return;
        }
        
        log.info("Purging {} items deleted before {}", expired.size(), cutoff);
        int purged = 0;
        for (MediaAsset asset : expired) {
            try {
                permanentDeleteHandler.purge(asset);
                purged++;
            } catch (RuntimeException e) {
                log.error("Failed to purge media {}", asset.getId(), e);
            }
        }
        log.info("Purged {} of {} expired items", purged, expired.size());
    }
}
