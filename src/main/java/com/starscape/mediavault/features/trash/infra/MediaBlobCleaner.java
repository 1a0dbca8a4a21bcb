package com.starscape.mediavault.features.trash.infra;

import com.starscape.mediavault.common.storage.BlobArea;
import com.starscape.mediavault.common.storage.BlobStore;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes every blob that belongs to a library item: the original, its
 * thumbnail and tiny thumbnail, and its preview. Failures are logged and
 * reported but never thrown, so database cleanup can proceed.
 */
@Service
public class MediaBlobCleaner {
    
    private static final Logger log = LoggerFactory.getLogger(MediaBlobCleaner.class);
    
    private final BlobStore blobStore;
    
    public MediaBlobCleaner(BlobStore blobStore) {
        this.blobStore = blobStore;
    }
    
    /**
     * @return true if every blob was deleted or already absent
     */
    public boolean deleteAll(MediaAsset asset) {
        boolean allSucceeded = true;
        if (asset.getThumbnailPath() != null) {
            allSucceeded &= delete(BlobArea.THUMBNAILS, asset.getThumbnailPath());
            allSucceeded &= delete(BlobArea.TINY_THUMBNAILS, asset.getThumbnailPath());
        }
        if (asset.getPreviewPath() != null) {
            allSucceeded &= delete(BlobArea.PREVIEWS, asset.getPreviewPath());
        }
        allSucceeded &= delete(BlobArea.ORIGINALS, asset.getFilePath());
        return allSucceeded;
    }
    
    private boolean delete(BlobArea area, String key) {
        boolean deleted = blobStore.delete(area, key);
        if (!deleted) {
            log.error("Failed to delete {} blob {}", area.directoryName(), key);
        }
        return deleted;
    }
}
