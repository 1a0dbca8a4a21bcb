package com.starscape.mediavault.common.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable storage for originals, thumbnails and previews, addressed by area and
 * a relative key such as {@code 2024-05/20240512_101500_a1b2c3d4e5f6.jpg}.
 */
public interface BlobStore {
    
    /**
     * Store bytes under the key. Returns only once the bytes are durably in place;
     * readers never see a partially written blob.
     */
    void put(BlobArea area, String key, byte[] bytes) throws IOException;
    
    /**
     * Move a local file into the store. The source file no longer exists afterwards.
     */
    void moveIn(Path source, BlobArea area, String key) throws IOException;
    
    /**
     * Move a stored blob back out to a local file, removing it from the store.
     * Used to hand an original back to the staging area when an import is rolled back.
     */
    void moveOut(BlobArea area, String key, Path target) throws IOException;
    
    boolean exists(BlobArea area, String key);
    
    /**
     * Delete a blob.
     * @return true if the blob was deleted or did not exist, false on error
     */
    boolean delete(BlobArea area, String key);
    
    /**
     * Give local file access to a stored blob for extraction and rendering.
     * @throws java.nio.file.NoSuchFileException if the blob does not exist
     */
    LocalBlob openLocal(BlobArea area, String key) throws IOException;
}
