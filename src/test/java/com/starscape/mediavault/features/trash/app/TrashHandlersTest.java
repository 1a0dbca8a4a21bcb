package com.starscape.mediavault.features.trash.app;

import com.starscape.mediavault.common.config.TrashProperties;
import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.common.storage.BlobArea;
import com.starscape.mediavault.common.storage.LocalBlobStore;
import com.starscape.mediavault.features.library.domain.ContentHash;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.trash.infra.MediaBlobCleaner;
import com.starscape.mediavault.support.InMemoryLibraryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TrashHandlersTest {
    
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String ORIGINAL = "2024-05/20240512_101500_a1b2c3d4e5f6.jpg";
    
    @TempDir
    Path tempDir;
    
    private InMemoryLibraryRepository library;
    private LocalBlobStore blobStore;
    private MoveToTrashHandler moveToTrash;
    private RestoreFromTrashHandler restore;
    private PermanentDeleteHandler permanentDelete;
    private TrashPurgeJob purgeJob;
    
    @BeforeEach
    void setUp() {
        library = new InMemoryLibraryRepository();
        blobStore = new LocalBlobStore(tempDir);
        TrashProperties trashProperties = new TrashProperties();
        trashProperties.setRetentionDays(30);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        moveToTrash = new MoveToTrashHandler(library);
        restore = new RestoreFromTrashHandler(library);
        permanentDelete = new PermanentDeleteHandler(library, new MediaBlobCleaner(blobStore), trashProperties, clock);
        purgeJob = new TrashPurgeJob(library, permanentDelete, trashProperties, clock);
    }
    
    private MediaAsset storedAsset(String hash) throws IOException {
        MediaAsset asset = new MediaAsset(ContentHash.sha256(hash), "20240512_101500_a1b2c3d4e5f6.jpg",
            "IMG_0001.jpg", ORIGINAL, MediaKind.IMAGE, "image/jpeg", 5L);
        asset.attachThumbnail(ORIGINAL);
        asset.attachPreview(ORIGINAL);
        for (BlobArea area : BlobArea.values()) {
            blobStore.put(area, ORIGINAL, "bytes".getBytes(StandardCharsets.UTF_8));
        }
        return library.seed(asset);
    }
    
    private void trashedAgo(MediaAsset asset, Duration age) {
        ReflectionTestUtils.setField(asset, "deletedAt", NOW.minus(age));
    }
    
    @Test
    void moveToTrashIsIdempotent() throws IOException {
        MediaAsset asset = storedAsset("h1");
        
        moveToTrash.handle(asset.getId());
        Instant deletedAt = asset.getDeletedAt();
        moveToTrash.handle(asset.getId());
        
        assertTrue(asset.isDeleted());
        assertEquals(deletedAt, asset.getDeletedAt());
        assertTrue(blobStore.exists(BlobArea.ORIGINALS, ORIGINAL));
    }
    
    @Test
    void unknownMediaIsNotFound() {
        assertThrows(NotFoundException.class, () -> moveToTrash.handle(99L));
        assertThrows(NotFoundException.class, () -> restore.handle(99L));
        assertThrows(NotFoundException.class, () -> permanentDelete.handle(99L));
    }
    
    @Test
    void restoreRequiresTrashedMedia() throws IOException {
        MediaAsset asset = storedAsset("h1");
        
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> restore.handle(asset.getId()));
        assertEquals("Media is not in the trash", e.getMessage());
        
        moveToTrash.handle(asset.getId());
        restore.handle(asset.getId());
        assertFalse(asset.isDeleted());
    }
    
    @Test
    void permanentDeleteRequiresTrash() throws IOException {
        MediaAsset asset = storedAsset("h1");
        
        assertThrows(IllegalArgumentException.class, () -> permanentDelete.handle(asset.getId()));
        assertTrue(library.findById(asset.getId()).isPresent());
    }
    
    @Test
    void permanentDeleteWaitsForRetention() throws IOException {
        MediaAsset asset = storedAsset("h1");
        trashedAgo(asset, Duration.ofDays(10));
        
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> permanentDelete.handle(asset.getId()));
        
        assertTrue(e.getMessage().contains("21 days remaining"), e.getMessage());
        assertTrue(blobStore.exists(BlobArea.ORIGINALS, ORIGINAL));
    }
    
    @Test
    void permanentDeleteRemovesRowAndEveryBlob() throws IOException {
        MediaAsset asset = storedAsset("h1");
        trashedAgo(asset, Duration.ofDays(31));
        
        permanentDelete.handle(asset.getId());
        
        assertTrue(library.findById(asset.getId()).isEmpty());
        for (BlobArea area : BlobArea.values()) {
            assertFalse(blobStore.exists(area, ORIGINAL), area.name());
        }
    }
    
    @Test
    void purgeJobOnlyRemovesExpiredItems() throws IOException {
        MediaAsset expired = storedAsset("h1");
        trashedAgo(expired, Duration.ofDays(45));
        MediaAsset recent = storedAsset("h2");
        trashedAgo(recent, Duration.ofDays(2));
        MediaAsset live = storedAsset("h3");
        
        purgeJob.purgeExpired();
        
        assertTrue(library.findById(expired.getId()).isEmpty());
        assertTrue(library.findById(recent.getId()).isPresent());
        assertTrue(library.findById(live.getId()).isPresent());
    }
}
