package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.common.storage.BlobArea;
import com.starscape.mediavault.common.storage.BlobStore;
import com.starscape.mediavault.common.storage.LocalBlob;
import com.starscape.mediavault.features.library.app.ContentHasher;
import com.starscape.mediavault.features.library.domain.ContentHash;
import com.starscape.mediavault.features.library.domain.DuplicateHashException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.library.domain.MediaPatch;
import com.starscape.mediavault.features.library.domain.MergePolicy;
import com.starscape.mediavault.features.library.domain.StorageIntegrityException;
import com.starscape.mediavault.features.library.domain.UpdateOutcome;
import com.starscape.mediavault.features.metadata.app.MetadataExtractor;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import com.starscape.mediavault.features.rendering.app.DerivedAssetRenderer;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import com.starscape.mediavault.features.rendering.domain.RenderedPreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Rebuilds metadata and derived assets for one library row from its stored original.
 */
@Component
public class RegenerationItemProcessor {
    
    private static final Logger log = LoggerFactory.getLogger(RegenerationItemProcessor.class);
    
    private final ProcessingProperties properties;
    private final ContentHasher hasher;
    private final LibraryRepository library;
    private final MetadataExtractor metadataExtractor;
    private final DerivedAssetRenderer renderer;
    private final BlobStore blobStore;
    
    public RegenerationItemProcessor(
            ProcessingProperties properties,
            ContentHasher hasher,
            LibraryRepository library,
            MetadataExtractor metadataExtractor,
            DerivedAssetRenderer renderer,
            BlobStore blobStore) {
        this.properties = properties;
        this.hasher = hasher;
        this.library = library;
        this.metadataExtractor = metadataExtractor;
        this.renderer = renderer;
        this.blobStore = blobStore;
    }
    
    /**
     * @param policy {@link MergePolicy#FILL_MISSING} only fills gaps and keeps
     *               derived assets that are still in the store;
     *               {@link MergePolicy#REPLACE} rebuilds everything
     */
    public RegenerationOutcome process(MediaAsset asset, MergePolicy policy) {
        String name = asset.getFilename();
        try (LocalBlob original = blobStore.openLocal(BlobArea.ORIGINALS, asset.getFilePath())) {
            return regenerate(asset, original.path(), policy);
        } catch (NoSuchFileException e) {
            return RegenerationOutcome.failed("Missing file: " + asset.getFilePath());
        } catch (IOException e) {
            return RegenerationOutcome.failed(ImportItemProcessor.failure(name, e.getMessage()));
        }
    }
    
    private RegenerationOutcome regenerate(MediaAsset asset, Path file, MergePolicy policy) throws IOException {
        String name = asset.getFilename();
        ContentHash hash = hasher.hash(file);
        ContentHash backfill = null;
        if (asset.getContentHash() == null) {
            backfill = hash;
        } else if (!asset.getContentHash().equals(hash.value())) {
            log.warn("Content hash mismatch for media {} ({}): stored {}, computed {}",
                asset.getId(), name, asset.getContentHash(), hash.value());
        }
        
        MetadataRecord metadata = metadataExtractor.extract(file, asset.getMediaType());
        
        String derivedKey = asset.getThumbnailPath() != null
                ? asset.getThumbnailPath()
                : StorageLayout.derivedKeyFor(asset.getFilePath());
        boolean renderThumbnail = policy == MergePolicy.REPLACE
                || asset.getThumbnailPath() == null
                || !blobStore.exists(BlobArea.THUMBNAILS, asset.getThumbnailPath());
        boolean renderPreview = policy == MergePolicy.REPLACE
                || asset.getPreviewPath() == null
                || !blobStore.exists(BlobArea.PREVIEWS, asset.getPreviewPath());
        String previewKey = asset.getPreviewPath() != null ? asset.getPreviewPath() : derivedKey;
        
        byte[] thumbnail = null;
        byte[] tinyThumbnail = null;
        RenderedPreview preview = null;
        try {
            if (renderThumbnail) {
                thumbnail = renderer.renderThumbnail(file, asset.getMediaType(),
                    properties.getThumbnailMaxSize(), properties.getThumbnailQuality());
            }
            if (renderPreview) {
                preview = renderer.renderPreview(file, asset.getMediaType());
            }
        } catch (RenderException e) {
            return RegenerationOutcome.failed(ImportItemProcessor.failure(name, e.getMessage()));
        }
        if (renderThumbnail) {
            try {
                tinyThumbnail = renderer.renderThumbnail(file, asset.getMediaType(),
                    properties.getTinyThumbnailSize(), properties.getThumbnailQuality());
            } catch (RenderException e) {
                log.warn("Tiny thumbnail skipped for {}: {}", name, e.getMessage());
            }
        }
        
        boolean previewStored = false;
        if (thumbnail != null) {
            blobStore.put(BlobArea.THUMBNAILS, derivedKey, thumbnail);
        }
        if (tinyThumbnail != null) {
            blobStore.put(BlobArea.TINY_THUMBNAILS, derivedKey, tinyThumbnail);
        }
        if (preview != null && !preview.referencesOriginal()) {
            blobStore.put(BlobArea.PREVIEWS, previewKey, preview.bytes());
            previewStored = true;
        }
        
        MediaPatch patch = new MediaPatch(metadata, policy,
            thumbnail != null ? derivedKey : null,
            previewStored ? previewKey : null,
            backfill);
        try {
            UpdateOutcome outcome = library.update(asset.getId(), patch);
            log.debug("Regenerated media {} ({}): metadataChanged={}, thumbnail={}, tagsLinked={}",
                asset.getId(), name, outcome.metadataChanged(), thumbnail != null, outcome.tagsLinked());
            return RegenerationOutcome.succeeded(outcome.metadataChanged(), thumbnail != null, outcome.tagsLinked());
        } catch (DuplicateHashException e) {
            return RegenerationOutcome.failed(ImportItemProcessor.failure(name,
                "content duplicates another item (" + hash.value() + ")"));
        } catch (NotFoundException e) {
            return RegenerationOutcome.failed(ImportItemProcessor.failure(name, "removed during regeneration"));
        } catch (StorageIntegrityException e) {
            return RegenerationOutcome.failed(ImportItemProcessor.failure(name, e.getMessage()));
        }
    }
    
    /**
     * Null a row's enrichment fields and derived paths, keeping its identity,
     * then delete the blobs those paths pointed at.
     */
    public void clearDerivedAssets(MediaAsset asset) {
        String thumbnailPath = asset.getThumbnailPath();
        String previewPath = asset.getPreviewPath();
        library.clearDerivedData(asset.getId());
        
        boolean allDeleted = true;
        if (thumbnailPath != null) {
            allDeleted &= blobStore.delete(BlobArea.THUMBNAILS, thumbnailPath);
            allDeleted &= blobStore.delete(BlobArea.TINY_THUMBNAILS, thumbnailPath);
        }
        if (previewPath != null) {
            allDeleted &= blobStore.delete(BlobArea.PREVIEWS, previewPath);
        }
        if (!allDeleted) {
            log.warn("Some derived blobs failed to delete for media {}, the row is already cleared", asset.getId());
        }
    }
}
