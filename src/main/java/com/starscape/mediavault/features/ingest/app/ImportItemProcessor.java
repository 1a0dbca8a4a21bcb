package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.common.storage.BlobArea;
import com.starscape.mediavault.common.storage.BlobStore;
import com.starscape.mediavault.features.library.app.ContentHasher;
import com.starscape.mediavault.features.library.domain.ContentHash;
import com.starscape.mediavault.features.library.domain.DuplicateHashException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.library.domain.MergePolicy;
import com.starscape.mediavault.features.metadata.app.MetadataExtractor;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import com.starscape.mediavault.features.rendering.app.DerivedAssetRenderer;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import com.starscape.mediavault.features.rendering.domain.RenderedPreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports a single staged file: hash, dedup, extract, render, store, insert.
 *
 * <p>Blobs are written before the row, and the original is moved in last, so a
 * committed row always points at stored files. When the insert fails the
 * derived blobs are deleted and the original goes back to where it was staged.
 */
@Component
public class ImportItemProcessor {
    
    private static final Logger log = LoggerFactory.getLogger(ImportItemProcessor.class);
    
    private final ProcessingProperties properties;
    private final ContentHasher hasher;
    private final LibraryRepository library;
    private final MetadataExtractor metadataExtractor;
    private final DerivedAssetRenderer renderer;
    private final BlobStore blobStore;
    private final StorageLayout layout;
    
    public ImportItemProcessor(
            ProcessingProperties properties,
            ContentHasher hasher,
            LibraryRepository library,
            MetadataExtractor metadataExtractor,
            DerivedAssetRenderer renderer,
            BlobStore blobStore,
            StorageLayout layout) {
        this.properties = properties;
        this.hasher = hasher;
        this.library = library;
        this.metadataExtractor = metadataExtractor;
        this.renderer = renderer;
        this.blobStore = blobStore;
        this.layout = layout;
    }
    
    public ImportOutcome process(ImportCandidate candidate) {
        Path staged;
        try {
            staged = candidate.stage();
        } catch (IOException e) {
            return ImportOutcome.failed(e.getMessage());
        }
        
        try {
            return importStaged(staged, candidate.displayName(), candidate.originalName());
        } finally {
            candidate.release(staged);
        }
    }
    
    private ImportOutcome importStaged(Path file, String name, String originalName) {
        if (!Files.isRegularFile(file)) {
            return ImportOutcome.failed("Missing file: " + name);
        }
        Optional<MediaKind> kind = properties.mediaKindOf(file);
        if (kind.isEmpty()) {
            return ImportOutcome.failed(failure(name, "unsupported file type"));
        }
        
        ContentHash hash;
        long fileSize;
        try {
            hash = hasher.hash(file);
            fileSize = Files.size(file);
        } catch (IOException e) {
            return ImportOutcome.failed(failure(name, "cannot read file: " + e.getMessage()));
        }
        
        Optional<MediaAsset> existing = library.findByHash(hash);
        if (existing.isPresent()) {
            return skipDuplicate(existing.get(), file, name);
        }
        
        MetadataRecord metadata = metadataExtractor.extract(file, kind.get());
        StorageLayout.Keys keys = layout.keysFor(file, metadata.dateTaken());
        
        byte[] thumbnail;
        RenderedPreview preview;
        try {
            thumbnail = renderer.renderThumbnail(file, kind.get(),
                properties.getThumbnailMaxSize(), properties.getThumbnailQuality());
            preview = renderer.renderPreview(file, kind.get());
        } catch (RenderException e) {
            return ImportOutcome.failed(failure(name, e.getMessage()));
        }
        byte[] tinyThumbnail = renderTinyThumbnail(file, kind.get(), name);
        
        List<BlobArea> written = new ArrayList<>();
        try {
            blobStore.put(BlobArea.THUMBNAILS, keys.derived(), thumbnail);
            written.add(BlobArea.THUMBNAILS);
            if (tinyThumbnail != null) {
                blobStore.put(BlobArea.TINY_THUMBNAILS, keys.derived(), tinyThumbnail);
                written.add(BlobArea.TINY_THUMBNAILS);
            }
            if (!preview.referencesOriginal()) {
                blobStore.put(BlobArea.PREVIEWS, keys.derived(), preview.bytes());
                written.add(BlobArea.PREVIEWS);
            }
            blobStore.moveIn(file, BlobArea.ORIGINALS, keys.original());
        } catch (IOException e) {
            deleteBlobs(written, keys.derived());
            return ImportOutcome.failed(failure(name, "storage failed: " + e.getMessage()));
        }
        
        MediaAsset asset = new MediaAsset(hash, keys.filename(), originalName,
            keys.original(), kind.get(), properties.mimeTypeOf(file), fileSize);
        asset.applyMetadata(metadata, MergePolicy.FILL_MISSING);
        asset.attachThumbnail(keys.derived());
        if (!preview.referencesOriginal()) {
            asset.attachPreview(keys.derived());
        }
        
        try {
            MediaAsset saved = library.insert(asset);
            log.debug("Imported {} as media {} ({})", name, saved.getId(), keys.original());
            return ImportOutcome.imported(saved.getId());
        } catch (DuplicateHashException e) {
            log.info("Duplicate of {} committed concurrently, discarding {}", hash.value(), name);
            deleteBlobs(written, keys.derived());
            blobStore.delete(BlobArea.ORIGINALS, keys.original());
            return ImportOutcome.duplicate(null);
        } catch (RuntimeException e) {
            deleteBlobs(written, keys.derived());
            restoreOriginal(keys.original(), file);
            return ImportOutcome.failed(failure(name, e.getMessage()));
        }
    }
    
    private ImportOutcome skipDuplicate(MediaAsset existing, Path file, String name) {
        if (existing.isDeleted()) {
            library.restoreFromTrash(existing.getId());
            log.info("Restored media {} from trash, re-imported as {}", existing.getId(), name);
        } else {
            log.debug("Skipping {}: duplicate of media {}", name, existing.getId());
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove duplicate staged file {}: {}", file, e.getMessage());
        }
        return ImportOutcome.duplicate(existing.getId());
    }
    
    private byte[] renderTinyThumbnail(Path file, MediaKind kind, String name) {
        try {
            return renderer.renderThumbnail(file, kind,
                properties.getTinyThumbnailSize(), properties.getThumbnailQuality());
        } catch (RenderException e) {
            log.warn("Tiny thumbnail skipped for {}: {}", name, e.getMessage());
            return null;
        }
    }
    
    private void restoreOriginal(String originalKey, Path stagedPath) {
        try {
            blobStore.moveOut(BlobArea.ORIGINALS, originalKey, stagedPath);
        } catch (IOException e) {
            log.error("Could not move original {} back to {}: {}", originalKey, stagedPath, e.getMessage());
        }
    }
    
    private void deleteBlobs(List<BlobArea> areas, String key) {
        for (BlobArea area : areas) {
            if (!blobStore.delete(area, key)) {
                log.warn("Could not delete {} blob {}", area.directoryName(), key);
            }
        }
    }
    
    static String failure(String name, String cause) {
        return "Failed to process " + name + ": " + cause;
    }
}
