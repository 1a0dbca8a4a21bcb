package com.starscape.mediavault.features.library.infra;

import com.starscape.mediavault.common.config.JobProperties;
import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.features.library.domain.ContentHash;
import com.starscape.mediavault.features.library.domain.DuplicateHashException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.library.domain.MediaPatch;
import com.starscape.mediavault.features.library.domain.StorageIntegrityException;
import com.starscape.mediavault.features.library.domain.UpdateOutcome;
import com.starscape.mediavault.features.tags.app.KeywordTagLinker;
import com.starscape.mediavault.features.tags.domain.MediaTagRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link LibraryRepository} on PostgreSQL. The partial unique index on
 * {@code media.content_hash} is the final word on duplicates; a violation of
 * it surfaces as {@link DuplicateHashException}.
 */
@Repository
public class DatabaseLibraryRepository implements LibraryRepository {
    
    static final String CONTENT_HASH_INDEX = "ux_media_content_hash";
    
    private final JpaMediaAssetRepository mediaRepository;
    private final MediaTagRepository mediaTagRepository;
    private final KeywordTagLinker tagLinker;
    private final int pageSize;
    
    public DatabaseLibraryRepository(
            JpaMediaAssetRepository mediaRepository,
            MediaTagRepository mediaTagRepository,
            KeywordTagLinker tagLinker,
            JobProperties jobProperties) {
        this.mediaRepository = mediaRepository;
        this.mediaTagRepository = mediaTagRepository;
        this.tagLinker = tagLinker;
        this.pageSize = jobProperties.getPageSize();
    }
    
    @Override
    public Optional<MediaAsset> findById(Long id) {
        return mediaRepository.findById(id);
    }
    
    @Override
    public Optional<MediaAsset> findByHash(ContentHash hash) {
        return mediaRepository.findByContentHash(hash.value());
    }
    
    @Override
    @Transactional
    public MediaAsset insert(MediaAsset asset) {
        MediaAsset saved;
        try {
            saved = mediaRepository.saveAndFlush(asset);
        } catch (DataIntegrityViolationException e) {
            throw translate(asset.getContentHash(), e);
        }
        tagLinker.link(saved.getId(), saved.getKeywords());
        return saved;
    }
    
    @Override
    @Transactional
    public UpdateOutcome update(Long id, MediaPatch patch) {
        MediaAsset asset = mediaRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Media not found: " + id));
        
        boolean metadataChanged = asset.applyMetadata(patch.metadata(), patch.policy());
        if (patch.thumbnailPath() != null) {
            asset.attachThumbnail(patch.thumbnailPath());
        }
        if (patch.previewPath() != null) {
            asset.attachPreview(patch.previewPath());
        }
        if (patch.contentHash() != null) {
            asset.backfillContentHash(patch.contentHash());
        }
        
        try {
            mediaRepository.saveAndFlush(asset);
        } catch (DataIntegrityViolationException e) {
            throw translate(asset.getContentHash(), e);
        }
        int tagsLinked = tagLinker.link(id, asset.getKeywords());
        return new UpdateOutcome(metadataChanged, tagsLinked);
    }
    
    @Override
    public Iterable<MediaAsset> listAll() {
        return new KeysetPagedIterable(afterId ->
            mediaRepository.findPageAfter(afterId, PageRequest.of(0, pageSize)));
    }
    
    @Override
    public Iterable<MediaAsset> listMissingDerivedData() {
        return new KeysetPagedIterable(afterId ->
            mediaRepository.findMissingDerivedDataPageAfter(afterId, PageRequest.of(0, pageSize)));
    }
    
    @Override
    public long countAll() {
        return mediaRepository.count();
    }
    
    @Override
    public long countMissingDerivedData() {
        return mediaRepository.countMissingDerivedData();
    }
    
    @Override
    @Transactional
    public void clearDerivedData(Long id) {
        MediaAsset asset = mediaRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Media not found: " + id));
        asset.clearDerivedData();
        mediaRepository.save(asset);
    }
    
    @Override
    @Transactional
    public void moveToTrash(Long id) {
        MediaAsset asset = mediaRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Media not found: " + id));
        asset.markDeleted();
        mediaRepository.save(asset);
    }
    
    @Override
    @Transactional
    public void restoreFromTrash(Long id) {
        MediaAsset asset = mediaRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Media not found: " + id));
        asset.restore();
        mediaRepository.save(asset);
    }
    
    @Override
    public List<MediaAsset> findTrashedBefore(Instant cutoff) {
        return mediaRepository.findTrashedBefore(cutoff);
    }
    
    @Override
    @Transactional
    public void purge(Long id) {
        mediaTagRepository.deleteByMediaId(id);
        mediaRepository.deleteById(id);
    }
    
    private RuntimeException translate(String contentHash, DataIntegrityViolationException e) {
        if (violatesContentHashIndex(e)) {
            return new DuplicateHashException(contentHash, e);
        }
        return new StorageIntegrityException("Media row rejected by the database: " + e.getMostSpecificCause().getMessage(), e);
    }
    
    private static boolean violatesContentHashIndex(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraintName = ((ConstraintViolationException) cause).getConstraintName();
                if (constraintName != null && constraintName.toLowerCase(Locale.ROOT).contains(CONTENT_HASH_INDEX)) {
                    return true;
                }
            }
            if (cause.getMessage() != null && cause.getMessage().contains(CONTENT_HASH_INDEX)) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
