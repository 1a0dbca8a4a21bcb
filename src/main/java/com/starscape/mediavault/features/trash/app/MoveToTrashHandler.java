package com.starscape.mediavault.features.trash.app;

import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import org.springframework.stereotype.Service;

/**
 * Handler for soft-deleting library items. Deleting an item already in the trash is a no-op.
 */
@Service
public class MoveToTrashHandler {
    
    private final LibraryRepository library;
    
    public MoveToTrashHandler(LibraryRepository library) {
        this.library = library;
    }
    
    public void handle(Long mediaId) {
        MediaAsset asset = library.findById(mediaId)
                .orElseThrow(() -> new NotFoundException("Media not found: " + mediaId));
        if (asset.isDeleted()) {
            return;
        }
        library.moveToTrash(mediaId);
    }
}
