package com.starscape.mediavault.features.trash.app;

import com.starscape.mediavault.common.exception.NotFoundException;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import org.springframework.stereotype.Service;

@Service
public class RestoreFromTrashHandler {
    
    private final LibraryRepository library;
    
    public RestoreFromTrashHandler(LibraryRepository library) {
        this.library = library;
    }
    
    public void handle(Long mediaId) {
        MediaAsset asset = library.findById(mediaId)
                .orElseThrow(() -> new NotFoundException("Media not found: " + mediaId));
        if (!asset.isDeleted()) {
            throw new IllegalArgumentException("Media is not in the trash");
        }
        library.restoreFromTrash(mediaId);
    }
}
