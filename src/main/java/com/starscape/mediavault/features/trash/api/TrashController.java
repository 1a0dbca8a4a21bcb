package com.starscape.mediavault.features.trash.api;

import com.starscape.mediavault.features.trash.app.MoveToTrashHandler;
import com.starscape.mediavault.features.trash.app.PermanentDeleteHandler;
import com.starscape.mediavault.features.trash.app.RestoreFromTrashHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for media deletion operations.
 * Handles soft delete, restore, and permanent deletion.
 */
@RestController
@RequestMapping("/commands/media")
public class TrashController {
    
    private final MoveToTrashHandler moveToTrashHandler;
    private final RestoreFromTrashHandler restoreFromTrashHandler;
    private final PermanentDeleteHandler permanentDeleteHandler;
    
    public TrashController(
            MoveToTrashHandler moveToTrashHandler,
            RestoreFromTrashHandler restoreFromTrashHandler,
            PermanentDeleteHandler permanentDeleteHandler) {
        this.moveToTrashHandler = moveToTrashHandler;
        this.restoreFromTrashHandler = restoreFromTrashHandler;
        this.permanentDeleteHandler = permanentDeleteHandler;
    }
    
    /**
     * DELETE /commands/media/{mediaId}
     */
    @DeleteMapping("/{mediaId}")
    public ResponseEntity<Void> moveToTrash(@PathVariable Long mediaId) {
        moveToTrashHandler.handle(mediaId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
    
    /**
     * POST /commands/media/{mediaId}/restore
     */
    @PostMapping("/{mediaId}/restore")
    public ResponseEntity<Void> restore(@PathVariable Long mediaId) {
        restoreFromTrashHandler.handle(mediaId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
    
    /**
     * Permanently delete an item once its retention period in the trash is over.
     * DELETE /commands/media/{mediaId}/permanent
     */
    @DeleteMapping("/{mediaId}/permanent")
    public ResponseEntity<Void> deletePermanently(@PathVariable Long mediaId) {
        permanentDeleteHandler.handle(mediaId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
