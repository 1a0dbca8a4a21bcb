package com.starscape.mediavault.common.storage;

/**
 * Storage areas for originals and their derived assets.
 * The directory name doubles as the object-key prefix on S3.
 */
public enum BlobArea {
    ORIGINALS("originals"),
    THUMBNAILS("thumbnails"),
    TINY_THUMBNAILS("thumbnails_tiny"),
    PREVIEWS("previews");
    
    private final String directoryName;
    
    BlobArea(String directoryName) {
        this.directoryName = directoryName;
    }
    
    public String directoryName() {
        return directoryName;
    }
}
