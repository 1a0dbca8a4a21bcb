package com.starscape.mediavault.common.storage;

import com.starscape.mediavault.common.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Blob store on the local filesystem under app.storage.root.
 */
@Component
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "local", matchIfMissing = true)
public class LocalBlobStore implements BlobStore {
    
    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);
    
    private final Path root;
    
    @Autowired
    public LocalBlobStore(StorageProperties storageProperties) {
        this(storageProperties.getRoot());
    }
    
    public LocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }
    
    @Override
    public void put(BlobArea area, String key, byte[] bytes) throws IOException {
        Path target = resolve(area, key);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
        try {
            Files.write(temp, bytes);
            moveReplacing(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
    
    @Override
    public void moveIn(Path source, BlobArea area, String key) throws IOException {
        Path target = resolve(area, key);
        Files.createDirectories(target.getParent());
        // Falls back to copy-and-delete across filesystems
        Files.move(source, target);
    }
    
    @Override
    public void moveOut(BlobArea area, String key, Path target) throws IOException {
        Path source = resolve(area, key);
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.move(source, target);
    }
    
    @Override
    public boolean exists(BlobArea area, String key) {
        return Files.isRegularFile(resolve(area, key));
    }
    
    @Override
    public boolean delete(BlobArea area, String key) {
        try {
            Files.deleteIfExists(resolve(area, key));
            return true;
        } catch (IOException e) {
            log.error("Failed to delete blob: area={}, key={}", area, key, e);
            return false;
        }
    }
    
    @Override
    public LocalBlob openLocal(BlobArea area, String key) throws IOException {
        Path path = resolve(area, key);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return LocalBlob.inPlace(path);
    }
    
    public Path resolve(BlobArea area, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Blob key cannot be blank");
        }
        Path areaDir = root.resolve(area.directoryName());
        Path resolved = areaDir.resolve(key).normalize();
        if (!resolved.startsWith(areaDir)) {
            throw new IllegalArgumentException("Blob key escapes its storage area: " + key);
        }
        return resolved;
    }
    
    private void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
