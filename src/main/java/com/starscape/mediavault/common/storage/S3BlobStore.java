package com.starscape.mediavault.common.storage;

import com.starscape.mediavault.common.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;

/**
 * Blob store backed by an S3 bucket. Keys are laid out as
 * {@code <prefix>/<area>/<key>} so a bucket can be shared with other data.
 */
@Component
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "s3")
public class S3BlobStore implements BlobStore {
    
    /**
     * User metadata holding the source file's modification time in epoch millis.
     * Downloads restore it so date fallbacks see the same value as at import.
     */
    static final String SOURCE_MTIME_METADATA = "source-mtime";
    
    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);
    
    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    
    public S3BlobStore(S3Client s3Client, StorageProperties storageProperties) {
        this.s3Client = s3Client;
        this.bucket = storageProperties.getS3().getBucket();
        this.prefix = storageProperties.getS3().getPrefix();
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("app.storage.s3.bucket must be set when the s3 backend is enabled");
        }
    }
    
    @Override
    public void put(BlobArea area, String key, byte[] bytes) throws IOException {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey(area, key))
                .contentType(contentTypeOf(key))
                .contentLength((long) bytes.length)
                .build();
        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));
        } catch (S3Exception e) {
            throw new IOException("Failed to upload " + objectKey(area, key), e);
        }
    }
    
    @Override
    public void moveIn(Path source, BlobArea area, String key) throws IOException {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey(area, key))
                .contentType(contentTypeOf(key))
                .metadata(Map.of(SOURCE_MTIME_METADATA,
                    String.valueOf(Files.getLastModifiedTime(source).toMillis())))
                .build();
        try {
            s3Client.putObject(putRequest, RequestBody.fromFile(source));
        } catch (S3Exception e) {
            throw new IOException("Failed to upload " + objectKey(area, key), e);
        }
        Files.delete(source);
    }
    
    @Override
    public void moveOut(BlobArea area, String key, Path target) throws IOException {
        download(area, key, target);
        delete(area, key);
    }
    
    @Override
    public boolean exists(BlobArea area, String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey(area, key))
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }
    
    @Override
    public boolean delete(BlobArea area, String key) {
        String objectKey = objectKey(area, key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .build());
            log.debug("Deleted S3 object: bucket={}, key={}", bucket, objectKey);
            return true;
        } catch (NoSuchKeyException e) {
            log.debug("S3 object does not exist (already deleted?): bucket={}, key={}", bucket, objectKey);
            return true;
        } catch (Exception e) {
            log.error("Failed to delete S3 object: bucket={}, key={}", bucket, objectKey, e);
            return false;
        }
    }
    
    @Override
    public LocalBlob openLocal(BlobArea area, String key) throws IOException {
        String suffix = "-" + Path.of(key).getFileName().toString();
        Path temp = Files.createTempFile("media-vault-", suffix);
        Files.delete(temp);
        download(area, key, temp);
        return LocalBlob.temporaryCopy(temp);
    }
    
    private void download(BlobArea area, String key, Path target) throws IOException {
        String objectKey = objectKey(area, key);
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .build();
        GetObjectResponse response;
        try {
            response = s3Client.getObject(getRequest, ResponseTransformer.toFile(target));
        } catch (NoSuchKeyException e) {
            throw new NoSuchFileException(objectKey);
        } catch (S3Exception e) {
            throw new IOException("Failed to download " + objectKey, e);
        }
        Instant modified = sourceModifiedTime(response);
        if (modified != null) {
            Files.setLastModifiedTime(target, FileTime.from(modified));
        }
    }
    
    private static Instant sourceModifiedTime(GetObjectResponse response) {
        String stored = response.hasMetadata() ? response.metadata().get(SOURCE_MTIME_METADATA) : null;
        if (stored != null) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(stored));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {} metadata value: {}", SOURCE_MTIME_METADATA, stored);
            }
        }
        return response.lastModified();
    }
    
    String objectKey(BlobArea area, String key) {
        String base = area.directoryName() + "/" + key;
        if (prefix == null || prefix.isBlank()) {
            return base;
        }
        return prefix + "/" + base;
    }
    
    private static String contentTypeOf(String key) {
        String lower = key.toLowerCase();
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        return "application/octet-stream";
    }
}
