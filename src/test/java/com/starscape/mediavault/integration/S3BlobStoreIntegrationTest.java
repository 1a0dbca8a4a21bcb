package com.starscape.mediavault.integration;

import com.starscape.mediavault.common.config.StorageProperties;
import com.starscape.mediavault.common.storage.BlobArea;
import com.starscape.mediavault.common.storage.LocalBlob;
import com.starscape.mediavault.common.storage.S3BlobStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;

/**
 * Runs the S3 blob store against LocalStack.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3BlobStoreIntegrationTest {
    
    private static final String TEST_BUCKET = "media-vault-test";
    
    @Container
    static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.8.1"))
            .withServices(S3);
    
    private static S3Client s3Client;
    private static S3BlobStore blobStore;
    
    @TempDir
    Path tempDir;
    
    @BeforeAll
    static void setUp() {
        s3Client = S3Client.builder()
                .endpointOverride(localstack.getEndpointOverride(S3))
                .credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(localstack.getAccessKey(), localstack.getSecretKey())))
                .region(Region.of(localstack.getRegion()))
                .forcePathStyle(true)
                .build();
        s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
        
        StorageProperties properties = new StorageProperties();
        properties.getS3().setBucket(TEST_BUCKET);
        properties.getS3().setPrefix("media");
        blobStore = new S3BlobStore(s3Client, properties);
    }
    
    @Test
    void putStoresUnderAreaPrefix() throws Exception {
        blobStore.put(BlobArea.THUMBNAILS, "2024-05/a.jpg", "thumb".getBytes(StandardCharsets.UTF_8));
        
        assertTrue(blobStore.exists(BlobArea.THUMBNAILS, "2024-05/a.jpg"));
        assertFalse(blobStore.exists(BlobArea.PREVIEWS, "2024-05/a.jpg"));
        assertEquals(5L, s3Client.headObject(HeadObjectRequest.builder()
                .bucket(TEST_BUCKET)
                .key("media/thumbnails/2024-05/a.jpg")
                .build()).contentLength());
    }
    
    @Test
    void moveInAndMoveOutTransferOwnership() throws Exception {
        Path source = Files.writeString(tempDir.resolve("b.jpg"), "original");
        
        blobStore.moveIn(source, BlobArea.ORIGINALS, "2024-05/b.jpg");
        
        assertFalse(Files.exists(source));
        assertTrue(blobStore.exists(BlobArea.ORIGINALS, "2024-05/b.jpg"));
        
        Path target = tempDir.resolve("restored.jpg");
        blobStore.moveOut(BlobArea.ORIGINALS, "2024-05/b.jpg", target);
        
        assertEquals("original", Files.readString(target));
        assertFalse(blobStore.exists(BlobArea.ORIGINALS, "2024-05/b.jpg"));
    }
    
    @Test
    void openLocalDownloadsATemporaryCopy() throws Exception {
        blobStore.put(BlobArea.ORIGINALS, "2024-05/c.jpg", "content".getBytes(StandardCharsets.UTF_8));
        
        Path copy;
        try (LocalBlob blob = blobStore.openLocal(BlobArea.ORIGINALS, "2024-05/c.jpg")) {
            copy = blob.path();
            assertEquals("content", Files.readString(copy));
        }
        
        assertFalse(Files.exists(copy));
        assertThrows(NoSuchFileException.class, () -> blobStore.openLocal(BlobArea.ORIGINALS, "missing.jpg"));
    }
    
    @Test
    void originalKeepsItsModificationTimeThroughStorage() throws Exception {
        Instant taken = Instant.parse("2019-07-04T08:30:00Z");
        Path source = Files.writeString(tempDir.resolve("e.jpg"), "no exif");
        Files.setLastModifiedTime(source, FileTime.from(taken));
        
        blobStore.moveIn(source, BlobArea.ORIGINALS, "2019-07/e.jpg");
        
        try (LocalBlob blob = blobStore.openLocal(BlobArea.ORIGINALS, "2019-07/e.jpg")) {
            assertEquals(taken, Files.getLastModifiedTime(blob.path()).toInstant());
        }
    }
    
    @Test
    void deleteIsIdempotent() throws Exception {
        blobStore.put(BlobArea.PREVIEWS, "2024-05/d.jpg", "preview".getBytes(StandardCharsets.UTF_8));
        
        assertTrue(blobStore.delete(BlobArea.PREVIEWS, "2024-05/d.jpg"));
        assertTrue(blobStore.delete(BlobArea.PREVIEWS, "2024-05/d.jpg"));
        assertFalse(blobStore.exists(BlobArea.PREVIEWS, "2024-05/d.jpg"));
    }
}
