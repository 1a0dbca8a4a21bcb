package com.starscape.mediavault.integration;

import com.starscape.mediavault.common.domain.MediaKind;
import com.starscape.mediavault.features.library.app.ContentHasher;
import com.starscape.mediavault.features.library.domain.ContentHash;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.library.domain.MergePolicy;
import com.starscape.mediavault.features.metadata.domain.MetadataRecord;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the job endpoints.
 * Tests: stage files → start import → poll status → verify library and history
 */
public class ImportFlowIntegrationTest extends BaseIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    @Autowired
    private LibraryRepository library;
    
    @Autowired
    private ContentHasher contentHasher;
    
    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
        awaitIdle();
    }
    
    private void awaitIdle() {
        await().atMost(Duration.ofSeconds(30))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() ->
                    given()
                        .get("/queries/jobs/current")
                        .then()
                        .statusCode(200)
                        .body("state", not(equalTo("running"))));
    }
    
    private Path stage(String name, byte[] content) throws Exception {
        Path file = importsDir().resolve(name);
        Files.write(file, content);
        return file;
    }
    
    @Test
    void shouldImportStagedFilesAndSkipDuplicates() throws Exception {
        byte[] first = TestUtils.createTestImage(317, 211);
        byte[] second = TestUtils.createTestImage(211, 317);
        Path firstFile = stage("first.jpg", first);
        ContentHash firstHash = contentHasher.hash(firstFile);
        stage("second.jpg", second);
        stage("second-copy.jpg", second);
        
        given()
                .post("/commands/imports/local")
                .then()
                .statusCode(202)
                .body("status", equalTo("running"));
        
        await().atMost(Duration.ofSeconds(30))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() ->
                    given()
                        .get("/queries/imports/status")
                        .then()
                        .statusCode(200)
                        .body("state", equalTo("completed"))
                        .body("source", equalTo("local"))
                        .body("totalFiles", equalTo(3))
                        .body("successfulImports", equalTo(2))
                        .body("skippedDuplicates", equalTo(1))
                        .body("failedImports", equalTo(0)));
        
        MediaAsset imported = library.findByHash(firstHash).orElseThrow();
        assertEquals(MediaKind.IMAGE, imported.getMediaType());
        assertEquals(317, imported.getWidth());
        assertEquals(211, imported.getHeight());
        assertNotNull(imported.getThumbnailPath());
        assertTrue(Files.exists(STORAGE_ROOT.resolve("originals").resolve(imported.getFilePath())));
        assertTrue(Files.exists(STORAGE_ROOT.resolve("thumbnails").resolve(imported.getThumbnailPath())));
        assertFalse(Files.exists(firstFile), "imported files leave the staging directory");
        
        given()
                .queryParam("limit", 5)
                .get("/queries/jobs/history")
                .then()
                .statusCode(200)
                .body("[0].kind", equalTo("import"))
                .body("[0].status", equalTo("completed"))
                .body("[0].totalItems", equalTo(3));
    }
    
    @Test
    void shouldRegenerateLibrary() throws Exception {
        stage("regen.jpg", TestUtils.createTestImage(123, 77));
        given().post("/commands/imports/local").then().statusCode(202);
        awaitIdle();
        
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("missingOnly", false))
                .post("/commands/regenerations")
                .then()
                .statusCode(202)
                .body("message", equalTo("Full regeneration started"));
        
        await().atMost(Duration.ofSeconds(30))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() ->
                    given()
                        .get("/queries/regenerations/status")
                        .then()
                        .statusCode(200)
                        .body("state", oneOf("completed", "failed"))
                        .body("missingOnly", equalTo(false)));
        
        given()
                .get("/queries/regenerations/status")
                .then()
                .body("processedMedia", greaterThan(0));
    }
    
    @Test
    void shouldRejectWebDavImportWhenNotConfigured() {
        given()
                .post("/commands/imports/webdav")
                .then()
                .statusCode(503)
                .body("code", equalTo("SOURCE_UNAVAILABLE"));
        
        given()
                .get("/queries/imports/status")
                .then()
                .body("state", equalTo("failed"))
                .body("source", equalTo("webdav"));
    }
    
    @Test
    void cancelWithoutRunningJobIsANoOp() {
        given()
                .post("/commands/jobs/cancel")
                .then()
                .statusCode(200)
                .body("status", equalTo("idle"));
    }
    
    @Test
    void historyLimitMustBePositive() {
        given()
                .queryParam("limit", 0)
                .get("/queries/jobs/history")
                .then()
                .statusCode(400)
                .body("message", equalTo("Limit must be at least 1"));
    }
    
    @Test
    void shouldListKeywordTags() {
        String hash = Long.toHexString(System.nanoTime()) + "feedface";
        MediaAsset asset = new MediaAsset(ContentHash.sha256(hash), hash + ".jpg", "tagged.jpg",
            "2024-05/" + hash + ".jpg", MediaKind.IMAGE, "image/jpeg", 10L);
        asset.applyMetadata(MetadataRecord.builder().keywords("marina, dunes").build(), MergePolicy.REPLACE);
        library.insert(asset);
        
        given()
                .get("/queries/tags")
                .then()
                .statusCode(200)
                .body("tags", hasItems("dunes", "marina"));
    }
    
    @Test
    void shouldMoveToTrashAndRestore() {
        String hash = Long.toHexString(System.nanoTime()) + "deadbeef";
        MediaAsset saved = library.insert(new MediaAsset(ContentHash.sha256(hash), hash + ".jpg", "trash.jpg",
            "2024-05/" + hash + ".jpg", MediaKind.IMAGE, "image/jpeg", 10L));
        
        given()
                .delete("/commands/media/{id}", saved.getId())
                .then()
                .statusCode(204);
        
        given()
                .delete("/commands/media/{id}/permanent", saved.getId())
                .then()
                .statusCode(400)
                .body("message", containsString("days remaining in retention period"));
        
        given()
                .post("/commands/media/{id}/restore", saved.getId())
                .then()
                .statusCode(204);
        
        given()
                .post("/commands/media/{id}/restore", saved.getId())
                .then()
                .statusCode(400)
                .body("message", equalTo("Media is not in the trash"));
        
        given()
                .delete("/commands/media/{id}", Long.MAX_VALUE)
                .then()
                .statusCode(404);
    }
}
