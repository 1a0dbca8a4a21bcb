package com.starscape.mediavault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Configuration properties for the media data directory and blob backend.
 * Binds to app.storage.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {
    
    public enum Backend { LOCAL, S3 }
    
    private Path root = Path.of("./data");
    private Backend backend = Backend.LOCAL;
    private S3 s3 = new S3();
    
    public Path getRoot() {
        return root;
    }
    
    public void setRoot(Path root) {
        this.root = root;
    }
    
    public Backend getBackend() {
        return backend;
    }
    
    public void setBackend(Backend backend) {
        this.backend = backend;
    }
    
    public S3 getS3() {
        return s3;
    }
    
    public void setS3(S3 s3) {
        this.s3 = s3;
    }
    
    /**
     * Directory scanned by local imports.
     */
    public Path getImportsDir() {
        return root.resolve("imports");
    }
    
    /**
     * Directory that receives WebDAV downloads before they are processed.
     */
    public Path getWebDavStagingDir() {
        return root.resolve("webdav");
    }
    
    public static class S3 {
        
        private String bucket;
        private String prefix = "media";
        
        public String getBucket() {
            return bucket;
        }
        
        public void setBucket(String bucket) {
            this.bucket = bucket;
        }
        
        public String getPrefix() {
            return prefix;
        }
        
        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }
}
