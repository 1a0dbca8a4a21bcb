package com.starscape.mediavault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the remote WebDAV import source.
 * Binds to app.webdav.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.webdav")
public class WebDavProperties {
    
    private boolean enabled = false;
    private String url;
    private String username;
    private String password;
    private String remotePath = "/";
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
    
    public String getUrl() {
        return url;
    }
    
    public void setUrl(String url) {
        this.url = url;
    }
    
    public String getUsername() {
        return username;
    }
    
    public void setUsername(String username) {
        this.username = username;
    }
    
    public String getPassword() {
        return password;
    }
    
    public void setPassword(String password) {
        this.password = password;
    }
    
    public String getRemotePath() {
        return remotePath;
    }
    
    public void setRemotePath(String remotePath) {
        this.remotePath = remotePath;
    }
    
    /**
     * Remote path with a leading slash; blank means the share root.
     */
    public String normalizedRemotePath() {
        if (remotePath == null || remotePath.isBlank()) {
            return "/";
        }
        String trimmed = remotePath.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
