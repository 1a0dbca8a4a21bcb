package com.starscape.mediavault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for reverse geocoding of GPS coordinates.
 * Binds to app.geocoding.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.geocoding")
public class GeocodingProperties {
    
    private boolean enabled = false;
    private String baseUrl = "https://nominatim.openstreetmap.org/reverse";
    private String userAgent = "MediaVault/1.0 (self-hosted)";
    private Duration timeout = Duration.ofSeconds(10);
    private Duration rateLimit = Duration.ofSeconds(1);
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
    
    public String getBaseUrl() {
        return baseUrl;
    }
    
    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
    
    public String getUserAgent() {
        return userAgent;
    }
    
    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
    
    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
    
    public Duration getRateLimit() {
        return rateLimit;
    }
    
    public void setRateLimit(Duration rateLimit) {
        this.rateLimit = rateLimit;
    }
}
