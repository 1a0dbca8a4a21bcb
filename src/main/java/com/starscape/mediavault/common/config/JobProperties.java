package com.starscape.mediavault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits for background jobs.
 * Binds to app.jobs.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.jobs")
public class JobProperties {
    
    private int maxErrors = 100;
    private int pageSize = 200;
    private int historyLimit = 100;
    
    public int getMaxErrors() {
        return maxErrors;
    }
    
    public void setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
    }
    
    public int getPageSize() {
        return pageSize;
    }
    
    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }
    
    public int getHistoryLimit() {
        return historyLimit;
    }
    
    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }
}
