package com.starscape.mediavault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds to app.trash.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.trash")
public class TrashProperties {
    
    private int retentionDays = 30;
    private String purgeCron = "0 30 3 * * *";
    
    public int getRetentionDays() {
        return retentionDays;
    }
    
    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
    
    public String getPurgeCron() {
        return purgeCron;
    }
    
    public void setPurgeCron(String purgeCron) {
        this.purgeCron = purgeCron;
    }
}
