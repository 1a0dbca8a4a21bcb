package com.starscape.mediavault;

import com.starscape.mediavault.common.config.GeocodingProperties;
import com.starscape.mediavault.common.config.JobProperties;
import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.config.StorageProperties;
import com.starscape.mediavault.common.config.TrashProperties;
import com.starscape.mediavault.common.config.WebDavProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    ProcessingProperties.class,
    StorageProperties.class,
    JobProperties.class,
    GeocodingProperties.class,
    WebDavProperties.class,
    TrashProperties.class
})
public class MediaVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaVaultApplication.class, args);
    }
}
