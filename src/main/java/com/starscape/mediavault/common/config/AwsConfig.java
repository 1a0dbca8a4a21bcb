package com.starscape.mediavault.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * S3 client for the object-storage blob backend.
 * Only created when app.storage.backend=s3.
 */
@Configuration
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "s3")
public class AwsConfig {
    
    @Value("${aws.region}")
    private String region;
    
    @Value("${aws.profile:}")
    private String profile;
    
    @Value("${aws.s3.endpoint:}")
    private String endpoint;
    
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        // Use profile if specified, otherwise use default credentials chain
        if (profile != null && !profile.isBlank()) {
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }
    
    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider);
        if (endpoint != null && !endpoint.isBlank()) {
            // MinIO and other S3-compatible stores
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }
}
