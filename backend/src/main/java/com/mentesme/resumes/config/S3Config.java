package com.mentesme.resumes.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Client for the resume bucket. Only created when {@code resumes.s3.enabled=true};
 * startup fails fast if the bucket or region is missing.
 */
@Configuration
@ConditionalOnProperty(name = "resumes.s3.enabled", havingValue = "true")
public class S3Config {

    private static final Logger log = LoggerFactory.getLogger(S3Config.class);

    @Bean
    public S3Client resumeS3Client(S3Properties properties) {
        properties.requireConfigured();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (properties.hasEndpoint()) {
            builder.endpointOverride(URI.create(properties.getEndpoint()))
                    .forcePathStyle(true);
            log.info("S3 resume client using endpoint {} (path-style)", properties.getEndpoint());
        }
        return builder.build();
    }
}
