package com.mentesme.resumes.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for {@code S3ResumeStorage}. Resumes are stored under
 * {@code <prefix>/resumes/<file name>} in {@link #getBucket()}.
 */
@Component
@ConfigurationProperties(prefix = "resumes.s3")
public class S3Properties {

    private boolean enabled;
    private String bucket;
    private String region;
    private String prefix = "";
    /** Optional endpoint override for S3-compatible stores; switches to path-style access. */
    private String endpoint;

    /**
     * @throws IllegalStateException if storage is enabled without a bucket or region
     */
    public void requireConfigured() {
        if (!enabled) {
            return;
        }
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(bucket)) {
            missing.add("resumes.s3.bucket");
        }
        if (!StringUtils.hasText(region)) {
            missing.add("resumes.s3.region");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("S3 resume storage is enabled but not configured, missing: "
                    + String.join(", ", missing));
        }
    }

    public String resumeKey(String fileName) {
        String base = StringUtils.trimTrailingCharacter(
                StringUtils.trimLeadingCharacter(prefix == null ? "" : prefix.strip(), '/'), '/');
        return (base.isEmpty() ? "" : base + "/") + "resumes/" + fileName;
    }

    public boolean hasEndpoint() {
        return StringUtils.hasText(endpoint);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }
}
