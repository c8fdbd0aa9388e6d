package com.mentesme.resumes.api;

import com.mentesme.resumes.config.AppProperties;
import com.mentesme.resumes.model.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final AppProperties appProperties;

    public HealthController(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", LocalDateTime.now(), appProperties.getVersion(), "Service is running");
    }
}
