package com.mentesme.resumes.model;

import java.time.LocalDateTime;

public record HealthResponse(String status, LocalDateTime timestamp, String version, String message) {
}
