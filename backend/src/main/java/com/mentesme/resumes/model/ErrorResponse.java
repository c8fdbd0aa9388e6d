package com.mentesme.resumes.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, Object detail, LocalDateTime timestamp) {

    public static ErrorResponse of(String error, String message, Object detail) {
        return new ErrorResponse(error, message, detail, LocalDateTime.now());
    }
}
