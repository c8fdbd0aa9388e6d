package com.mentesme.resumes.api;

import com.mentesme.resumes.exception.CandidateException;
import com.mentesme.resumes.exception.ErrorKind;
import com.mentesme.resumes.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns every failure into the uniform {@code {error, message, detail?, timestamp}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Map<ErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(Map.of(
            ErrorKind.VALIDATION_ERROR, HttpStatus.UNPROCESSABLE_ENTITY,
            ErrorKind.INVALID_FILE_TYPE, HttpStatus.BAD_REQUEST,
            ErrorKind.FILE_TOO_LARGE, HttpStatus.PAYLOAD_TOO_LARGE,
            ErrorKind.STORAGE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR,
            ErrorKind.CANDIDATE_NOT_FOUND, HttpStatus.NOT_FOUND
    ));

    static HttpStatus statusFor(ErrorKind kind) {
        return STATUS_BY_KIND.get(kind);
    }

    @ExceptionHandler(CandidateException.class)
    public ResponseEntity<ErrorResponse> handleCandidateError(CandidateException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getKind());
        Object detail = ex.getDetail();
        if (status.is5xxServerError()) {
            log.error("{} on {}: {} ({})", ex.getKind().wireName(), request.getRequestURI(), ex.getMessage(), detail, ex);
            detail = null;
        } else {
            log.warn("{} on {}: {}", ex.getKind().wireName(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(ex.getKind().wireName(), ex.getMessage(), detail));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        return validationError(request, List.of(fieldError(ex.getParameterName(), "Field required")));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex,
                                                           HttpServletRequest request) {
        return validationError(request, List.of(fieldError(ex.getRequestPartName(), "File required")));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value";
        return validationError(request, List.of(fieldError(ex.getName(),
                "Invalid value '" + ex.getValue() + "', expected " + expected)));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex,
                                                              HttpServletRequest request) {
        log.warn("Upload rejected by multipart limit on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of(ErrorKind.FILE_TOO_LARGE.wireName(),
                        "Uploaded file size exceeds the maximum limit", null));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipartError(MultipartException ex, HttpServletRequest request) {
        log.warn("Malformed multipart request on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR.wireName(),
                        "Request must be multipart/form-data", null));
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleHttpError(Exception ex, HttpServletRequest request) {
        HttpStatusCode code = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        HttpStatus status = HttpStatus.valueOf(code.value());
        log.warn("{} {} -> {}", request.getMethod(), request.getRequestURI(), status);
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.getReasonPhrase().replace(" ", ""), ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("InternalServerError", "An unexpected error occurred", null));
    }

    private ResponseEntity<ErrorResponse> validationError(HttpServletRequest request,
                                                          List<Map<String, String>> detail) {
        log.warn("Validation error on {}: {}", request.getRequestURI(), detail);
        return ResponseEntity.status(STATUS_BY_KIND.get(ErrorKind.VALIDATION_ERROR))
                .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR.wireName(), "Request validation failed", detail));
    }

    private static Map<String, String> fieldError(String field, String message) {
        return Map.of("field", field, "message", message);
    }
}
