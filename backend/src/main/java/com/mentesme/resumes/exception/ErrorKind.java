package com.mentesme.resumes.exception;

/**
 * Closed set of failures the candidate operations can report.
 * The wire name is what clients see in the {@code error} field.
 */
public enum ErrorKind {

    VALIDATION_ERROR("ValidationError"),
    INVALID_FILE_TYPE("InvalidFileType"),
    FILE_TOO_LARGE("FileTooLarge"),
    STORAGE_ERROR("StorageError"),
    CANDIDATE_NOT_FOUND("CandidateNotFound");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
