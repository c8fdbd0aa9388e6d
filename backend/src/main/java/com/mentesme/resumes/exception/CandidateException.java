package com.mentesme.resumes.exception;

public class CandidateException extends RuntimeException {

    private final ErrorKind kind;
    private final transient Object detail;

    public CandidateException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public CandidateException(ErrorKind kind, String message, Object detail) {
        this(kind, message, detail, null);
    }

    public CandidateException(ErrorKind kind, String message, Object detail, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static CandidateException notFound(long id) {
        return new CandidateException(ErrorKind.CANDIDATE_NOT_FOUND,
                "Candidate with ID " + id + " not found");
    }

    public static CandidateException validation(String message, Object detail) {
        return new CandidateException(ErrorKind.VALIDATION_ERROR, message, detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Object getDetail() {
        return detail;
    }
}
