package com.mentesme.resumes.service.storage;

import java.io.IOException;

/**
 * Byte-level storage for resume files, addressed by a flat file name.
 * Implementations: {@link LocalResumeStorage} (upload directory, default) and
 * {@link S3ResumeStorage} (enabled with {@code resumes.s3.enabled=true}).
 */
public interface ResumeStorage {

    /**
     * Write the file, replacing nothing: callers pass names that are unique.
     */
    void write(String fileName, byte[] content) throws IOException;

    /**
     * @return true if a file was removed, false if none existed under that name
     */
    boolean delete(String fileName) throws IOException;

    boolean exists(String fileName);

    /**
     * Human-readable location, used in log lines only.
     */
    String describe(String fileName);
}
