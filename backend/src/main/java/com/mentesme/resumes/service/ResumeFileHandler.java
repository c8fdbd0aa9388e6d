package com.mentesme.resumes.service;

import com.mentesme.resumes.config.UploadProperties;
import com.mentesme.resumes.exception.CandidateException;
import com.mentesme.resumes.exception.ErrorKind;
import com.mentesme.resumes.service.storage.ResumeStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.Locale;
import java.util.UUID;

/**
 * Validates resume uploads and moves their bytes in and out of {@link ResumeStorage}.
 * Holds no state of its own.
 */
@Service
public class ResumeFileHandler {

    private static final Logger log = LoggerFactory.getLogger(ResumeFileHandler.class);

    private final ResumeStorage storage;
    private final UploadProperties uploadProperties;

    public ResumeFileHandler(ResumeStorage storage, UploadProperties uploadProperties) {
        this.storage = storage;
        this.uploadProperties = uploadProperties;
    }

    public void validateType(String originalName) {
        String ext = extensionOf(originalName);
        boolean allowed = uploadProperties.getAllowedExtensions().stream()
                .anyMatch(a -> a.equalsIgnoreCase(ext));
        if (!allowed) {
            log.warn("Invalid file type attempted: {} ({})", originalName, ext.isEmpty() ? "no extension" : ext);
            throw new CandidateException(ErrorKind.INVALID_FILE_TYPE,
                    "Invalid file type for '" + originalName + "'",
                    "Allowed types: " + String.join(", ", uploadProperties.getAllowedExtensions()));
        }
    }

    public void validateSize(String originalName, long size) {
        long max = uploadProperties.getMaxFileSize();
        if (size > max) {
            log.warn("File size exceeded: {} ({} bytes > {} bytes)", originalName, size, max);
            throw fileTooLarge(originalName, size, max);
        }
    }

    /**
     * Write the bytes under a freshly generated name.
     *
     * @return the generated file name, 32 hex chars plus the lower-cased original extension
     */
    public String save(String originalName, byte[] content) {
        String fileName = generateFileName(originalName);
        try {
            storage.write(fileName, content);
        } catch (FileAlreadyExistsException e) {
            // the existing file belongs to someone else, leave it alone
            log.error("Generated file name already taken: {}", fileName, e);
            throw storageError(e);
        } catch (IOException e) {
            log.error("Error saving file {} as {}: {}", originalName, fileName, e.getMessage(), e);
            // a failed write may still have left a partial file behind
            delete(fileName);
            throw storageError(e);
        }
        log.info("File saved: {} -> {} ({} bytes)", originalName, storage.describe(fileName), content.length);
        return fileName;
    }

    /**
     * Best-effort removal. Failures of any kind are logged, never thrown.
     *
     * @return true if the file existed and was removed
     */
    public boolean delete(String fileName) {
        try {
            boolean deleted = storage.delete(fileName);
            if (deleted) {
                log.info("File deleted: {}", fileName);
            } else {
                log.warn("File not found for deletion: {}", fileName);
            }
            return deleted;
        } catch (IOException | RuntimeException e) {
            log.error("Error deleting file {}: {}", fileName, e.getMessage(), e);
            return false;
        }
    }

    public boolean exists(String fileName) {
        return storage.exists(fileName);
    }

    private static CandidateException storageError(IOException cause) {
        return new CandidateException(ErrorKind.STORAGE_ERROR,
                "Failed to save resume file", cause.getMessage(), cause);
    }

    static CandidateException fileTooLarge(String originalName, long size, long max) {
        String detail = String.format(Locale.ROOT, "File size: %.2f MB, Max allowed: %.2f MB",
                size / (1024.0 * 1024.0), max / (1024.0 * 1024.0));
        String name = originalName != null ? "'" + originalName + "' " : "";
        return new CandidateException(ErrorKind.FILE_TOO_LARGE,
                "File " + name + "size exceeds the maximum limit", detail);
    }

    static String generateFileName(String originalName) {
        return UUID.randomUUID().toString().replace("-", "") + extensionOf(originalName);
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
