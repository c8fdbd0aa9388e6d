package com.mentesme.resumes.service.storage;

import com.mentesme.resumes.config.UploadProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

@Service
@ConditionalOnProperty(name = "resumes.s3.enabled", havingValue = "false", matchIfMissing = true)
public class LocalResumeStorage implements ResumeStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalResumeStorage.class);

    private final Path uploadDir;

    public LocalResumeStorage(UploadProperties properties) {
        this.uploadDir = Paths.get(properties.getDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(uploadDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create upload directory " + uploadDir, e);
        }
        log.info("Local resume storage initialized: {}", uploadDir);
    }

    @Override
    public void write(String fileName, byte[] content) throws IOException {
        // CREATE_NEW: a name collision must fail rather than overwrite another resume
        Files.write(resolve(fileName), content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public boolean delete(String fileName) throws IOException {
        return Files.deleteIfExists(resolve(fileName));
    }

    @Override
    public boolean exists(String fileName) {
        try {
            return Files.exists(resolve(fileName));
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public String describe(String fileName) {
        return uploadDir.resolve(fileName).toString();
    }

    private Path resolve(String fileName) throws IOException {
        Path path = uploadDir.resolve(fileName).normalize();
        if (!path.getParent().equals(uploadDir)) {
            throw new IOException("File name escapes the upload directory: " + fileName);
        }
        return path;
    }
}
