package com.mentesme.resumes.service.storage;

import com.mentesme.resumes.config.S3Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

@Service
@ConditionalOnProperty(name = "resumes.s3.enabled", havingValue = "true")
public class S3ResumeStorage implements ResumeStorage {

    private static final Logger log = LoggerFactory.getLogger(S3ResumeStorage.class);

    private final S3Client s3Client;
    private final S3Properties s3Properties;

    public S3ResumeStorage(S3Client s3Client, S3Properties s3Properties) {
        this.s3Client = s3Client;
        this.s3Properties = s3Properties;
        log.info("S3 resume storage initialized: {}", describe(""));
    }

    @Override
    public void write(String fileName, byte[] content) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(s3Properties.getBucket())
                .key(keyFor(fileName))
                .contentType(contentTypeFor(fileName))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException("S3 upload failed for " + describe(fileName), e);
        }
    }

    @Override
    public boolean delete(String fileName) throws IOException {
        if (!objectExists(fileName)) {
            return false;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(s3Properties.getBucket())
                    .key(keyFor(fileName))
                    .build());
            return true;
        } catch (SdkException e) {
            throw new IOException("S3 delete failed for " + describe(fileName), e);
        }
    }

    @Override
    public boolean exists(String fileName) {
        try {
            return objectExists(fileName);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String describe(String fileName) {
        return "s3://" + s3Properties.getBucket() + "/" + keyFor(fileName);
    }

    String keyFor(String fileName) {
        return s3Properties.resumeKey(fileName);
    }

    private boolean objectExists(String fileName) throws IOException {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(s3Properties.getBucket())
                    .key(keyFor(fileName))
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new IOException("S3 lookup failed for " + describe(fileName), e);
        } catch (SdkException e) {
            throw new IOException("S3 lookup failed for " + describe(fileName), e);
        }
    }

    static String contentTypeFor(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return "application/pdf";
        }
        if (lower.endsWith(".docx")) {
            return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
        }
        if (lower.endsWith(".doc")) {
            return "application/msword";
        }
        return "application/octet-stream";
    }
}
