package com.mentesme.resumes.service.storage;

import com.mentesme.resumes.config.S3Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3ResumeStorageTest {

    private S3Client s3Client;
    private S3ResumeStorage storage;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        S3Properties properties = new S3Properties();
        properties.setBucket("resumes-bucket");
        properties.setPrefix("prod");
        storage = new S3ResumeStorage(s3Client, properties);
    }

    @Test
    void writePutsObjectUnderPrefixedKey() throws IOException {
        storage.write("abc.pdf", new byte[]{1, 2, 3});

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertEquals("resumes-bucket", request.bucket());
        assertEquals("prod/resumes/abc.pdf", request.key());
        assertEquals("application/pdf", request.contentType());
    }

    @Test
    void sdkFailureOnWriteIsReportedAsIOException() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        IOException ex = assertThrows(IOException.class, () -> storage.write("abc.pdf", new byte[]{1}));
        assertTrue(ex.getMessage().contains("s3://resumes-bucket/prod/resumes/abc.pdf"));
    }

    @Test
    void deleteRemovesExistingObject() throws IOException {
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder().build());

        assertTrue(storage.delete("abc.docx"));

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(captor.capture());
        assertEquals("prod/resumes/abc.docx", captor.getValue().key());
    }

    @Test
    void deleteOfMissingObjectReturnsFalse() throws IOException {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertFalse(storage.delete("gone.pdf"));
        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void plainNotFoundOnLookupCountsAsMissing() throws IOException {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

        assertFalse(storage.delete("gone.pdf"));
        assertFalse(storage.exists("gone.pdf"));
    }

    @Test
    void lookupFailureOnDeleteIsReportedAsIOException() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(SdkClientException.create("network down"));

        IOException ex = assertThrows(IOException.class, () -> storage.delete("abc.pdf"));
        assertInstanceOf(SdkClientException.class, ex.getCause());
        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void lookupFailureOnExistsIsNotReportedAsMissing() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        assertThrows(UncheckedIOException.class, () -> storage.exists("abc.pdf"));
    }

    @Test
    void keyPrefixIsNormalised() {
        S3Properties properties = new S3Properties();
        properties.setBucket("resumes-bucket");

        properties.setPrefix("");
        assertEquals("resumes/abc.pdf", new S3ResumeStorage(s3Client, properties).keyFor("abc.pdf"));
        properties.setPrefix("/staging/");
        assertEquals("staging/resumes/abc.pdf", new S3ResumeStorage(s3Client, properties).keyFor("abc.pdf"));
    }

    @Test
    void contentTypeFollowsExtension() {
        assertEquals("application/msword", S3ResumeStorage.contentTypeFor("a.doc"));
        assertEquals("application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                S3ResumeStorage.contentTypeFor("a.DOCX"));
    }
}
