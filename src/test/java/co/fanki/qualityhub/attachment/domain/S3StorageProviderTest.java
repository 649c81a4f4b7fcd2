package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.DomainException;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link S3StorageProvider}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class S3StorageProviderTest {

    private static final String BUCKET = "qualityhub-attachments";

    private static final byte[] CONTENT =
            "expected vs actual".getBytes(StandardCharsets.UTF_8);

    private S3Client s3;

    private S3StorageProvider provider;

    @BeforeEach
    void setUp() {
        s3 = createMock(S3Client.class);
        provider = new S3StorageProvider(s3, BUCKET, 1024);
    }

    @Test
    void whenCreating_givenNoBucket_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new S3StorageProvider(s3, " ", 1024));
    }

    @Test
    void whenStoring_givenAllowedFile_shouldPutUnderDatedKey() {
        final Capture<PutObjectRequest> request = newCapture();
        expect(s3.putObject(capture(request), anyObject(RequestBody.class)))
                .andReturn(PutObjectResponse.builder().build());
        replay(s3);

        final StoredFile stored = provider.store("Failure Log.TXT",
                "text/plain", CONTENT.length,
                new ByteArrayInputStream(CONTENT));

        verify(s3);
        assertTrue(stored.path().matches("\\d{4}/\\d{2}/[0-9a-f-]{36}\\.txt"),
                stored.path());
        assertEquals(BUCKET, request.getValue().bucket());
        assertEquals(stored.path(), request.getValue().key());
        assertEquals("text/plain", request.getValue().contentType());
        assertEquals(CONTENT.length, request.getValue().contentLength());
    }

    @Test
    void whenStoring_givenOversizedFile_shouldRejectBeforeUpload() {
        replay(s3);

        final DomainException error = assertThrows(DomainException.class,
                () -> provider.store("big.pdf", "application/pdf", 2048,
                        new ByteArrayInputStream(CONTENT)));

        assertEquals("FILE_TOO_LARGE", error.getErrorCode());
        verify(s3);
    }

    @Test
    void whenStoring_givenUnreachableBucket_shouldRaiseStorageException() {
        expect(s3.putObject(anyObject(PutObjectRequest.class),
                anyObject(RequestBody.class))).andThrow(
                SdkClientException.create("connection refused"));
        replay(s3);

        assertThrows(StorageException.class, () -> provider.store("a.png",
                "image/png", CONTENT.length,
                new ByteArrayInputStream(CONTENT)));
        verify(s3);
    }

    @Test
    void whenLoading_givenStoredKey_shouldReturnObjectBytes() {
        final Capture<GetObjectRequest> request = newCapture();
        expect(s3.getObjectAsBytes(capture(request))).andReturn(
                ResponseBytes.fromByteArray(
                        GetObjectResponse.builder().build(), CONTENT));
        replay(s3);

        assertArrayEquals(CONTENT, provider.load("2026/03/abc.txt"));

        verify(s3);
        assertEquals("2026/03/abc.txt", request.getValue().key());
    }

    @Test
    void whenLoading_givenMissingKey_shouldAnswerFileNotFound() {
        expect(s3.getObjectAsBytes(anyObject(GetObjectRequest.class)))
                .andThrow(NoSuchKeyException.builder()
                        .message("The specified key does not exist.")
                        .build());
        replay(s3);

        final DomainException error = assertThrows(DomainException.class,
                () -> provider.load("2026/03/gone.txt"));

        assertEquals("FILE_NOT_FOUND", error.getErrorCode());
        verify(s3);
    }

    @Test
    void whenLoading_givenTraversalPath_shouldRejectWithoutCallingS3() {
        replay(s3);

        final DomainException error = assertThrows(DomainException.class,
                () -> provider.load("2026/../../secrets"));

        assertEquals("INVALID_FILE_PATH", error.getErrorCode());
        verify(s3);
    }

    @Test
    void whenDeleting_givenKey_shouldDeleteObject() {
        final Capture<DeleteObjectRequest> request = newCapture();
        expect(s3.deleteObject(capture(request))).andReturn(
                DeleteObjectResponse.builder().build());
        replay(s3);

        provider.delete("2026/03/abc.txt");

        verify(s3);
        assertEquals(BUCKET, request.getValue().bucket());
        assertEquals("2026/03/abc.txt", request.getValue().key());
    }

    @Test
    void whenCheckingAvailability_givenUnreachableBucket_shouldAnswerFalse() {
        expect(s3.headBucket(anyObject(HeadBucketRequest.class))).andThrow(
                SdkClientException.create("connection refused"));
        replay(s3);

        assertFalse(provider.isAvailable());
        verify(s3);
    }

}
