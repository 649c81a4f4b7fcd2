package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.shared.Preconditions;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.InputStream;
import java.net.URI;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Stores attachments as objects of an S3 bucket.
 *
 * <p>Object keys follow the layout {@link UploadPolicy} picks, so stored
 * paths read the same whichever backend wrote them. Any S3 compatible
 * endpoint works when {@code storage.s3.endpoint} is set, addressed in
 * path style. Without explicit keys the default AWS credentials chain
 * applies. Active when {@code storage.type} is {@code s3}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "storage.type", havingValue = "s3")
public class S3StorageProvider implements StorageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            S3StorageProvider.class);

    private final S3Client s3;
    private final String bucket;
    private final UploadPolicy uploadPolicy;

    /**
     * Creates a new S3StorageProvider with its own client.
     *
     * @param theBucket the bucket objects are stored in, required
     * @param region the AWS region of the bucket
     * @param endpoint an S3 compatible endpoint, blank for AWS
     * @param accessKeyId the access key, blank for the default chain
     * @param secretAccessKey the secret key, blank for the default chain
     * @param theMaxFileSize the largest accepted file, in bytes
     */
    @Autowired
    public S3StorageProvider(
            @Value("${storage.s3.bucket:}") final String theBucket,
            @Value("${storage.s3.region:us-east-1}") final String region,
            @Value("${storage.s3.endpoint:}") final String endpoint,
            @Value("${storage.s3.access-key-id:}") final String accessKeyId,
            @Value("${storage.s3.secret-access-key:}")
            final String secretAccessKey,
            @Value("${storage.max-file-size:10485760}")
            final long theMaxFileSize) {
        this(clientFor(region, endpoint, accessKeyId, secretAccessKey),
                theBucket, theMaxFileSize);
    }

    S3StorageProvider(final S3Client theS3, final String theBucket,
            final long theMaxFileSize) {
        this.s3 = Preconditions.requireNonNull(theS3,
                "S3 client cannot be null");
        this.bucket = Preconditions.requireNonBlank(theBucket,
                "storage.s3.bucket is required when storage.type is s3");
        this.uploadPolicy = new UploadPolicy(theMaxFileSize);
    }

    @Override
    public StoredFile store(final String originalFilename,
            final String mimeType, final long size,
            final InputStream content) {
        uploadPolicy.check(mimeType, size);

        final String key = UploadPolicy.pathFor(originalFilename,
                LocalDate.now(ZoneOffset.UTC));
        try {
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(mimeType)
                            .contentLength(size)
                            .build(),
                    RequestBody.fromInputStream(content, size));
        } catch (final SdkException e) {
            throw new StorageException("Failed to store file "
                    + originalFilename, e);
        }
        LOG.debug("Stored {} ({} bytes) at s3://{}/{}", originalFilename,
                size, bucket, key);
        return new StoredFile(key, size, mimeType, originalFilename);
    }

    @Override
    public byte[] load(final String path) {
        final String key = checkKey(path);
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
        } catch (final NoSuchKeyException e) {
            throw new DomainException("Stored file " + path + " not found",
                    "FILE_NOT_FOUND");
        } catch (final SdkException e) {
            throw new StorageException("Failed to read file " + path, e);
        }
    }

    @Override
    public void delete(final String path) {
        final String key = checkKey(path);
        try {
            s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            LOG.debug("Deleted s3://{}/{}", bucket, key);
        } catch (final SdkException e) {
            throw new StorageException("Failed to delete file " + path, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (final SdkException e) {
            LOG.warn("Bucket {} is not reachable: {}", bucket, e.getMessage());
            return false;
        }
    }

    @PreDestroy
    void close() {
        s3.close();
    }

    /** Rejects keys that could not have come from {@link #store}. */
    private static String checkKey(final String path) {
        if (path == null || path.isBlank() || path.startsWith("/")
                || path.contains("..")) {
            throw new DomainException("Invalid file path: " + path,
                    "INVALID_FILE_PATH");
        }
        return path;
    }

    static S3Client clientFor(final String region, final String endpoint,
            final String accessKeyId, final String secretAccessKey) {
        final S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region));
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint))
                    .forcePathStyle(true);
        }
        if (accessKeyId != null && !accessKeyId.isBlank()
                && secretAccessKey != null && !secretAccessKey.isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKeyId,
                            secretAccessKey)));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        return builder.build();
    }

}
