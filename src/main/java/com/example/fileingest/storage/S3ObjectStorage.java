package com.example.fileingest.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ObjectStorage} on an S3 bucket. Calls are synchronous so a snapshot sees the state the
 * upload left behind.
 */
public final class S3ObjectStorage implements ObjectStorage, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStorage.class);
    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3ObjectStorage(String bucket, String prefix, Optional<String> region) {
        this(region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()), bucket, prefix);
    }

    public S3ObjectStorage(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
    }

    @Override
    public boolean exists(String key) throws IOException {
        return head(key).isPresent();
    }

    @Override
    public Optional<Map<String, String>> metadata(String key) throws IOException {
        return head(key).map(HeadObjectResponse::metadata);
    }

    @Override
    public void upload(String key, Path file, Map<String, String> metadata) throws IOException {
        String objectKey = objectKey(key);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .metadata(metadata)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(file));
        } catch (SdkException ex) {
            throw new IOException("Failed to upload " + file + " to s3://" + bucket + "/" + objectKey, ex);
        }
        LOGGER.info("Uploaded {} to s3://{}/{}", file, bucket, objectKey);
    }

    @Override
    public boolean delete(String key) throws IOException {
        if (!exists(key)) {
            return false;
        }
        String objectKey = objectKey(key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build());
        } catch (SdkException ex) {
            throw new IOException("Failed to delete s3://" + bucket + "/" + objectKey, ex);
        }
        LOGGER.info("Deleted s3://{}/{}", bucket, objectKey);
        return true;
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private Optional<HeadObjectResponse> head(String key) throws IOException {
        String objectKey = objectKey(key);
        try {
            return Optional.of(s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(objectKey).build()));
        } catch (S3Exception ex) {
            if (ex.statusCode() == NOT_FOUND) {
                return Optional.empty();
            }
            throw new IOException("Failed to inspect s3://" + bucket + "/" + objectKey, ex);
        } catch (SdkException ex) {
            throw new IOException("Failed to inspect s3://" + bucket + "/" + objectKey, ex);
        }
    }

    String objectKey(String key) {
        String normalized = key.replace("\\", "/");
        return prefix.isEmpty() ? normalized : prefix + "/" + normalized;
    }

    private String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("/+$", "");
    }
}
