package io.cronhook.internal.s3;

import io.cronhook.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.net.URI;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ObjectStore} backed by an S3-compatible bucket (AWS S3, MinIO, DigitalOcean Spaces).
 */
public class S3ObjectStore implements ObjectStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private static final int MAX_PAGE_SIZE = 1000;

    private final S3Client client;
    private final String bucket;

    public S3ObjectStore(S3Client client, String bucket) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        this.bucket = bucket;
    }

    /**
     * Build a client for the given endpoint. A blank endpoint means AWS itself; anything else is treated as
     * an S3-compatible service and addressed path-style.
     */
    public static S3ObjectStore create(String endpoint, String region, String accessKey, String secretKey,
                                       String bucket) {
        return new S3ObjectStore(buildClient(endpoint, region, accessKey, secretKey), bucket);
    }

    static S3Client buildClient(String endpoint, String region, String accessKey, String secretKey) {
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(resolveCredentials(accessKey, secretKey));
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region.trim()));
        }
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint.trim()));
            builder.serviceConfiguration(S3Configuration.builder()
                    .pathStyleAccessEnabled(true)
                    .build());
        }
        return builder.build();
    }

    private static AwsCredentialsProvider resolveCredentials(String accessKey, String secretKey) {
        boolean hasAccess = accessKey != null && !accessKey.isBlank();
        boolean hasSecret = secretKey != null && !secretKey.isBlank();
        if (!hasAccess && !hasSecret) {
            return DefaultCredentialsProvider.create();
        }
        if (!hasAccess || !hasSecret) {
            throw new IllegalArgumentException("S3 access key and secret key must be configured together");
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey.trim(), secretKey.trim()));
    }

    /**
     * Create the bucket if it does not exist yet.
     */
    public void ensureBucket() throws IOException {
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return;
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} not found, creating it", bucket);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw new IOException("Failed to check bucket " + bucket + ": " + e.getMessage(), e);
            }
            log.info("Bucket {} not found, creating it", bucket);
        } catch (SdkException e) {
            throw new IOException("Failed to check bucket " + bucket + ": " + e.getMessage(), e);
        }

        try {
            client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException e) {
            throw new IOException("Failed to create bucket " + bucket + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, byte[] content, String contentType, Map<String, String> metadata) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .metadata(metadata == null ? Map.of() : metadata)
                .build();
        try {
            client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException("Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list(String prefix, int maxKeys) throws IOException {
        if (maxKeys <= 0) {
            return List.of();
        }

        List<String> keys = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .maxKeys(Math.min(MAX_PAGE_SIZE, maxKeys - keys.size()));
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                ListObjectsV2Response response = client.listObjectsV2(request.build());
                for (S3Object object : response.contents()) {
                    keys.add(object.key());
                }
                continuationToken = Boolean.TRUE.equals(response.isTruncated())
                        ? response.nextContinuationToken()
                        : null;
            } while (continuationToken != null && keys.size() < maxKeys);
        } catch (SdkException e) {
            throw new IOException("Failed to list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }
        return keys;
    }

    @Override
    public byte[] get(String key) throws IOException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            return client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new NoSuchFileException(key);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new NoSuchFileException(key);
            }
            throw new IOException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new IOException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    public String bucket() {
        return bucket;
    }

    @Override
    public void close() {
        client.close();
    }
}
