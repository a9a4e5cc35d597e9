package com.example.drivecatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Uploads the saved catalog to {@code s3://bucket/prefix/<file name>}. The local file stays
 * authoritative, so upload failures are logged and the scan still succeeds.
 */
public final class S3CatalogPublisher implements CatalogPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3CatalogPublisher.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    private boolean closed;

    public S3CatalogPublisher(String bucket, String prefix, Optional<String> region) {
        this(region
                        .map(Region::of)
                        .map(r -> S3Client.builder().region(r).build())
                        .orElseGet(() -> S3Client.builder().build()),
                bucket,
                prefix);
    }

    S3CatalogPublisher(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
    }

    @Override
    public void publish(Path catalogFile) {
        if (closed) {
            LOGGER.warn("Skipping S3 upload of {} because the publisher is closed.", catalogFile);
            return;
        }
        String key = keyFor(catalogFile);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("text/csv")
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(catalogFile));
            LOGGER.info("Uploaded {} to s3://{}/{}", catalogFile, bucket, key);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to upload {} to S3", catalogFile, ex);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        s3Client.close();
    }

    String keyFor(Path catalogFile) {
        String name = catalogFile.getFileName().toString();
        return prefix.isEmpty() ? name : prefix + "/" + name;
    }

    private String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("/+$", "");
    }
}
