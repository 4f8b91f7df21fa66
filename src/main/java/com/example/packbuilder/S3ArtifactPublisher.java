package com.example.packbuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Uploads artifacts to an S3 bucket. Failed uploads are logged and do not fail the build.
 */
public final class S3ArtifactPublisher implements ArtifactPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactPublisher.class);
    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3ArtifactPublisher(String bucket, String prefix, Optional<String> region) {
        this(region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()), bucket, prefix);
    }

    S3ArtifactPublisher(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
    }

    @Override
    public void publish(Path artifact) {
        String key = keyFor(artifact);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(artifact));
            LOGGER.info("Uploaded {} to s3://{}/{}", artifact, bucket, key);
        } catch (Exception ex) {
            LOGGER.warn("Failed to upload {} to S3", artifact, ex);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    String keyFor(Path artifact) {
        String name = artifact.getFileName().toString();
        return prefix.isEmpty() ? name : prefix + "/" + name;
    }

    static String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("/+$", "");
    }
}
