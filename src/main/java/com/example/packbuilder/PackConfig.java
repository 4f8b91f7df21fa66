package com.example.packbuilder;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for a pack build.
 */
public record PackConfig(
        Path sourceDirectory,
        Path buildDirectory,
        Path cacheDirectory,
        PackType packType,
        boolean useObfuscation,
        int threadCount,
        String description,
        Optional<Path> reportFile,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
}
