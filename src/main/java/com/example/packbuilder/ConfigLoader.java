package com.example.packbuilder;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    static final String DEFAULT_BUILD_DIRECTORY = "build/pack";
    static final String DEFAULT_CACHE_DIRECTORY = ".cache";
    static final String DEFAULT_DESCRIPTION = "Generated resource pack.";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public PackConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.sourceDirectory == null || raw.sourceDirectory.isBlank()) {
            throw new IllegalArgumentException("Config must include a sourceDirectory.");
        }

        Path sourceDirectory = Path.of(raw.sourceDirectory);
        Path buildDirectory = Path.of(optionalString(raw.buildDirectory, DEFAULT_BUILD_DIRECTORY));
        Path cacheDirectory = Path.of(optionalString(raw.cacheDirectory, DEFAULT_CACHE_DIRECTORY));
        PackType packType = raw.packType == null || raw.packType.isBlank()
                ? PackType.FOLDER
                : PackType.parse(raw.packType);
        boolean useObfuscation = raw.useObfuscation == null || raw.useObfuscation;
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        String description = optionalString(raw.description, DEFAULT_DESCRIPTION);
        Optional<Path> reportFile = Optional.ofNullable(raw.reportFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new PackConfig(
                sourceDirectory,
                buildDirectory,
                cacheDirectory,
                packType,
                useObfuscation,
                threadCount,
                description,
                reportFile,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String sourceDirectory;
        public String buildDirectory;
        public String cacheDirectory;
        public String packType;
        public Boolean useObfuscation;
        public Integer threadCount;
        public String description;
        public String reportFile;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
