package com.example.packbuilder;

import com.example.packbuilder.resource.PackMeta;
import com.example.packbuilder.resource.ResourceKey;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * The produced bytes of a finished build, keyed by resource, together with their content hash
 * and whether the build changed anything compared to the previous one.
 */
public final class BuildResult {
    private final PackMeta meta;
    private final Path targetDirectory;
    private final SortedMap<ResourceKey, byte[]> entries;
    private final String hash;
    private final boolean changed;

    private BuildResult(PackMeta meta,
                        Path targetDirectory,
                        SortedMap<ResourceKey, byte[]> entries,
                        String hash,
                        boolean changed) {
        this.meta = meta;
        this.targetDirectory = targetDirectory;
        this.entries = Collections.unmodifiableSortedMap(entries);
        this.hash = hash;
        this.changed = changed;
    }

    public static Builder builder(PackMeta meta) {
        return new Builder(meta, null);
    }

    public static Builder builder(PackMeta meta, Path targetDirectory) {
        return new Builder(meta, targetDirectory);
    }

    public PackMeta meta() {
        return meta;
    }

    public Optional<Path> targetDirectory() {
        return Optional.ofNullable(targetDirectory);
    }

    /**
     * Entries in canonical order. The byte arrays must not be modified.
     */
    public SortedMap<ResourceKey, byte[]> entries() {
        return entries;
    }

    public Stream<Map.Entry<ResourceKey, byte[]>> stream() {
        return entries.entrySet().stream();
    }

    public Optional<byte[]> get(ResourceKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    public String hash() {
        return hash;
    }

    public boolean changed() {
        return changed;
    }

    @Override
    public String toString() {
        return "BuildResult[" + entries.size() + " entries, hash=" + hash + ", changed=" + changed + "]";
    }

    /**
     * SHA-256 over the entries in canonical order: overlay, path, payload length and payload of each.
     */
    static String hashOf(SortedMap<ResourceKey, byte[]> entries) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        ByteBuffer length = ByteBuffer.allocate(Long.BYTES);
        for (Map.Entry<ResourceKey, byte[]> entry : entries.entrySet()) {
            digest.update(entry.getKey().overlay().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(entry.getKey().path().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            length.clear();
            length.putLong(entry.getValue().length);
            digest.update(length.array());
            digest.update(entry.getValue());
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }

    /**
     * Collects entries from any number of worker threads until {@link #freeze(boolean)} turns
     * it into a {@link BuildResult}. A builder can be frozen once.
     */
    public static final class Builder {
        private final PackMeta meta;
        private final Path targetDirectory;
        private final ConcurrentHashMap<ResourceKey, byte[]> entries = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, ResourceKey> outputNames = new ConcurrentHashMap<>();
        private volatile boolean frozen;

        private Builder(PackMeta meta, Path targetDirectory) {
            this.meta = Objects.requireNonNull(meta, "meta");
            this.targetDirectory = targetDirectory;
        }

        /**
         * Adds an entry. Output names, the overlay folded into the path, are unique within one build,
         * so {@code ("x", "a.txt")} and {@code ("", "x/a.txt")} cannot both be added.
         */
        public Builder put(ResourceKey key, byte[] bytes) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(bytes, "bytes");
            if (frozen) {
                throw new IllegalStateException("Build result is already frozen.");
            }
            ResourceKey existing = outputNames.putIfAbsent(key.fullPath(), key);
            if (existing != null) {
                if (existing.equals(key)) {
                    throw new IllegalStateException("Duplicate resource in build: " + key);
                }
                throw new IllegalStateException("Resource " + describe(key) + " collides with " + describe(existing)
                        + " on output path " + key.fullPath());
            }
            entries.put(key, bytes);
            return this;
        }

        public int size() {
            return entries.size();
        }

        private static String describe(ResourceKey key) {
            return "(overlay '" + key.overlay() + "', path '" + key.path() + "')";
        }

        /**
         * Hash of the entries added so far.
         */
        public String hash() {
            return hashOf(new TreeMap<>(entries));
        }

        public synchronized BuildResult freeze(boolean changed) {
            if (frozen) {
                throw new IllegalStateException("Build result is already frozen.");
            }
            frozen = true;
            TreeMap<ResourceKey, byte[]> sorted = new TreeMap<>(entries);
            return new BuildResult(meta, targetDirectory, sorted, hashOf(sorted), changed);
        }
    }
}
