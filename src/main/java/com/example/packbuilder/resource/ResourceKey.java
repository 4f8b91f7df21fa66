package com.example.packbuilder.resource;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one produced resource: the overlay it belongs to and its forward-slash
 * relative path. The empty overlay is the root of the pack.
 */
public record ResourceKey(String overlay, String path) implements Comparable<ResourceKey> {
    private static final Comparator<ResourceKey> ORDER = Comparator
            .comparing(ResourceKey::fullPath)
            .thenComparing(ResourceKey::overlay);

    public ResourceKey {
        Objects.requireNonNull(overlay, "overlay");
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Resource path must not be blank.");
        }
        if (path.startsWith("/") || path.contains("\\")) {
            throw new IllegalArgumentException("Resource path must be a forward-slash relative path: " + path);
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Resource path contains an invalid segment: " + path);
            }
        }
        if (overlay.contains("/") || overlay.contains("\\") || overlay.equals(".") || overlay.equals("..")) {
            throw new IllegalArgumentException("Overlay must be a single path segment: " + overlay);
        }
    }

    /**
     * Creates a key in the root overlay.
     */
    public static ResourceKey root(String path) {
        return new ResourceKey("", path);
    }

    public boolean isRootOverlay() {
        return overlay.isEmpty();
    }

    /**
     * Path with the overlay folded in, always joined by forward slashes.
     */
    public String fullPath() {
        return overlay.isEmpty() ? path : overlay + "/" + path;
    }

    @Override
    public int compareTo(ResourceKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return fullPath();
    }
}
