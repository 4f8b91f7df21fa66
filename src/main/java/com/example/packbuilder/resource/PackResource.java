package com.example.packbuilder.resource;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A lazily computed unit of output. The payload supplier is invoked at most once per build.
 */
public final class PackResource {
    private final ResourceKey key;
    private final long estimatedSize;
    private final Supplier<byte[]> payload;

    public PackResource(ResourceKey key, long estimatedSize, Supplier<byte[]> payload) {
        this.key = Objects.requireNonNull(key, "key");
        this.estimatedSize = Math.max(0L, estimatedSize);
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    /**
     * Creates a resource whose bytes are already known.
     */
    public static PackResource of(ResourceKey key, byte[] bytes) {
        byte[] copy = bytes.clone();
        return new PackResource(key, copy.length, () -> copy);
    }

    public ResourceKey key() {
        return key;
    }

    public String overlay() {
        return key.overlay();
    }

    public String path() {
        return key.path();
    }

    /**
     * Scheduling weight; carries no meaning for correctness.
     */
    public long estimatedSize() {
        return estimatedSize;
    }

    public byte[] get() {
        byte[] bytes = payload.get();
        if (bytes == null) {
            throw new IllegalStateException("Resource " + key + " produced no bytes.");
        }
        return bytes;
    }

    @Override
    public String toString() {
        return "PackResource[" + key + ", ~" + estimatedSize + " bytes]";
    }
}
