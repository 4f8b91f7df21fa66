package com.example.packbuilder;

import java.nio.file.Path;

/**
 * Hands a freshly written artifact to whatever distributes it.
 */
@FunctionalInterface
public interface ArtifactPublisher extends AutoCloseable {
    void publish(Path artifact);

    @Override
    default void close() {
        // no-op
    }

    static ArtifactPublisher noop() {
        return artifact -> {
        };
    }
}
