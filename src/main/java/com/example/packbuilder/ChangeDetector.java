package com.example.packbuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Remembers the hash of the last build in a marker file and tells whether a new hash differs.
 */
public final class ChangeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeDetector.class);
    static final String MARKER_FILE_NAME = "zip-hash.txt";

    private final Path markerFile;

    public ChangeDetector(Path cacheDirectory) {
        this.markerFile = cacheDirectory.resolve(MARKER_FILE_NAME);
    }

    /**
     * Returns true and records the hash if it differs from the recorded one or none is recorded.
     */
    public boolean hasChanged(String hash) throws IOException {
        return hasChanged(hash, false);
    }

    /**
     * Same as {@link #hasChanged(String)}, but always reports and records a change when {@code force} is set.
     */
    public synchronized boolean hasChanged(String hash, boolean force) throws IOException {
        Optional<String> previous = readPrevious();
        if (!force && previous.isPresent() && previous.get().equals(hash)) {
            return false;
        }
        Path parent = markerFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(markerFile, hash, StandardCharsets.UTF_8);
        return true;
    }

    /**
     * Forgets the recorded hash so the next comparison reports a change.
     */
    public synchronized void invalidate() throws IOException {
        Files.deleteIfExists(markerFile);
    }

    /**
     * Returns the recorded hash, if one can be read.
     */
    public synchronized Optional<String> readPrevious() {
        if (!Files.isRegularFile(markerFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(markerFile, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            LOGGER.warn("Failed to read build hash marker {}; treating it as absent.", markerFile, ex);
            return Optional.empty();
        }
    }

    public Path markerFile() {
        return markerFile;
    }
}
