package com.example.packbuilder;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Configured output form of a build.
 */
public enum PackType {
    FOLDER,
    ZIP,
    NONE;

    /**
     * Creates the strategy matching this type.
     */
    public BuildStrategy strategy(PackConfig config) {
        switch (this) {
            case FOLDER:
                return new DirectorySyncStrategy(config.buildDirectory());
            case ZIP:
                return new ArchiveWriterStrategy(archivePath(config.buildDirectory()), new ChangeDetector(config.cacheDirectory()));
            case NONE:
                return new InMemoryStrategy();
            default:
                throw new IllegalStateException("Unhandled pack type " + this);
        }
    }

    public static PackType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown packType '" + value + "', expected one of FOLDER, ZIP, NONE.", ex);
        }
    }

    static Path archivePath(Path buildDirectory) {
        Path absolute = buildDirectory.toAbsolutePath().normalize();
        return absolute.resolveSibling(absolute.getFileName() + ".zip");
    }
}
