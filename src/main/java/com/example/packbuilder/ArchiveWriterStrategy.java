package com.example.packbuilder;

import com.example.packbuilder.resource.ResourceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the resource set into a single zip archive, but only when the build hash differs from
 * the previous build or the archive is missing.
 */
public final class ArchiveWriterStrategy implements BuildStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveWriterStrategy.class);
    static final String COMMENT = "Generated resource pack.";
    // Every entry is stamped 2000-01-01T00:00:00Z.
    static final long ENTRY_TIME = 946_684_800_000L;

    private final Path archive;
    private final ChangeDetector changeDetector;

    public ArchiveWriterStrategy(Path archive, ChangeDetector changeDetector) {
        this.archive = archive.toAbsolutePath().normalize();
        this.changeDetector = changeDetector;
    }

    @Override
    public BuildResult create(ResourceProvider provider, ParallelPipeline pipeline) throws IOException, InterruptedException {
        BuildResult.Builder builder = InMemoryStrategy.assemble(provider.build(), pipeline);
        BuildResult result = builder.freeze(changeDetector.hasChanged(builder.hash(), !exists()));
        if (!result.changed()) {
            LOGGER.info("Archive {} is up to date ({} resources).", archive, result.size());
            return result;
        }
        try {
            write(result);
        } catch (IOException | RuntimeException ex) {
            // Forget the new hash, the next build has to write the archive again.
            try {
                changeDetector.invalidate();
            } catch (IOException invalidateFailure) {
                ex.addSuppressed(invalidateFailure);
            }
            throw ex;
        }
        LOGGER.info("Wrote {} resources to {}.", result.size(), archive);
        return result;
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(archive);
    }

    public Path archive() {
        return archive;
    }

    /**
     * Writes next to the archive first and moves the finished file into place.
     */
    private void write(BuildResult result) throws IOException {
        Path parent = archive.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, archive.getFileName().toString(), ".tmp");
        try {
            try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                zip.setLevel(Deflater.BEST_COMPRESSION);
                zip.setComment(COMMENT);
                for (Map.Entry<ResourceKey, byte[]> entry : result.entries().entrySet()) {
                    ZipEntry zipEntry = new ZipEntry(entry.getKey().fullPath());
                    zipEntry.setTime(ENTRY_TIME);
                    zip.putNextEntry(zipEntry);
                    zip.write(entry.getValue());
                    zip.closeEntry();
                }
            }
            try {
                Files.move(temp, archive, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, archive, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
