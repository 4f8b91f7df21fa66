package com.example.packbuilder;

import com.example.packbuilder.resource.PackResource;
import com.example.packbuilder.resource.ResourceKey;
import com.example.packbuilder.resource.ResourceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps a directory tree in sync with the resource set. A file is rewritten only when it is
 * missing or its length differs from the new payload; files that are no longer produced are
 * deleted.
 *
 * <p>Two payloads of equal length are treated as identical. Content is never compared.
 */
public final class DirectorySyncStrategy implements BuildStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectorySyncStrategy.class);

    private final Path root;

    public DirectorySyncStrategy(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public BuildResult create(ResourceProvider provider, ParallelPipeline pipeline) throws IOException, InterruptedException {
        ResourceSet resources = provider.build();
        Files.createDirectories(root);
        DirectoryIndex index = DirectoryIndex.snapshot(root);
        Path realRoot = root.toRealPath();
        BuildResult.Builder builder = BuildResult.builder(resources.meta(), root);
        AtomicBoolean changed = new AtomicBoolean();
        AtomicInteger written = new AtomicInteger();

        pipeline.forEachParallel(resources.resources(), PackResource::estimatedSize, resource -> {
            byte[] bytes = resource.get();
            builder.put(resource.key(), bytes);
            Path target = targetOf(index, resource.key(), realRoot);
            if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS) || Files.size(target) != bytes.length) {
                Files.write(target, bytes);
                changed.set(true);
                written.incrementAndGet();
                LOGGER.debug("This file was successfully generated: {} ({}/{})", resource.key(), pipeline.progress(), pipeline.goal());
            }
        });

        int deleted = deleteStale(index);
        if (deleted > 0) {
            changed.set(true);
        }
        LOGGER.info("Synchronized {} resources into {}: {} written, {} deleted.", builder.size(), root, written.get(), deleted);
        return builder.freeze(changed.get());
    }

    @Override
    public boolean exists() {
        return Files.isDirectory(root);
    }

    public Path root() {
        return root;
    }

    private Path targetOf(DirectoryIndex index, ResourceKey key, Path realRoot) throws IOException {
        String relative = relativePathOf(key);
        Path claimed = index.claim(relative).orElse(null);
        if (claimed != null && !Files.isSymbolicLink(claimed)) {
            return claimed;
        }
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root)) {
            throw new IOException("Resource " + key + " resolves outside of " + root);
        }
        if (claimed != null) {
            // Outputs are regular files; a link in their place is removed, never written through.
            Files.delete(claimed);
        }
        Path ancestor = target.getParent();
        while (!Files.exists(ancestor)) {
            ancestor = ancestor.getParent();
        }
        if (!ancestor.toRealPath().startsWith(realRoot)) {
            throw new IOException("Resource " + key + " resolves outside of " + root + " through a symbolic link");
        }
        Files.createDirectories(target.getParent());
        return target;
    }

    /**
     * Deletes unclaimed files, then unclaimed directories that ended up empty.
     */
    private int deleteStale(DirectoryIndex index) throws IOException {
        int deleted = 0;
        for (Path path : index.remaining()) {
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                if (!isEmptyDirectory(path)) {
                    continue;
                }
            }
            if (Files.deleteIfExists(path)) {
                deleted++;
                LOGGER.debug("Deleted stale output {}", root.relativize(path));
            }
        }
        return deleted;
    }

    private boolean isEmptyDirectory(Path directory) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            return !stream.iterator().hasNext();
        }
    }

    static String relativePathOf(ResourceKey key) {
        return key.fullPath().replace('/', File.separatorChar);
    }
}
