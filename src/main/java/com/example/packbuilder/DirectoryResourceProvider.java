package com.example.packbuilder;

import com.example.packbuilder.resource.PackMeta;
import com.example.packbuilder.resource.PackResource;
import com.example.packbuilder.resource.ResourceKey;
import com.example.packbuilder.resource.ResourceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads resources from a source tree. Files directly in the tree belong to the root overlay,
 * files under {@code overlays/<name>/} belong to overlay {@code <name>}. Hidden files are skipped.
 */
public final class DirectoryResourceProvider implements ResourceProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryResourceProvider.class);
    static final String OVERLAYS_DIRECTORY = "overlays";

    private final Path sourceDirectory;
    private final String description;

    public DirectoryResourceProvider(Path sourceDirectory, String description) {
        this.sourceDirectory = sourceDirectory.toAbsolutePath().normalize();
        this.description = description;
    }

    @Override
    public ResourceSet build() throws IOException {
        if (!Files.isDirectory(sourceDirectory)) {
            throw new IOException("Source directory does not exist: " + sourceDirectory);
        }
        List<PackResource> resources = new ArrayList<>();
        Path overlays = sourceDirectory.resolve(OVERLAYS_DIRECTORY);
        collect(sourceDirectory, "", overlays, resources);
        if (Files.isDirectory(overlays)) {
            try (Stream<Path> stream = Files.list(overlays)) {
                for (Path overlay : stream.filter(Files::isDirectory).sorted().toList()) {
                    String name = overlay.getFileName().toString();
                    if (!isHidden(overlay.getFileName())) {
                        collect(overlay, name, null, resources);
                    }
                }
            }
        }
        LOGGER.info("Found {} resources in {}", resources.size(), sourceDirectory);
        PackMeta meta = new PackMeta(Map.of(
                "description", description,
                "resourceCount", resources.size()
        ));
        return new ResourceSet(meta, resources);
    }

    private void collect(Path directory, String overlay, Path excluded, List<PackResource> target) throws IOException {
        try (Stream<Path> stream = Files.walk(directory)) {
            List<Path> files = stream
                    .filter(path -> excluded == null || !path.startsWith(excluded))
                    .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                    .filter(path -> !isHidden(directory.relativize(path)))
                    .sorted()
                    .toList();
            for (Path file : files) {
                String relative = directory.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
                target.add(new PackResource(new ResourceKey(overlay, relative), Files.size(file), () -> read(file)));
            }
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read resource " + file, ex);
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
