package com.example.packbuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Snapshot of the files and directories under a build root, keyed by relative path in reverse
 * lexicographic order so children always come before their parents. Entries are claimed as the
 * build produces them; whatever is left afterwards is stale.
 */
final class DirectoryIndex {
    private final TreeMap<String, Path> entries = new TreeMap<>(Comparator.reverseOrder());

    private DirectoryIndex() {
    }

    /**
     * Walks the root, which must exist. The root itself is not indexed.
     */
    static DirectoryIndex snapshot(Path root) throws IOException {
        DirectoryIndex index = new DirectoryIndex();
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(path -> !path.equals(root))
                    .forEach(path -> index.entries.put(root.relativize(path).toString(), path));
        }
        return index;
    }

    /**
     * Removes and returns the entry for this relative path, if present.
     */
    synchronized Optional<Path> claim(String relativePath) {
        return Optional.ofNullable(entries.remove(relativePath));
    }

    /**
     * Unclaimed entries, deepest first.
     */
    synchronized List<Path> remaining() {
        return new ArrayList<>(entries.values());
    }
}
