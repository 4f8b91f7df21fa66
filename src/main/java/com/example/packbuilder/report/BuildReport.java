package com.example.packbuilder.report;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serialized summary of a finished build.
 */
public record BuildReport(
        String packType,
        String hash,
        boolean changed,
        String targetDirectory,
        Map<String, Object> meta,
        Instant builtAt,
        List<EntryReport> entries
) {
}
