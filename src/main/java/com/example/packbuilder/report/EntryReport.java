package com.example.packbuilder.report;

/**
 * Serialized description of one entry of a build.
 */
public record EntryReport(
        String overlay,
        String path,
        long size,
        String mimeType
) {
}
