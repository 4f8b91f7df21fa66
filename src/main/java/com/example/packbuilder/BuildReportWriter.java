package com.example.packbuilder;

import com.example.packbuilder.report.BuildReport;
import com.example.packbuilder.report.EntryReport;
import com.example.packbuilder.resource.ResourceKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class BuildReportWriter {
    private static final String FALLBACK_MIME_TYPE = "application/octet-stream";

    private final ObjectMapper mapper;
    private final Tika tika;
    private final Clock clock;

    public BuildReportWriter(Tika tika) {
        this(tika, Clock.systemUTC());
    }

    BuildReportWriter(Tika tika, Clock clock) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.tika = tika;
        this.clock = clock;
    }

    /**
     * Describes the result, detecting a media type for every entry.
     */
    public BuildReport report(PackType packType, BuildResult result) {
        List<EntryReport> entries = new ArrayList<>(result.size());
        for (Map.Entry<ResourceKey, byte[]> entry : result.entries().entrySet()) {
            ResourceKey key = entry.getKey();
            entries.add(new EntryReport(key.overlay(), key.path(), entry.getValue().length, detectMimeType(key, entry.getValue())));
        }
        return new BuildReport(
                packType.name(),
                result.hash(),
                result.changed(),
                result.targetDirectory().map(Path::toString).orElse(null),
                result.meta().properties(),
                clock.instant(),
                entries
        );
    }

    /**
     * Writes the report as JSON, creating the parent directories if needed.
     */
    public void write(Path file, PackType packType, BuildResult result) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report(packType, result));
    }

    ObjectMapper mapper() {
        return mapper;
    }

    private String detectMimeType(ResourceKey key, byte[] bytes) {
        String name = key.path().substring(key.path().lastIndexOf('/') + 1);
        MediaType mediaType = MediaType.parse(tika.detect(bytes, name));
        return mediaType == null ? FALLBACK_MIME_TYPE : mediaType.toString();
    }
}
