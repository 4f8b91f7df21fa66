package com.example.packbuilder;

import com.example.packbuilder.report.BuildReport;
import com.example.packbuilder.report.EntryReport;
import com.example.packbuilder.resource.PackMeta;
import com.example.packbuilder.resource.ResourceKey;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildReportWriterTest {
    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private BuildResult result() {
        BuildResult.Builder builder = BuildResult.builder(new PackMeta(Map.of("description", "Test pack")), tempDir);
        builder.put(ResourceKey.root("textures/skin.png"),
                new byte[] {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A});
        builder.put(new ResourceKey("legacy", "notes.txt"), "plain text".getBytes(StandardCharsets.UTF_8));
        return builder.freeze(true);
    }

    @Test
    void describesEveryEntry() {
        BuildReport report = new BuildReportWriter(new Tika(), clock).report(PackType.FOLDER, result());

        assertEquals("FOLDER", report.packType());
        assertTrue(report.changed());
        assertEquals(tempDir.toString(), report.targetDirectory());
        assertEquals(2, report.entries().size());
        EntryReport notes = report.entries().get(0);
        assertEquals("legacy", notes.overlay());
        assertEquals("notes.txt", notes.path());
        assertEquals(10L, notes.size());
        assertTrue(notes.mimeType().startsWith("text/plain"));
        assertTrue(report.entries().get(1).mimeType().contains("png"));
    }

    @Test
    void writesJson() throws Exception {
        BuildReportWriter writer = new BuildReportWriter(new Tika(), clock);
        BuildResult result = result();
        Path file = tempDir.resolve("reports").resolve("build.json");

        writer.write(file, PackType.ZIP, result);

        JsonNode json = writer.mapper().readTree(file.toFile());
        assertEquals(result.hash(), json.get("hash").asText());
        assertEquals("ZIP", json.get("packType").asText());
        assertEquals("2024-05-01T12:00:00Z", json.get("builtAt").asText());
        assertEquals("Test pack", json.get("meta").get("description").asText());
        assertEquals("textures/skin.png", json.get("entries").get(1).get("path").asText());
    }
}
