package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.project.Project;
import org.dxworks.fortframe.project.ProjectLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void writesRunFilesDiagnosticsAndDoneRecords(@TempDir Path dir) throws IOException {
        Path input = Paths.get(TestUtils.SAMPLES_BASE_PATH);
        Project project = new ProjectLoader(FortframeConfig.defaults(), file -> fail("unexpected " + file))
                .load(List.of(input));
        project.correlate();
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.warn("main.f90", 3, DiagnosticKind.UNRESOLVED_REFERENCE, "call to 'nowhere' not found");
        Path output = dir.resolve("out/fortframe.jsonl");
        Files.createDirectories(output.getParent());

        App.writeJsonl(output, input, project, diagnostics, Instant.now());

        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            records.add(TestUtils.APPROVAL_MAPPER.readTree(line));
        }
        assertEquals(1 + 4 + 1 + 1, records.size());

        JsonNode run = records.get(0);
        assertEquals("run", run.get("kind").asText());
        assertEquals(4, run.get("total_files").asInt());

        JsonNode legacy = records.get(1);
        assertEquals("sourcefile", legacy.get("kind").asText());
        assertTrue(legacy.get("path").asText().endsWith("legacy.f"));
        assertEquals("sourcefile", legacy.at("/tree/kind").asText());
        assertEquals("FIXED", legacy.at("/tree/form").asText());

        JsonNode diagnostic = records.get(5);
        assertEquals("diagnostic", diagnostic.get("kind").asText());
        assertEquals("UNRESOLVED_REFERENCE", diagnostic.at("/diagnostic/kind").asText());
        assertEquals(3, diagnostic.at("/diagnostic/line").asInt());

        JsonNode done = records.get(6);
        assertEquals("done", done.get("kind").asText());
        assertEquals(4, done.get("files_parsed").asInt());
        assertEquals(1, done.get("diagnostics").asInt());
    }

    @Test
    void treeRecordsCarryReferencesButNotBackLinks(@TempDir Path dir) throws IOException {
        Path input = Paths.get(TestUtils.SAMPLES_BASE_PATH);
        Project project = new ProjectLoader(FortframeConfig.defaults(), file -> fail("unexpected " + file))
                .load(List.of(input));
        project.correlate();
        Path output = dir.resolve("fortframe.jsonl");

        App.writeJsonl(output, input, project, new Diagnostics(), Instant.now());

        String text = Files.readString(output, StandardCharsets.UTF_8);
        assertFalse(text.contains("\"parent\""));
        assertFalse(text.contains("\"docFragments\""));
        assertFalse(text.contains("\"target\""));
        assertTrue(text.contains("\"resolved\":true"));
        assertTrue(text.contains("\"targetKind\""));
    }
}
