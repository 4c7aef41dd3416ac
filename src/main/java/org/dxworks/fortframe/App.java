package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.fortframe.correlate.ExternalLinkDirectory;
import org.dxworks.fortframe.diagnostics.Diagnostic;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.diagnostics.FortframeException;
import org.dxworks.fortframe.diagnostics.Severity;
import org.dxworks.fortframe.model.GenericSourceEntity;
import org.dxworks.fortframe.model.SourceFileEntity;
import org.dxworks.fortframe.project.Project;
import org.dxworks.fortframe.project.ProjectLoader;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar fortframe.jar <source-dir> <output-file> [<link-dir>]");
            System.err.println("  <source-dir>:  Fortran source directory");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  <link-dir>:    Optional directory to write " + ExternalLinkDirectory.FILE_NAME + " into");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isDirectory(input)) {
            System.err.println("Error: Source directory does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting Fortran documentation extraction...");
        System.out.println("Input: " + input.toAbsolutePath());

        Instant startTime = Instant.now();
        Project project;
        try {
            FortframeConfig config = FortframeConfig.load();
            project = new ProjectLoader(config).load(List.of(input));
            project.correlate();
        } catch (FortframeException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }
        System.out.println("Parsed " + project.getFiles().size() + " source files");

        Diagnostics diagnostics = project.getDiagnostics();
        writeJsonl(jsonlOutput, input, project, diagnostics, startTime);

        if (args.length > 2) {
            Path linkDir = Paths.get(args[2]);
            String baseUrl = linkDir.toAbsolutePath().toUri().toString();
            ExternalLinkDirectory.of(project.getFiles(), baseUrl).write(linkDir);
            System.out.println("Link directory written to: " + linkDir.toAbsolutePath());
        }

        long errors = diagnostics.all().stream().filter(d -> d.severity == Severity.ERROR).count();
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Extraction complete!");
        System.out.println("Modules: " + project.getModules().size()
                + ", procedures: " + project.getProcedures().size()
                + ", types: " + project.getTypes().size());
        if (!diagnostics.isEmpty()) {
            System.out.println("Diagnostics: " + diagnostics.size() + " (" + errors + " errors)");
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static void writeJsonl(Path jsonlOutput, Path input, Project project, Diagnostics diagnostics,
                           Instant startTime) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", project.getFiles().size() + project.getExtraFiles().size());
            writeLine(writer, runInfo);

            for (SourceFileEntity file : project.getFiles()) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "sourcefile");
                record.put("path", file.path);
                record.put("tree", file);
                writeLine(writer, record);
            }

            for (GenericSourceEntity extraFile : project.getExtraFiles()) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "genericsource");
                record.put("path", extraFile.path);
                record.put("tree", extraFile);
                writeLine(writer, record);
            }

            for (Diagnostic diagnostic : diagnostics.all()) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "diagnostic");
                record.put("diagnostic", diagnostic);
                writeLine(writer, record);
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_parsed", project.getFiles().size() + project.getExtraFiles().size());
            doneInfo.put("diagnostics", diagnostics.size());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }
    }

    private static void writeLine(BufferedWriter writer, Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
    }
}
