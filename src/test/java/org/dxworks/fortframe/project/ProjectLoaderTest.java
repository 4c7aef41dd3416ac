package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.TestUtils;
import org.dxworks.fortframe.diagnostics.*;
import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.GenericSourceEntity;
import org.dxworks.fortframe.model.SourceFileEntity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectLoaderTest {
    private static final Path SAMPLES = Paths.get(TestUtils.SAMPLES_BASE_PATH);
    private static final Preprocessor UNUSED = file -> fail("no preprocessing expected for " + file);

    @Test
    void loadsSampleProjectInPathOrder() throws IOException {
        Project project = new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(SAMPLES));

        List<String> names = project.getFiles().stream().map(f -> f.name).toList();
        assertEquals(List.of("legacy.f", "utils.f90", "main.f90", "shapes.f90"), names);
        assertEquals(SourceForm.FIXED, project.getFiles().get(0).form);
        assertTrue(project.getFiles().get(1).path.endsWith("samples/fortran/lib/utils.f90"));
        assertFalse(project.getFiles().get(1).preprocessed);
        assertTrue(project.getDiagnostics().all().stream().noneMatch(d -> d.severity == Severity.ERROR));
    }

    @Test
    void projectListsEntitiesByKind() throws IOException {
        Project project = new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(SAMPLES));

        assertEquals(List.of("utils", "shapes"), names(project.getModules()));
        assertEquals(List.of("main"), names(project.getPrograms()));
        assertEquals(List.of("legacy", "helper", "clamp", "square", "internal_helper", "describe", "circle_area",
                "destroy"), names(project.getProcedures()).stream().map(String::toLowerCase).toList());
        assertEquals(List.of("shape", "circle"), names(project.getTypes()));
        assertEquals(List.of("area_iface"), names(project.getAbstractInterfaces()));
        assertTrue(project.getInterfaces().isEmpty());
        assertTrue(project.getBlockData().isEmpty());
        assertEquals(1, project.getCommonBlocks().get("shared").size());
        assertSame(project.getTypes().get(1), project.findEntity("CIRCLE", EntityKind.DERIVED_TYPE).orElseThrow());
        assertEquals(0, project.getConfig().getParallel());
    }

    @Test
    void blockDataAndSubmodulesAreListedSeparately(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a_base.f90"), "module base\nend module base\n");
        Files.writeString(dir.resolve("b_impl.f90"), "submodule (base) impl\nend submodule impl\n");
        Files.writeString(dir.resolve("c_init.f90"), "block data init\n  common /cfg/ n\nend block data init\n");

        Project project = new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(dir));

        assertEquals(List.of("base"), names(project.getModules()));
        assertEquals(List.of("impl"), names(project.getSubmodules()));
        assertEquals(List.of("init"), names(project.getBlockData()));
        assertEquals(List.of("cfg"), List.copyOf(project.getCommonBlocks().keySet()));
    }

    @Test
    void extraFilesContributeDocumentationOnly(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("build.sh"), "#! author: Jane Doe\n#!\n#! Builds everything.\nmake\n");
        Files.writeString(dir.resolve("notes.txt"), "#! not collected\n");
        Files.writeString(dir.resolve("solver.f90"), "module solver\nend module solver\n");

        Project project = new ProjectLoader(TestUtils.config(s -> s.extraFiletypes.put("sh", "#")), UNUSED)
                .load(List.of(dir));
        project.correlate();

        assertEquals(List.of("solver.f90"), project.getFiles().stream().map(f -> f.name).toList());
        assertEquals(1, project.getExtraFiles().size());
        GenericSourceEntity script = project.getExtraFiles().get(0);
        assertEquals("build.sh", script.name);
        assertEquals("Builds everything.", script.documentation);
        assertEquals("Jane Doe", script.metadata.author);
        assertTrue(script.path.endsWith("/build.sh"));
        assertTrue(project.findEntity("build.sh").isEmpty());
        assertTrue(project.getDiagnostics().isEmpty());
    }

    @Test
    void parallelLoadingGivesTheSameResult() throws IOException {
        Project sequential = new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(SAMPLES));
        Project parallel = new ProjectLoader(TestUtils.config(s -> s.parallel = 3), UNUSED).load(List.of(SAMPLES));
        sequential.correlate();
        parallel.correlate();

        assertEquals(TestUtils.APPROVAL_MAPPER.writeValueAsString(sequential.getFiles()),
                TestUtils.APPROVAL_MAPPER.writeValueAsString(parallel.getFiles()));
    }

    @Test
    void structuralErrorAbortsLoadingUnlessForced(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("bad.f90"), "module m\nend module n\n");
        Files.writeString(dir.resolve("good.f90"), "module g\nend module g\n");

        StructuralParseException e = assertThrows(StructuralParseException.class,
                () -> new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(dir)));
        assertEquals(2, e.getLine());

        Project forced = new ProjectLoader(TestUtils.config(s -> s.force = true), UNUSED).load(List.of(dir));
        assertEquals(List.of("good.f90"), forced.getFiles().stream().map(f -> f.name).toList());
        Diagnostic diagnostic = forced.getDiagnostics().all().get(0);
        assertEquals(Severity.ERROR, diagnostic.severity);
        assertEquals(DiagnosticKind.STRUCTURAL, diagnostic.kind);
        assertEquals(2, diagnostic.line);
        assertTrue(diagnostic.file.endsWith("bad.f90"));
    }

    @Test
    void forcedParallelLoadingKeepsGoodFiles(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a.f90"), "module a\nend module a\n");
        Files.writeString(dir.resolve("b.f90"), "module b\n");
        Files.writeString(dir.resolve("c.f90"), "module c\nend module c\n");

        Project project = new ProjectLoader(TestUtils.config(s -> {
            s.force = true;
            s.parallel = 2;
        }), UNUSED).load(List.of(dir));

        assertEquals(List.of("a", "c"), project.getModules().stream().map(m -> m.name).toList());
        assertEquals(1, project.getDiagnostics().ofKind(DiagnosticKind.STRUCTURAL).size());
    }

    @Test
    void undecodableFileIsEncodingError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("latin.f90");
        Files.write(file, new byte[]{'!', ' ', (byte) 0xC3, (byte) 0x28, '\n'});

        assertThrows(SourceEncodingException.class,
                () -> new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(dir)));

        Project forced = new ProjectLoader(TestUtils.config(s -> s.force = true), UNUSED).load(List.of(dir));
        assertTrue(forced.getFiles().isEmpty());
        assertEquals(DiagnosticKind.ENCODING, forced.getDiagnostics().all().get(0).kind);
    }

    @Test
    void byteOrderMarkIsSkipped(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("bom.f90"), "\uFEFFmodule bom\nend module bom\n");

        Project project = new ProjectLoader(FortframeConfig.defaults(), UNUSED).load(List.of(dir));

        assertEquals("bom", project.getModules().get(0).name);
    }

    @Test
    void preprocessedExtensionsGoThroughThePreprocessor(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("pre.F90"), "#ifdef X\nmodule raw\n#endif\n");
        Preprocessor preprocessor = file -> "module pre\nend module pre\n";

        Project project = new ProjectLoader(FortframeConfig.defaults(), preprocessor).load(List.of(dir));

        SourceFileEntity file = project.getFiles().get(0);
        assertTrue(file.preprocessed);
        assertEquals(SourceForm.FREE, file.form);
        assertEquals("pre", project.getModules().get(0).name);
    }

    @Test
    void preprocessorFailureIsReportedWhenForced(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("pre.F90"), "module pre\nend module pre\n");
        Preprocessor failing = file -> {
            throw new PreprocessingException(file.toString(), "boom");
        };

        assertThrows(PreprocessingException.class,
                () -> new ProjectLoader(FortframeConfig.defaults(), failing).load(List.of(dir)));

        Project forced = new ProjectLoader(TestUtils.config(s -> s.force = true), failing).load(List.of(dir));
        Diagnostic diagnostic = forced.getDiagnostics().all().get(0);
        assertEquals(DiagnosticKind.PREPROCESSING, diagnostic.kind);
        assertTrue(diagnostic.message.contains("boom"));
    }

    @Test
    void unreadableExternalProjectIsOnlyAWarning(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("m.f90"), "module m\nend module m\n");
        String missing = dir.resolve("no-such-project").toString();

        Project project = new ProjectLoader(TestUtils.config(s -> s.external.put("other", missing)), UNUSED)
                .load(List.of(dir));

        assertEquals(1, project.getFiles().size());
        assertTrue(project.getExternalModules().isEmpty());
        Diagnostic diagnostic = project.getDiagnostics().all().get(0);
        assertEquals(Severity.WARNING, diagnostic.severity);
        assertEquals(DiagnosticKind.CONFIGURATION, diagnostic.kind);
        assertEquals(missing, diagnostic.file);
    }

    @Test
    void commandPreprocessorBuildsItsInvocation() {
        CommandPreprocessor preprocessor = new CommandPreprocessor("cpp  -E -P", List.of("DEBUG", "N=4"),
                List.of("include"), java.nio.charset.StandardCharsets.UTF_8);

        assertEquals(List.of("cpp", "-E", "-P", "-DDEBUG", "-DN=4", "-Iinclude"), preprocessor.getCommand());
    }

    @Test
    void missingPreprocessorCommandIsPreprocessingError(@TempDir Path dir) throws IOException {
        Path source = Files.writeString(dir.resolve("x.F90"), "module x\nend module x\n");
        CommandPreprocessor preprocessor = new CommandPreprocessor("fortframe-no-such-preprocessor", List.of(),
                List.of(), java.nio.charset.StandardCharsets.UTF_8);

        assertThrows(PreprocessingException.class, () -> preprocessor.preprocess(source));
    }

    private static List<String> names(List<? extends FortranEntity> entities) {
        return entities.stream().map(e -> e.name).toList();
    }
}
