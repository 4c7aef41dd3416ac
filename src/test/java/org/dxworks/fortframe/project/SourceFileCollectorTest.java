package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileCollectorTest {
    @TempDir
    Path root;

    @BeforeEach
    void createTree() throws IOException {
        for (String file : List.of("main.f90", "legacy.f", "notes.txt", "src/solver.f90", "src/gen/table.f90",
                "build/copy.f90", "src/io.F90")) {
            Path path = root.resolve(file);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "");
        }
    }

    @Test
    void collectsSourcesSortedByPath() throws IOException {
        List<Path> files = new SourceFileCollector(FortframeConfig.defaults()).collect(List.of(root));

        assertEquals(List.of("build/copy.f90", "legacy.f", "main.f90", "src/gen/table.f90", "src/io.F90",
                "src/solver.f90"), relative(files));
        assertTrue(files.stream().allMatch(Path::isAbsolute));
    }

    @Test
    void excludedDirectoriesAreSkipped() throws IOException {
        List<Path> files = new SourceFileCollector(TestUtils.config(s -> s.excludeDir.addAll(List.of("build", "src/gen"))))
                .collect(List.of(root));

        assertEquals(List.of("legacy.f", "main.f90", "src/io.F90", "src/solver.f90"), relative(files));
    }

    @Test
    void excludedFilesMatchNameOrRelativePath() throws IOException {
        List<Path> files = new SourceFileCollector(TestUtils.config(s -> s.exclude.addAll(List.of("legacy.*", "src/*.f90"))))
                .collect(List.of(root));

        assertEquals(List.of("build/copy.f90", "main.f90", "src/gen/table.f90", "src/io.F90"), relative(files));
    }

    @Test
    void rootMayBeASingleFile() throws IOException {
        SourceFileCollector collector = new SourceFileCollector(FortframeConfig.defaults());

        assertEquals(List.of("main.f90"), relative(collector.collect(List.of(root.resolve("main.f90")))));
        assertTrue(collector.collect(List.of(root.resolve("notes.txt"))).isEmpty());
    }

    @Test
    void extraFileTypesAreCollectedWithTheSources() throws IOException {
        List<Path> files = new SourceFileCollector(TestUtils.config(s -> s.extraFiletypes.put("txt", "#")))
                .collect(List.of(root));

        assertEquals(List.of("build/copy.f90", "legacy.f", "main.f90", "notes.txt", "src/gen/table.f90", "src/io.F90",
                "src/solver.f90"), relative(files));
    }

    @Test
    void overlappingRootsAreDeduplicated() throws IOException {
        List<Path> files = new SourceFileCollector(FortframeConfig.defaults())
                .collect(List.of(root.resolve("src"), root.resolve("src/../src/gen")));

        assertEquals(List.of("src/gen/table.f90", "src/io.F90", "src/solver.f90"), relative(files));
    }

    private List<String> relative(List<Path> files) {
        Path base = root.toAbsolutePath().normalize();
        return files.stream().map(f -> base.relativize(f).toString().replace('\\', '/')).toList();
    }
}
