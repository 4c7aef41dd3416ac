package org.dxworks.fortframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceFormDetectorTest {
    private final SourceFormDetector detector = new SourceFormDetector(FortframeConfig.defaults());

    @Test
    void detectsFormFromExtension() {
        assertEquals(Optional.of(SourceForm.FREE), detector.detectForm(Path.of("src/solver.f90")));
        assertEquals(Optional.of(SourceForm.FREE), detector.detectForm(Path.of("solver.f08")));
        assertEquals(Optional.of(SourceForm.FIXED), detector.detectForm(Path.of("legacy.f")));
        assertEquals(Optional.of(SourceForm.FIXED), detector.detectForm(Path.of("LEGACY.FOR")));
    }

    @Test
    void preprocessedExtensions() {
        assertEquals(Optional.of(SourceForm.FREE), detector.detectForm(Path.of("config.F90")));
        assertTrue(detector.needsPreprocessing(Path.of("config.F90")));
        assertEquals(Optional.of(SourceForm.FIXED), detector.detectForm(Path.of("old.F")));
        assertTrue(detector.needsPreprocessing(Path.of("old.F")));
        assertFalse(detector.needsPreprocessing(Path.of("plain.f90")));
    }

    @Test
    void otherFilesAreNotSources() {
        assertFalse(detector.isSource(Path.of("README.md")));
        assertFalse(detector.isSource(Path.of("Makefile")));
        assertFalse(detector.isSource(Path.of(".f90")));
        assertFalse(detector.isSource(Path.of("trailing.")));
        assertFalse(detector.isSource(Path.of("solver.F08x")));
    }

    @Test
    void configuredExtensionsAreUsed() {
        SourceFormDetector custom = new SourceFormDetector(TestUtils.config(s -> {
            s.extensions.add("inc");
            s.fixedExtensions.add("f77");
        }));

        assertEquals(Optional.of(SourceForm.FREE), custom.detectForm(Path.of("defs.inc")));
        assertEquals(Optional.of(SourceForm.FIXED), custom.detectForm(Path.of("old.f77")));
    }
}
