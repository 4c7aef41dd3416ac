package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.TestUtils;
import org.dxworks.fortframe.diagnostics.ConfigurationException;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.*;
import org.dxworks.fortframe.project.Project;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExternalLinkDirectoryTest {
    private static final String BASE_URL = "https://docs.example.org/proj";

    private static final String LIBRARY = String.join("\n",
            "module lib",
            "  private",
            "  public :: helper",
            "  integer, public :: counter",
            "contains",
            "  subroutine helper()",
            "  end subroutine helper",
            "  subroutine hidden()",
            "  end subroutine hidden",
            "end module lib",
            "");

    @Test
    void directoryListsPublicMembersWithTheirPages() {
        SourceFileEntity file = TestUtils.parse("lib.f90", LIBRARY);

        ExternalLinkDirectory directory = ExternalLinkDirectory.of(List.of(file), BASE_URL);

        assertEquals(1, directory.getModules().size());
        ExternalLinkDirectory.ModuleLink lib = directory.getModules().get(0);
        assertEquals("lib", lib.name);
        assertEquals(BASE_URL + "/module/lib.html", lib.url);
        assertEquals(List.of("counter", "helper"), lib.members.stream().map(m -> m.name).toList());
        assertEquals(BASE_URL + "/module/lib.html#variable-counter", lib.members.get(0).url);
        assertEquals(BASE_URL + "/proc/helper.html", lib.members.get(1).url);
        assertEquals(ProcedureType.SUBROUTINE, lib.members.get(1).procedureType);
    }

    @Test
    void submodulesAreNotListed() {
        SourceFileEntity file = TestUtils.parse("impl.f90", "submodule (lib) impl\nend submodule impl\n");

        assertTrue(ExternalLinkDirectory.of(List.of(file), BASE_URL).getModules().isEmpty());
    }

    @Test
    void writtenDirectoryLinksAnotherProject(@TempDir Path dir) throws IOException {
        ExternalLinkDirectory.of(List.of(TestUtils.parse("lib.f90", LIBRARY)), BASE_URL).write(dir);
        assertTrue(Files.exists(dir.resolve(ExternalLinkDirectory.FILE_NAME)));

        List<ModuleEntity> external = ExternalLinkDirectory.read(dir.toString()).toModules();
        assertEquals(1, external.size());
        ModuleEntity lib = external.get(0);
        assertEquals(BASE_URL + "/module/lib.html", lib.externalUrl);
        assertEquals(EntityKind.VARIABLE, lib.children.get(0).kind);
        assertEquals(ProcedureType.SUBROUTINE, ((ProcedureEntity) lib.children.get(1)).procedureType);

        FortframeConfig config = TestUtils.config(s -> s.warn = true);
        SourceFileEntity user = TestUtils.parseResult(config, "app.f90",
                "program app\n  use lib\n  call helper()\nend program app\n").getSourceFile();
        Project project = new Project(config, List.of(user), external, new Diagnostics());
        project.correlate();

        ProgramEntity app = (ProgramEntity) user.children.get(0);
        assertSame(lib, app.uses.get(0).module.target);
        assertEquals(BASE_URL + "/proc/helper.html", app.calls.get(0).getExternalUrl());
        assertTrue(project.getDiagnostics().isEmpty());
    }

    @Test
    void unreadableDirectoryIsConfigurationError(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> ExternalLinkDirectory.read(dir.resolve("missing").toString()));
    }

    @Test
    void malformedDirectoryIsConfigurationError(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(ExternalLinkDirectory.FILE_NAME), "{ not json");

        assertThrows(ConfigurationException.class, () -> ExternalLinkDirectory.read(dir.toString()));
    }

    @Test
    void urlsOfNestedEntitiesAnchorOnTheirPage() {
        SourceFileEntity file = TestUtils.parse("geo.f90", String.join("\n",
                "module Geo",
                "  type :: point",
                "    real :: x",
                "  end type point",
                "end module Geo",
                ""));
        ModuleEntity geo = (ModuleEntity) file.children.get(0);
        DerivedTypeEntity point = (DerivedTypeEntity) geo.children.get(0);

        assertEquals("https://x.org/module/geo.html", EntityUrls.urlFor(geo, "https://x.org/"));
        assertEquals("https://x.org/type/point.html", EntityUrls.urlFor(point, "https://x.org"));
        assertEquals("https://x.org/type/point.html#variable-x", EntityUrls.urlFor(point.children.get(0), "https://x.org"));
    }
}
