package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.TestUtils;
import org.dxworks.fortframe.diagnostics.Diagnostic;
import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.*;
import org.dxworks.fortframe.parser.FortranParser;
import org.dxworks.fortframe.project.Project;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorrelatorTest {
    private static final List<String> FIXTURES = List.of("legacy.f", "lib/utils.f90", "main.f90", "shapes.f90");

    private static Project fixtureProject(FortframeConfig config) {
        FortranParser parser = new FortranParser(config);
        List<SourceFileEntity> files = new ArrayList<>();
        for (String name : FIXTURES) {
            SourceForm form = name.endsWith(".f") ? SourceForm.FIXED : SourceForm.FREE;
            files.add(parser.parse(name, read(name), form).getSourceFile());
        }
        Project project = new Project(config, files, List.of(), new Diagnostics());
        project.correlate();
        return project;
    }

    private static Project project(FortframeConfig config, String... sources) {
        List<SourceFileEntity> files = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            files.add(TestUtils.parseResult(config, "file" + i + ".f90", sources[i]).getSourceFile());
        }
        Project project = new Project(config, files, List.of(), new Diagnostics());
        project.correlate();
        return project;
    }

    private static <T extends FortranEntity> T find(Project project, Class<T> type, String name, EntityKind kind) {
        return type.cast(project.findEntity(name, kind).orElseThrow());
    }

    @Test
    void programCallsResolveAcrossFiles() {
        Project project = fixtureProject(FortframeConfig.defaults());
        ProgramEntity main = find(project, ProgramEntity.class, "main", EntityKind.PROGRAM);
        DerivedTypeEntity shape = find(project, DerivedTypeEntity.class, "shape", EntityKind.DERIVED_TYPE);
        DerivedTypeEntity circle = find(project, DerivedTypeEntity.class, "circle", EntityKind.DERIVED_TYPE);

        assertEquals(4, main.calls.size());
        assertSame(circle.getBindings().get(0), main.calls.get(0).target);
        assertSame(shape.getBindings().get(1), main.calls.get(1).target);
        assertEquals(EntityKind.PROCEDURE, main.calls.get(2).getTargetKind());
        assertEquals("clamp", main.calls.get(2).name);
        assertEquals("lib/utils.f90", main.calls.get(2).getTargetFile());
        assertEquals("LEGACY", main.calls.get(3).name);
        assertEquals("legacy.f", main.calls.get(3).getTargetFile());

        VariableEntity c = main.childrenOf(VariableEntity.class).get(0);
        assertSame(circle, c.prototype.target);
    }

    @Test
    void typeExtensionInheritsComponentsAndBindings() {
        Project project = fixtureProject(FortframeConfig.defaults());
        DerivedTypeEntity shape = find(project, DerivedTypeEntity.class, "shape", EntityKind.DERIVED_TYPE);
        DerivedTypeEntity circle = find(project, DerivedTypeEntity.class, "circle", EntityKind.DERIVED_TYPE);

        assertSame(shape, circle.extendsType.target);
        assertEquals(List.of("x"), circle.inheritedComponents.stream().map(r -> r.name).toList());
        assertEquals(List.of("describe"), circle.inheritedBindings.stream().map(r -> r.name).toList());
        assertNull(circle.constructor);
        assertNull(shape.extendsType);
    }

    @Test
    void bindingsResolveToProceduresAndInterfaces() {
        Project project = fixtureProject(FortframeConfig.defaults());
        DerivedTypeEntity shape = find(project, DerivedTypeEntity.class, "shape", EntityKind.DERIVED_TYPE);
        DerivedTypeEntity circle = find(project, DerivedTypeEntity.class, "circle", EntityKind.DERIVED_TYPE);

        BoundProcedureEntity deferred = shape.getBindings().get(0);
        assertFalse(deferred.bindings.get(0).isResolved());
        assertEquals(EntityKind.ABSTRACT_INTERFACE, deferred.prototype.getTargetKind());
        assertEquals("area_iface", deferred.prototype.name);

        List<BoundProcedureEntity> bindings = circle.getBindings();
        assertEquals("circle_area", bindings.get(0).bindings.get(0).target.name);
        assertSame(bindings.get(0), bindings.get(1).bindings.get(0).target);
        assertEquals(EntityKind.PROCEDURE, bindings.get(2).bindings.get(0).getTargetKind());
        assertEquals("destroy", bindings.get(2).bindings.get(0).target.name);
    }

    @Test
    void commonBlockAndNamelistMembersResolveLocally() {
        Project project = fixtureProject(FortframeConfig.defaults());
        ProcedureEntity legacy = find(project, ProcedureEntity.class, "legacy", EntityKind.PROCEDURE);

        CommonBlockEntity shared = project.getCommonBlocks().get("shared").get(0);
        assertTrue(shared.members.stream().allMatch(EntityRef::isResolved));
        assertSame(legacy.childrenOf(VariableEntity.class).get(0), shared.members.get(0).target);
        NamelistEntity cfg = legacy.childrenOf(NamelistEntity.class).get(0);
        assertSame(legacy.arguments.get(0), cfg.members.get(0).target);
        assertEquals("HELPER", legacy.calls.get(0).target.name);
    }

    @Test
    void intrinsicModulesAndProceduresNeedNoSource() {
        Project project = fixtureProject(FortframeConfig.defaults());
        ModuleEntity utils = find(project, ModuleEntity.class, "utils", EntityKind.MODULE);
        ProcedureEntity clamp = find(project, ProcedureEntity.class, "clamp", EntityKind.PROCEDURE);

        FortranEntity env = utils.uses.get(0).module.target;
        assertTrue(env.isExternal());
        assertEquals("http://fortranwiki.org/fortran/show/iso_fortran_env", env.externalUrl);
        assertTrue(clamp.calls.isEmpty());
    }

    @Test
    void fixtureProjectCorrelatesWithoutWarnings() {
        Project project = fixtureProject(TestUtils.config(s -> s.warn = true));

        assertTrue(project.getDiagnostics().isEmpty(), () -> project.getDiagnostics().all().toString());
    }

    @Test
    void correlatingAgainGivesTheSameLinks() {
        Project project = fixtureProject(TestUtils.config(s -> s.warn = true));
        ProgramEntity main = find(project, ProgramEntity.class, "main", EntityKind.PROGRAM);
        DerivedTypeEntity circle = find(project, DerivedTypeEntity.class, "circle", EntityKind.DERIVED_TYPE);
        List<EntityRef> calls = List.copyOf(main.calls);
        List<EntityRef> inherited = List.copyOf(circle.inheritedBindings);

        project.correlate();

        assertEquals(calls, main.calls);
        assertEquals(inherited, circle.inheritedBindings);
        assertEquals(1, circle.getBindings().get(0).bindings.size());
    }

    @Test
    void callsDistinguishProceduresIntrinsicsAndArrays() {
        String source = String.join("\n",
                "module m",
                "contains",
                "  subroutine foo(a, b)",
                "    real :: a, b",
                "  end subroutine foo",
                "  subroutine bar()",
                "    real :: x, y, arr(3)",
                "    call foo(x, y)",
                "    call missing()",
                "    x = sqrt(y) + arr(2)",
                "  end subroutine bar",
                "end module m",
                "");

        Project quiet = project(FortframeConfig.defaults(), source);
        ProcedureEntity bar = find(quiet, ProcedureEntity.class, "bar", EntityKind.PROCEDURE);
        assertEquals(2, bar.calls.size());
        assertSame(quiet.findEntity("foo").orElseThrow(), bar.calls.get(0).target);
        assertEquals("missing", bar.calls.get(1).name);
        assertFalse(bar.calls.get(1).isResolved());
        assertTrue(quiet.getDiagnostics().isEmpty());

        Project warned = project(TestUtils.config(s -> s.warn = true), source);
        List<Diagnostic> unresolved = warned.getDiagnostics().ofKind(DiagnosticKind.UNRESOLVED_REFERENCE);
        assertEquals(1, unresolved.size());
        assertTrue(unresolved.get(0).message.contains("'missing'"));
        assertEquals("file0.f90", unresolved.get(0).file);
    }

    @Test
    void unknownBindingOnTypedVariableStaysUnresolved() {
        Project project = project(TestUtils.config(s -> s.warn = true), String.join("\n",
                "module t",
                "  type :: box",
                "  contains",
                "    procedure :: open => box_open",
                "  end type box",
                "contains",
                "  subroutine box_open(self)",
                "    class(box) :: self",
                "  end subroutine box_open",
                "end module t",
                "program p",
                "  use t",
                "  type(box) :: b",
                "  call b%open()",
                "  call b%close()",
                "end program p",
                ""));

        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        assertEquals(EntityKind.BOUND_PROCEDURE, p.calls.get(0).getTargetKind());
        assertEquals("b%close", p.calls.get(1).name);
        assertFalse(p.calls.get(1).isResolved());
        assertEquals(1, project.getDiagnostics().ofKind(DiagnosticKind.UNRESOLVED_REFERENCE).size());
    }

    @Test
    void moduleNamesMatchIgnoringCase() {
        Project project = project(TestUtils.config(s -> s.warn = true), String.join("\n",
                "module mymod",
                "  type :: Grid",
                "  end type Grid",
                "contains",
                "  subroutine Refine(g)",
                "    type(grid) :: g",
                "  end subroutine Refine",
                "end module mymod",
                ""), String.join("\n",
                "program p",
                "  use MyMod",
                "  type(GRID) :: g",
                "  call REFINE(g)",
                "end program p",
                ""));

        ModuleEntity mymod = find(project, ModuleEntity.class, "mymod", EntityKind.MODULE);
        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        assertEquals("MyMod", p.uses.get(0).moduleName);
        assertSame(mymod, p.uses.get(0).module.target);
        assertEquals("Grid", p.childrenOf(VariableEntity.class).get(0).prototype.target.name);
        assertEquals("Refine", p.calls.get(0).target.name);
        assertTrue(project.getDiagnostics().isEmpty(), () -> project.getDiagnostics().all().toString());
    }

    @Test
    void useRenamesHideTheOriginalName() {
        Project project = project(FortframeConfig.defaults(), String.join("\n",
                "module geo",
                "  type :: point",
                "    real :: x",
                "  end type point",
                "end module geo",
                "program p",
                "  use GEO, only: pt => point",
                "  type(pt) :: a",
                "  type(point) :: b",
                "end program p",
                ""));

        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        DerivedTypeEntity point = find(project, DerivedTypeEntity.class, "point", EntityKind.DERIVED_TYPE);
        List<VariableEntity> variables = p.childrenOf(VariableEntity.class);
        assertSame(point, variables.get(0).prototype.target);
        assertNull(variables.get(1).prototype.target);
        assertEquals("point", variables.get(1).prototype.name);
        assertEquals(EntityKind.MODULE, p.uses.get(0).module.getTargetKind());
    }

    @Test
    void unknownModulesAreReportedUnlessIntrinsic() {
        FortframeConfig config = TestUtils.config(s -> {
            s.warn = true;
            s.extraMods.put("fftw3", "http://www.fftw.org/doc/");
        });
        Project project = project(config, String.join("\n",
                "program p",
                "  use nowhere",
                "  use, intrinsic :: vendor_mod",
                "  use fftw3",
                "end program p",
                ""));

        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        assertFalse(p.uses.get(0).module.isResolved());
        assertFalse(p.uses.get(1).module.isResolved());
        assertEquals("http://www.fftw.org/doc/", p.uses.get(2).module.getExternalUrl());
        List<Diagnostic> unresolved = project.getDiagnostics().ofKind(DiagnosticKind.UNRESOLVED_REFERENCE);
        assertEquals(1, unresolved.size());
        assertTrue(unresolved.get(0).message.contains("nowhere"));
    }

    @Test
    void separateModuleProcedureFindsItsInterfaceInTheAncestor() {
        Project project = project(TestUtils.config(s -> s.warn = true), String.join("\n",
                "module geometry",
                "  interface",
                "    module function area(r) result(a)",
                "      real, intent(in) :: r",
                "      real :: a",
                "    end function area",
                "  end interface",
                "end module geometry",
                ""), String.join("\n",
                "submodule (geometry) geometry_impl",
                "contains",
                "  module procedure area",
                "    a = 3.14 * r * r",
                "  end procedure area",
                "end submodule geometry_impl",
                ""));

        ModuleEntity geometry = project.getModules().get(0);
        ModuleEntity impl = project.getSubmodules().get(0);
        assertSame(geometry, impl.ancestorModule.target);
        assertNull(impl.parentSubmodule);

        ProcedureEntity body = impl.childrenOf(ProcedureEntity.class).get(0);
        InterfaceEntity declaration = geometry.childrenOf(InterfaceEntity.class).get(0);
        assertSame(declaration, body.moduleInterface.target);
        assertTrue(project.getDiagnostics().isEmpty());
    }

    @Test
    void genericInterfaceCollectsModuleProcedures() {
        Project project = project(FortframeConfig.defaults(), String.join("\n",
                "module ops",
                "  interface norm",
                "    module procedure norm2d",
                "  end interface norm",
                "contains",
                "  real function norm2d(v)",
                "    real :: v(2)",
                "    norm2d = 0.0",
                "  end function norm2d",
                "end module ops",
                "program p",
                "  use ops",
                "  real :: y(2)",
                "  print *, norm(y)",
                "end program p",
                ""));

        InterfaceEntity norm = find(project, InterfaceEntity.class, "norm", EntityKind.INTERFACE);
        ProcedureEntity norm2d = find(project, ProcedureEntity.class, "norm2d", EntityKind.PROCEDURE);
        assertSame(norm2d, norm.moduleProcedures.get(0).target);
        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        assertSame(norm, p.calls.get(0).target);
    }

    @Test
    void firstDeclarationWinsBetweenDuplicateExternalProcedures() {
        Project project = project(FortframeConfig.defaults(),
                "subroutine dup()\nend subroutine dup\n",
                "subroutine dup()\nend subroutine dup\n",
                "program p\n  call dup()\nend program p\n");

        ProgramEntity p = find(project, ProgramEntity.class, "p", EntityKind.PROGRAM);
        assertEquals("file0.f90", p.calls.get(0).getTargetFile());
    }

    @Test
    void displaySettingsDecideVisibility() {
        String source = String.join("\n",
                "subroutine s(a)",
                "  real :: a",
                "  integer :: tmp",
                "end subroutine s",
                "!> display: none",
                "module quiet",
                "  integer :: level",
                "end module quiet",
                "");

        Project plain = project(FortframeConfig.defaults(), source);
        ProcedureEntity s = find(plain, ProcedureEntity.class, "s", EntityKind.PROCEDURE);
        assertTrue(s.visible);
        assertTrue(s.arguments.get(0).visible);
        assertFalse(s.childrenOf(VariableEntity.class).get(0).visible);
        ModuleEntity quiet = find(plain, ModuleEntity.class, "quiet", EntityKind.MODULE);
        assertTrue(quiet.visible);
        assertFalse(quiet.children.get(0).visible);
        assertEquals(List.of(), quiet.effectiveDisplay);

        Project internals = project(TestUtils.config(c -> c.procInternals = true), source);
        ProcedureEntity s2 = find(internals, ProcedureEntity.class, "s", EntityKind.PROCEDURE);
        assertTrue(s2.childrenOf(VariableEntity.class).get(0).visible);
    }

    private static String read(String sample) {
        try {
            return Files.readString(Paths.get(TestUtils.SAMPLES_BASE_PATH + sample), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
