package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.correlate.Correlator;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All parsed files of one documentation run plus the project-wide entity lists. Files are kept in
 * path order, which fixes the order of every list and every first-found name resolution.
 * After {@link #correlate()} the entity graph is only read.
 */
public class Project {
    private final FortframeConfig config;
    private final List<SourceFileEntity> files;
    private final List<GenericSourceEntity> extraFiles;
    private final List<ModuleEntity> externalModules;
    private final Diagnostics parseDiagnostics;
    private Diagnostics correlationDiagnostics = new Diagnostics();

    private final List<FortranEntity> entities = new ArrayList<>();
    private final List<ModuleEntity> modules = new ArrayList<>();
    private final List<ModuleEntity> submodules = new ArrayList<>();
    private final List<ProgramEntity> programs = new ArrayList<>();
    private final List<ProcedureEntity> procedures = new ArrayList<>();
    private final List<DerivedTypeEntity> types = new ArrayList<>();
    private final List<InterfaceEntity> interfaces = new ArrayList<>();
    private final List<InterfaceEntity> abstractInterfaces = new ArrayList<>();
    private final List<BlockDataEntity> blockData = new ArrayList<>();
    private final Map<String, List<CommonBlockEntity>> commonBlocks = new LinkedHashMap<>();

    public Project(FortframeConfig config, List<SourceFileEntity> files, List<ModuleEntity> externalModules,
                   Diagnostics parseDiagnostics) {
        this(config, files, List.of(), externalModules, parseDiagnostics);
    }

    public Project(FortframeConfig config, List<SourceFileEntity> files, List<GenericSourceEntity> extraFiles,
                   List<ModuleEntity> externalModules, Diagnostics parseDiagnostics) {
        this.config = config;
        this.files = List.copyOf(files);
        this.extraFiles = List.copyOf(extraFiles);
        this.externalModules = List.copyOf(externalModules);
        this.parseDiagnostics = parseDiagnostics;
        for (SourceFileEntity file : this.files) {
            for (FortranEntity entity : EntityTree.flatten(file)) {
                entities.add(entity);
                register(entity);
            }
        }
    }

    private void register(FortranEntity entity) {
        switch (entity.kind) {
            case MODULE -> modules.add((ModuleEntity) entity);
            case SUBMODULE -> submodules.add((ModuleEntity) entity);
            case PROGRAM -> programs.add((ProgramEntity) entity);
            case PROCEDURE -> {
                if (!(entity.parent instanceof InterfaceEntity)) {
                    procedures.add((ProcedureEntity) entity);
                }
            }
            case DERIVED_TYPE -> types.add((DerivedTypeEntity) entity);
            case INTERFACE -> interfaces.add((InterfaceEntity) entity);
            case ABSTRACT_INTERFACE -> abstractInterfaces.add((InterfaceEntity) entity);
            case BLOCK_DATA -> blockData.add((BlockDataEntity) entity);
            case COMMON_BLOCK -> commonBlocks
                    .computeIfAbsent(entity.getLowerName(), k -> new ArrayList<>())
                    .add((CommonBlockEntity) entity);
            default -> {
            }
        }
    }

    /** Resolves cross-references. Safe to call again; each run replaces the previous links. */
    public Diagnostics correlate() {
        correlationDiagnostics = new Correlator(config, externalModules).correlate(files);
        return correlationDiagnostics;
    }

    /** First entity named {@code name} in path and declaration order, optionally restricted to some kinds. */
    public Optional<FortranEntity> findEntity(String name, EntityKind... kinds) {
        for (FortranEntity entity : entities) {
            if (entity.nameMatches(name) && ofKind(entity, kinds)) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    private static boolean ofKind(FortranEntity entity, EntityKind... kinds) {
        if (kinds.length == 0) {
            return true;
        }
        for (EntityKind kind : kinds) {
            if (entity.kind == kind) {
                return true;
            }
        }
        return false;
    }

    public FortframeConfig getConfig() {
        return config;
    }

    public List<SourceFileEntity> getFiles() {
        return files;
    }

    /** Documentation-only files of the extra file types, in path order. */
    public List<GenericSourceEntity> getExtraFiles() {
        return extraFiles;
    }

    public List<ModuleEntity> getExternalModules() {
        return externalModules;
    }

    /** Parse diagnostics followed by those of the latest correlation. */
    public Diagnostics getDiagnostics() {
        Diagnostics all = new Diagnostics();
        all.addAll(parseDiagnostics);
        all.addAll(correlationDiagnostics);
        return all;
    }

    public List<ModuleEntity> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public List<ModuleEntity> getSubmodules() {
        return Collections.unmodifiableList(submodules);
    }

    public List<ProgramEntity> getPrograms() {
        return Collections.unmodifiableList(programs);
    }

    /** Procedures with a body: external, module, internal and separate module procedures. */
    public List<ProcedureEntity> getProcedures() {
        return Collections.unmodifiableList(procedures);
    }

    public List<DerivedTypeEntity> getTypes() {
        return Collections.unmodifiableList(types);
    }

    public List<InterfaceEntity> getInterfaces() {
        return Collections.unmodifiableList(interfaces);
    }

    public List<InterfaceEntity> getAbstractInterfaces() {
        return Collections.unmodifiableList(abstractInterfaces);
    }

    public List<BlockDataEntity> getBlockData() {
        return Collections.unmodifiableList(blockData);
    }

    /** Common blocks grouped by lower-cased name; blank common is {@code //}. */
    public Map<String, List<CommonBlockEntity>> getCommonBlocks() {
        return Collections.unmodifiableMap(commonBlocks);
    }
}
