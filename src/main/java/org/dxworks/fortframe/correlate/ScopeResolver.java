package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds and caches the {@link Scope} of every scoping unit of a project, and the export lists of its
 * modules. One instance serves a single correlation run.
 */
class ScopeResolver {
    private static final Logger logger = LoggerFactory.getLogger(ScopeResolver.class);

    private final Map<String, ModuleEntity> projectModules = new LinkedHashMap<>();
    private final Map<String, ModuleEntity> submodules = new LinkedHashMap<>();
    private final List<Map<String, ModuleEntity>> fallbackModules;
    private final Scope global;

    private final Map<FortranEntity, Scope> scopes = new IdentityHashMap<>();
    private final Set<FortranEntity> building = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<ModuleEntity, Map<String, List<FortranEntity>>> exports = new IdentityHashMap<>();
    private final Set<ModuleEntity> exporting = Collections.newSetFromMap(new IdentityHashMap<>());

    ScopeResolver(List<SourceFileEntity> files, List<Map<String, ModuleEntity>> fallbackModules) {
        this.fallbackModules = fallbackModules;
        Map<String, List<FortranEntity>> externalProcedures = Scope.names();
        for (SourceFileEntity file : files) {
            for (FortranEntity unit : file.children) {
                if (unit instanceof ModuleEntity module) {
                    Map<String, ModuleEntity> index = module.isSubmodule() ? submodules : projectModules;
                    ModuleEntity previous = index.putIfAbsent(module.getLowerName(), module);
                    if (previous != null && previous != module) {
                        logger.debug("{} {} in {} is shadowed by the one in {}", module.kind.getLabel(),
                                module.name, module.sourceFile, previous.sourceFile);
                    }
                } else if (unit.kind == EntityKind.PROCEDURE) {
                    Scope.declare(externalProcedures, unit.name, unit);
                }
            }
        }
        this.global = new Scope(externalProcedures, Map.of(), null);
    }

    /** Project module first, then intrinsic, extra and external placeholder modules. */
    Optional<ModuleEntity> module(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        ModuleEntity module = projectModules.get(key);
        if (module != null) {
            return Optional.of(module);
        }
        for (Map<String, ModuleEntity> fallback : fallbackModules) {
            module = fallback.get(key);
            if (module != null) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    Optional<ModuleEntity> submodule(String name) {
        return Optional.ofNullable(submodules.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Scope of the nearest scoping unit enclosing (or equal to) {@code entity}. */
    Scope scopeOf(FortranEntity entity) {
        for (FortranEntity current = entity; current != null; current = current.parent) {
            if (current instanceof ScopingUnit unit) {
                return scopeFor(unit);
            }
        }
        return global;
    }

    Scope scopeFor(ScopingUnit unit) {
        Scope cached = scopes.get(unit);
        if (cached != null) {
            return cached;
        }
        if (!building.add(unit)) {
            logger.debug("Cyclic host association through {}", unit);
            return Scope.EMPTY;
        }
        try {
            Map<String, List<FortranEntity>> local = Scope.names();
            for (FortranEntity member : declaredMembers(unit)) {
                Scope.declare(local, member.name, member);
            }
            Map<String, List<FortranEntity>> imported = Scope.names();
            for (UseStatement use : unit.uses) {
                module(use.moduleName)
                        .filter(module -> module != unit)
                        .ifPresent(module -> importInto(imported, use, exportsOf(module)));
            }
            Scope scope = new Scope(local, imported, host(unit));
            scopes.put(unit, scope);
            return scope;
        } finally {
            building.remove(unit);
        }
    }

    private Scope host(ScopingUnit unit) {
        if (unit instanceof ModuleEntity module && module.isSubmodule()) {
            Optional<ModuleEntity> parent = module.parentSubmoduleName != null
                    ? submodule(module.parentSubmoduleName)
                    : module(module.ancestorModuleName);
            return parent.map(this::scopeFor).orElse(global);
        }
        for (FortranEntity current = unit.parent; current != null; current = current.parent) {
            if (current instanceof ScopingUnit enclosing) {
                return scopeFor(enclosing);
            }
        }
        return global;
    }

    /** Names a module makes available to its users, keyed by lower-cased name. */
    Map<String, List<FortranEntity>> exportsOf(ModuleEntity module) {
        Map<String, List<FortranEntity>> cached = exports.get(module);
        if (cached != null) {
            return cached;
        }
        if (!exporting.add(module)) {
            logger.debug("Cyclic use association through module {}", module.name);
            return Map.of();
        }
        try {
            Map<String, List<FortranEntity>> names = Scope.names();
            for (FortranEntity member : declaredMembers(module)) {
                if (member.permission.isExported()) {
                    Scope.declare(names, member.name, member);
                }
            }
            for (UseStatement use : module.uses) {
                Optional<ModuleEntity> used = module(use.moduleName).filter(m -> m != module);
                if (used.isEmpty()) {
                    continue;
                }
                Map<String, List<FortranEntity>> imported = Scope.names();
                importInto(imported, use, exportsOf(used.get()));
                imported.forEach((name, entities) -> {
                    if (reexports(module, name)) {
                        entities.forEach(entity -> Scope.declare(names, name, entity));
                    }
                });
            }
            exports.put(module, names);
            return names;
        } finally {
            exporting.remove(module);
        }
    }

    private static boolean reexports(ModuleEntity module, String name) {
        if (module.privateNames.contains(name)) {
            return false;
        }
        return module.defaultAccess.isExported() || module.publicNames.contains(name);
    }

    private static void importInto(Map<String, List<FortranEntity>> target, UseStatement use,
                                   Map<String, List<FortranEntity>> exported) {
        exported.forEach((name, entities) -> {
            for (String localName : use.localNamesFor(name)) {
                entities.forEach(entity -> Scope.declare(target, localName, entity));
            }
        });
    }

    /** Entities a scoping unit declares itself: owned members, enumerators and generic interface bodies. */
    static List<FortranEntity> declaredMembers(FortranEntity unit) {
        List<FortranEntity> members = new ArrayList<>();
        for (FortranEntity member : unit.ownedMembers()) {
            members.add(member);
            if (member.kind == EntityKind.ENUM) {
                members.addAll(member.children);
            } else if (member instanceof InterfaceEntity block && block.isGeneric()) {
                members.addAll(block.getProcedures());
            }
        }
        return members;
    }
}
