package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the names recorded by the parser into links between entities once every file is parsed.
 * <p>
 * Every reference field is recomputed from the names on each run and assigned, never appended to,
 * so correlating an unchanged project again yields the same links. Unresolved names become
 * unresolved {@link EntityRef}s; with warnings enabled each distinct one is also reported.
 */
public class Correlator {
    private static final Logger logger = LoggerFactory.getLogger(Correlator.class);

    private static final Set<String> INTRINSIC_TYPES = Set.of(
            "integer", "real", "complex", "logical", "character", "double", "*");

    private final FortframeConfig config;
    private final List<Map<String, ModuleEntity>> fallbackModules;

    public Correlator(FortframeConfig config, List<ModuleEntity> externalModules) {
        this.config = config;
        Map<String, ModuleEntity> external = new LinkedHashMap<>();
        for (ModuleEntity module : externalModules) {
            external.putIfAbsent(module.getLowerName(), module);
        }
        this.fallbackModules = List.of(
                IntrinsicModules.intrinsic(),
                IntrinsicModules.placeholders(config.getExtraMods()),
                external);
    }

    /**
     * Correlates the given files, which must be in project order.
     *
     * @return the unresolved-reference diagnostics of this run
     */
    public Diagnostics correlate(List<SourceFileEntity> files) {
        long start = System.nanoTime();
        Pass pass = new Pass(new ScopeResolver(files, fallbackModules));
        List<FortranEntity> all = new ArrayList<>();
        files.forEach(file -> all.addAll(EntityTree.flatten(file)));

        pass.resolveModules(all);
        pass.resolveTypes(all);
        pass.resolveVariables(all);
        pass.resolveProcedures(all);
        pass.resolveCalls(all);
        for (SourceFileEntity file : files) {
            resolveDisplay(file, config.getDisplay(), config.isProcInternals());
        }
        logger.debug("Correlated {} entities in {} ms", all.size(), (System.nanoTime() - start) / 1_000_000);
        return pass.diagnostics;
    }

    private static void resolveDisplay(FortranEntity entity, List<String> inherited, boolean inheritedInternals) {
        List<String> own = entity.metadata.display;
        List<String> effective = own == null ? inherited : own.contains("none") ? List.of() : own;
        entity.effectiveDisplay = effective;
        boolean internals = entity.metadata.procInternals != null ? entity.metadata.procInternals : inheritedInternals;
        boolean hideLocals = entity.kind == EntityKind.PROCEDURE && !internals;
        for (FortranEntity member : entity.ownedMembers()) {
            boolean local = hideLocals && entity.children.contains(member);
            member.visible = !local && effective.contains(member.permission.getKeyword());
            resolveDisplay(member, effective, internals);
        }
    }

    /** State of one correlation run. */
    private final class Pass {
        final ScopeResolver scopes;
        final Diagnostics diagnostics = new Diagnostics();
        final Set<String> reported = new HashSet<>();

        Pass(ScopeResolver scopes) {
            this.scopes = scopes;
        }

        // ---- phase 1: modules ----

        void resolveModules(List<FortranEntity> all) {
            for (FortranEntity entity : all) {
                if (!(entity instanceof ScopingUnit unit)) {
                    continue;
                }
                for (UseStatement use : unit.uses) {
                    Optional<ModuleEntity> module = scopes.module(use.moduleName);
                    if (module.isEmpty() && !use.intrinsic) {
                        unresolved(unit, use.moduleName, "module");
                    }
                    use.module = new EntityRef(use.moduleName, module.orElse(null));
                }
                if (unit instanceof ModuleEntity submodule && submodule.isSubmodule()) {
                    Optional<ModuleEntity> ancestor = scopes.module(submodule.ancestorModuleName);
                    if (ancestor.isEmpty()) {
                        unresolved(submodule, submodule.ancestorModuleName, "ancestor module");
                    }
                    submodule.ancestorModule = new EntityRef(submodule.ancestorModuleName, ancestor.orElse(null));
                    if (submodule.parentSubmoduleName != null) {
                        Optional<ModuleEntity> parent = scopes.submodule(submodule.parentSubmoduleName);
                        if (parent.isEmpty()) {
                            unresolved(submodule, submodule.parentSubmoduleName, "parent submodule");
                        }
                        submodule.parentSubmodule = new EntityRef(submodule.parentSubmoduleName, parent.orElse(null));
                    } else {
                        submodule.parentSubmodule = null;
                    }
                }
            }
        }

        // ---- phase 2: types ----

        void resolveTypes(List<FortranEntity> all) {
            List<DerivedTypeEntity> types = new ArrayList<>();
            for (FortranEntity entity : all) {
                if (entity instanceof DerivedTypeEntity type) {
                    types.add(type);
                    type.extendsType = type.extendsName == null ? null
                            : link(type, type.extendsName, "parent type", EntityKind.DERIVED_TYPE);
                    FortranEntity constructor = scopes.scopeOf(type.parent)
                            .find(type.name, EntityKind.INTERFACE, EntityKind.PROCEDURE);
                    type.constructor = constructor == null ? null : EntityRef.to(constructor);
                }
            }
            Set<DerivedTypeEntity> done = Collections.newSetFromMap(new IdentityHashMap<>());
            for (DerivedTypeEntity type : types) {
                inherit(type, done, Collections.newSetFromMap(new IdentityHashMap<>()));
            }
        }

        private void inherit(DerivedTypeEntity type, Set<DerivedTypeEntity> done, Set<DerivedTypeEntity> visiting) {
            if (done.contains(type)) {
                return;
            }
            if (!visiting.add(type)) {
                diagnostics.warn(type.sourceFile, type.lineStart, DiagnosticKind.STRUCTURAL,
                        "cyclic extends chain through type " + type.name);
                logger.warn("Cyclic extends chain through type {} in {}", type.name, type.sourceFile);
                return;
            }
            List<EntityRef> components = new ArrayList<>();
            List<EntityRef> bindings = new ArrayList<>();
            DerivedTypeEntity parent = type.getParentType();
            if (parent != null) {
                inherit(parent, done, visiting);
                for (VariableEntity component : parent.getComponents()) {
                    if (component.permission.isExported()) {
                        components.add(EntityRef.to(component));
                    }
                }
                components.addAll(parent.inheritedComponents);
                Set<String> overridden = new HashSet<>();
                type.getBindings().forEach(b -> overridden.add(b.getLowerName()));
                for (BoundProcedureEntity binding : parent.getBindings()) {
                    if (binding.permission.isExported() && overridden.add(binding.getLowerName())) {
                        bindings.add(EntityRef.to(binding));
                    }
                }
                for (EntityRef inheritedBinding : parent.inheritedBindings) {
                    if (overridden.add(inheritedBinding.target.getLowerName())) {
                        bindings.add(inheritedBinding);
                    }
                }
            }
            type.inheritedComponents = components;
            type.inheritedBindings = bindings;
            visiting.remove(type);
            done.add(type);
        }

        // ---- variables, common blocks and namelists ----

        void resolveVariables(List<FortranEntity> all) {
            for (FortranEntity entity : all) {
                if (entity instanceof VariableEntity variable) {
                    variable.prototype = prototype(variable);
                } else if (entity instanceof CommonBlockEntity common) {
                    common.members = members(common, common.memberNames);
                } else if (entity instanceof NamelistEntity namelist) {
                    namelist.members = members(namelist, namelist.memberNames);
                }
            }
        }

        private EntityRef prototype(VariableEntity variable) {
            String proto = variable.protoName;
            if (proto == null || INTRINSIC_TYPES.contains(proto.toLowerCase(Locale.ROOT).replaceAll("[\\s(].*$", ""))) {
                return null;
            }
            if ("procedure".equals(variable.vartype)) {
                return link(variable, proto, "interface",
                        EntityKind.ABSTRACT_INTERFACE, EntityKind.INTERFACE, EntityKind.PROCEDURE);
            }
            return link(variable, proto, "type", EntityKind.DERIVED_TYPE);
        }

        private List<EntityRef> members(FortranEntity owner, List<String> names) {
            List<EntityRef> members = new ArrayList<>();
            for (String name : names) {
                members.add(link(owner, name, "variable", EntityKind.VARIABLE));
            }
            return members;
        }

        // ---- phase 3: bindings and interfaces ----

        void resolveProcedures(List<FortranEntity> all) {
            for (FortranEntity entity : all) {
                if (entity instanceof BoundProcedureEntity binding && binding.parent instanceof DerivedTypeEntity type) {
                    resolveBinding(type, binding);
                } else if (entity instanceof InterfaceEntity block && block.isGeneric()) {
                    List<EntityRef> procedures = new ArrayList<>();
                    for (String name : block.moduleProcedureNames) {
                        procedures.add(link(block, name, "module procedure", EntityKind.PROCEDURE));
                    }
                    block.moduleProcedures = procedures;
                } else if (entity instanceof ProcedureEntity procedure) {
                    procedure.moduleInterface = separateInterface(procedure);
                }
            }
        }

        private void resolveBinding(DerivedTypeEntity type, BoundProcedureEntity binding) {
            binding.prototype = binding.prototypeName == null ? null
                    : link(type, binding.prototypeName, "interface",
                    EntityKind.ABSTRACT_INTERFACE, EntityKind.INTERFACE, EntityKind.PROCEDURE);
            List<EntityRef> targets = new ArrayList<>();
            for (String name : binding.bindingNames) {
                switch (binding.bindingKind) {
                    case GENERIC -> {
                        BoundProcedureEntity sibling = findBinding(type, name, binding);
                        targets.add(sibling != null ? EntityRef.to(sibling)
                                : link(type, name, "procedure", EntityKind.PROCEDURE, EntityKind.INTERFACE));
                    }
                    case SPECIFIC -> targets.add(binding.deferred ? EntityRef.unresolved(name)
                            : link(type, name, "procedure", EntityKind.PROCEDURE, EntityKind.INTERFACE));
                    case FINAL -> targets.add(link(type, name, "final procedure", EntityKind.PROCEDURE));
                }
            }
            binding.bindings = targets;
        }

        private EntityRef separateInterface(ProcedureEntity procedure) {
            if (!procedure.isSeparateModuleProcedure() || !(procedure.parent instanceof ModuleEntity owner)) {
                return null;
            }
            Set<ModuleEntity> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            ModuleEntity current = owner;
            while (current != null && seen.add(current)) {
                for (InterfaceEntity block : current.childrenOf(InterfaceEntity.class)) {
                    for (ProcedureEntity declared : block.getProcedures()) {
                        if (declared.isSeparateModuleProcedure() && declared.nameMatches(procedure.name)) {
                            return EntityRef.to(block);
                        }
                    }
                }
                current = enclosingModule(current);
            }
            unresolved(procedure, procedure.name, "separate module procedure interface");
            return EntityRef.unresolved(procedure.name);
        }

        private ModuleEntity enclosingModule(ModuleEntity module) {
            if (!module.isSubmodule()) {
                return null;
            }
            EntityRef next = module.parentSubmodule != null ? module.parentSubmodule : module.ancestorModule;
            return next != null && next.target instanceof ModuleEntity target ? target : null;
        }

        // ---- phase 4: calls ----

        void resolveCalls(List<FortranEntity> all) {
            for (FortranEntity entity : all) {
                if (!(entity instanceof ScopingUnit unit)) {
                    continue;
                }
                Scope scope = scopes.scopeFor(unit);
                List<EntityRef> calls = new ArrayList<>();
                for (List<String> chain : unit.callChains) {
                    EntityRef call = chain.size() == 1 ? resolveCall(unit, scope, chain.get(0))
                            : resolveChain(unit, scope, chain);
                    if (call != null && !calls.contains(call)) {
                        calls.add(call);
                    }
                }
                unit.calls = calls;
            }
        }

        private EntityRef resolveCall(ScopingUnit unit, Scope scope, String name) {
            List<FortranEntity> candidates = scope.lookup(name);
            if (!candidates.isEmpty()) {
                for (FortranEntity candidate : candidates) {
                    if (candidate.kind == EntityKind.PROCEDURE || candidate.kind == EntityKind.INTERFACE) {
                        return EntityRef.to(candidate);
                    }
                }
                // array element or structure constructor
                return null;
            }
            if (IntrinsicProcedures.contains(name)) {
                return null;
            }
            unresolved(unit, name, "procedure");
            return EntityRef.unresolved(name);
        }

        private EntityRef resolveChain(ScopingUnit unit, Scope scope, List<String> chain) {
            String written = String.join("%", chain);
            DerivedTypeEntity type = typeOf(scope.find(chain.get(0), EntityKind.VARIABLE));
            for (int i = 1; i < chain.size() && type != null; i++) {
                String part = chain.get(i);
                if (i == chain.size() - 1) {
                    BoundProcedureEntity binding = findBinding(type, part, null);
                    if (binding != null) {
                        return EntityRef.to(binding);
                    }
                    if (findComponent(type, part) != null) {
                        return null;
                    }
                    break;
                }
                type = typeOf(findComponent(type, part));
            }
            unresolved(unit, written, "type-bound procedure");
            return EntityRef.unresolved(written);
        }

        // ---- helpers ----

        private EntityRef link(FortranEntity from, String name, String what, EntityKind... kinds) {
            FortranEntity target = scopes.scopeOf(from).find(name, kinds);
            if (target == null) {
                unresolved(from, name, what);
            }
            return new EntityRef(name, target);
        }

        private void unresolved(FortranEntity from, String name, String what) {
            if (!config.isWarn()) {
                return;
            }
            FortranEntity container = from instanceof ScopingUnit ? from : from.enclosing(
                    EntityKind.MODULE, EntityKind.SUBMODULE, EntityKind.PROGRAM, EntityKind.PROCEDURE,
                    EntityKind.BLOCK_DATA);
            String owner = container == null ? from.sourceFile : container.toString();
            if (!reported.add(owner + "|" + what + "|" + name.toLowerCase(Locale.ROOT))) {
                return;
            }
            String message = "unresolved " + what + " '" + name + "' in " + owner;
            diagnostics.warn(from.sourceFile, from.lineStart, DiagnosticKind.UNRESOLVED_REFERENCE, message);
            logger.warn("{}:{}: {}", from.sourceFile, from.lineStart, message);
        }
    }

    private static DerivedTypeEntity typeOf(FortranEntity entity) {
        if (entity instanceof VariableEntity variable && variable.prototype != null
                && variable.prototype.target instanceof DerivedTypeEntity type) {
            return type;
        }
        return null;
    }

    private static BoundProcedureEntity findBinding(DerivedTypeEntity type, String name, BoundProcedureEntity except) {
        for (BoundProcedureEntity binding : type.getBindings()) {
            if (binding != except && binding.nameMatches(name)) {
                return binding;
            }
        }
        for (EntityRef inherited : type.inheritedBindings) {
            if (inherited.target instanceof BoundProcedureEntity binding && binding.nameMatches(name)) {
                return binding;
            }
        }
        return null;
    }

    private static VariableEntity findComponent(DerivedTypeEntity type, String name) {
        for (VariableEntity component : type.getComponents()) {
            if (component.nameMatches(name)) {
                return component;
            }
        }
        for (EntityRef inherited : type.inheritedComponents) {
            if (inherited.target instanceof VariableEntity component && component.nameMatches(name)) {
                return component;
            }
        }
        return null;
    }
}
