package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Completes a container once its {@code end} has been read. Arguments and function results are
 * typed, standalone attribute statements are applied, default access is filled in and every
 * documentation fragment list is turned into documentation and metadata.
 */
class EntitySealer {
    private static final Pattern TYPE_KEYWORD = Pattern.compile(
            "^(double\\s*precision|double\\s*complex|\\w+)(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTENT = Pattern.compile("^intent\\((in|out|inout)\\)$");
    private static final Pattern DIMENSION = Pattern.compile("^dimension(\\(.*\\))$");

    private final String file;
    private final Diagnostics diagnostics;
    private final DocumentationFinisher finisher;

    EntitySealer(String file, Diagnostics diagnostics, DocumentationFinisher finisher) {
        this.file = file;
        this.diagnostics = diagnostics;
        this.finisher = finisher;
    }

    void seal(FortranEntity entity) {
        switch (entity.kind) {
            case PROCEDURE -> sealProcedure((ProcedureEntity) entity);
            case DERIVED_TYPE -> sealType((DerivedTypeEntity) entity);
            case ENUM -> numberEnumerators((EnumEntity) entity);
            default -> {
            }
        }
        if (entity instanceof ScopingUnit unit) {
            applyDefaultAccess(unit);
            applyAttributeStatements(unit);
            if (unit.kind == EntityKind.MODULE || unit.kind == EntityKind.SUBMODULE) {
                collectPublicNames(unit);
            }
            propagateInterfaceAccess(unit);
        }
        for (FortranEntity member : entity.ownedMembers()) {
            if (!member.kind.isContainer()) {
                finisher.finish(member);
            }
        }
        finisher.finish(entity);
    }

    // ---- procedures ----

    private void sealProcedure(ProcedureEntity procedure) {
        procedure.arguments.clear();
        for (String argumentName : procedure.argumentNames) {
            if (argumentName.equals("*")) {
                continue;
            }
            procedure.addArgument(argument(procedure, argumentName));
        }
        if (procedure.isFunction()) {
            String resultName = procedure.resultName != null ? procedure.resultName : procedure.name;
            VariableEntity declared = declaredVariable(procedure, resultName);
            if (declared != null) {
                procedure.removeChild(declared);
                procedure.setReturnVariable(declared);
            } else {
                procedure.setReturnVariable(undeclaredResult(procedure, resultName));
            }
        }
    }

    private VariableEntity argument(ProcedureEntity procedure, String name) {
        VariableEntity declared = declaredVariable(procedure, name);
        if (declared != null) {
            procedure.removeChild(declared);
            return declared;
        }
        for (InterfaceEntity dummyInterface : procedure.childrenOf(InterfaceEntity.class)) {
            if (!dummyInterface.isGeneric() && dummyInterface.nameMatches(name)) {
                VariableEntity dummy = new VariableEntity(name);
                dummy.vartype = "procedure";
                dummy.protoName = dummyInterface.name;
                dummy.prototype = EntityRef.to(dummyInterface);
                dummy.documentation = dummyInterface.documentation;
                dummy.sourceFile = file;
                dummy.lineStart = dummyInterface.lineStart;
                dummy.lineEnd = dummyInterface.lineEnd;
                return dummy;
            }
        }
        VariableEntity implicit = new VariableEntity(name);
        implicit.vartype = implicitType(name);
        implicit.sourceFile = file;
        implicit.lineStart = procedure.lineStart;
        implicit.lineEnd = procedure.lineStart;
        return implicit;
    }

    private VariableEntity undeclaredResult(ProcedureEntity function, String name) {
        VariableEntity result = new VariableEntity(name);
        result.sourceFile = file;
        result.lineStart = function.lineStart;
        result.lineEnd = function.lineStart;
        Matcher m = function.headerType == null ? null : TYPE_KEYWORD.matcher(function.headerType.trim());
        if (m != null && m.matches()) {
            TypeSpec spec = TypeSpec.parse(m.group(1), m.group(2));
            result.vartype = spec.vartype;
            result.kindSpec = spec.kind;
            result.length = spec.length;
            result.protoName = spec.proto;
        } else {
            result.vartype = implicitType(name);
        }
        return result;
    }

    private static VariableEntity declaredVariable(FortranEntity scope, String name) {
        for (VariableEntity variable : scope.childrenOf(VariableEntity.class)) {
            if (variable.nameMatches(name)) {
                return variable;
            }
        }
        return null;
    }

    static String implicitType(String name) {
        char first = Character.toLowerCase(name.charAt(0));
        return first >= 'i' && first <= 'n' ? "integer" : "real";
    }

    // ---- types and enums ----

    private static void sealType(DerivedTypeEntity type) {
        for (FortranEntity member : type.children) {
            if (member.permissionExplicit) {
                continue;
            }
            member.permission = member.kind == EntityKind.BOUND_PROCEDURE ? type.bindingAccess : type.componentAccess;
        }
    }

    private void numberEnumerators(EnumEntity enumeration) {
        int next = 0;
        boolean numbering = true;
        for (VariableEntity enumerator : enumeration.childrenOf(VariableEntity.class)) {
            enumerator.parameter = true;
            if (enumerator.initial != null) {
                try {
                    next = Integer.parseInt(enumerator.initial.trim());
                    numbering = true;
                } catch (NumberFormatException e) {
                    if (numbering) {
                        diagnostics.warn(file, enumerator.lineStart, DiagnosticKind.METADATA,
                                "cannot number enumerators after non-integer value '" + enumerator.initial
                                        + "' of " + enumerator.name);
                    }
                    numbering = false;
                    continue;
                }
            } else if (numbering) {
                enumerator.initial = String.valueOf(next);
            } else {
                continue;
            }
            next++;
        }
    }

    // ---- access ----

    private static List<FortranEntity> declaredMembers(ScopingUnit unit) {
        List<FortranEntity> members = new ArrayList<>();
        for (FortranEntity member : unit.ownedMembers()) {
            members.add(member);
            if (member.kind == EntityKind.ENUM) {
                members.addAll(member.children);
            }
        }
        return members;
    }

    private static void applyDefaultAccess(ScopingUnit unit) {
        for (FortranEntity member : declaredMembers(unit)) {
            if (!member.permissionExplicit) {
                member.permission = unit.defaultAccess;
            }
        }
    }

    private static void applyAttributeStatements(ScopingUnit unit) {
        if (unit.pendingAttributes.isEmpty() && unit.pendingParameters.isEmpty()) {
            return;
        }
        Set<String> matched = new HashSet<>();
        for (FortranEntity member : declaredMembers(unit)) {
            String key = accessKey(member.name);
            List<String> attributes = unit.pendingAttributes.get(key);
            if (attributes != null) {
                matched.add(key);
                attributes.forEach(attribute -> applyAttribute(member, attribute));
            }
            String parameterValue = unit.pendingParameters.get(key);
            if (parameterValue != null && member instanceof VariableEntity variable) {
                variable.parameter = true;
                variable.initial = parameterValue;
            }
        }
        for (Map.Entry<String, List<String>> entry : unit.pendingAttributes.entrySet()) {
            if (matched.contains(entry.getKey())) {
                continue;
            }
            for (String attribute : entry.getValue()) {
                Optional<Permission> permission = Permission.fromKeyword(attribute);
                if (permission.isEmpty()) {
                    continue;
                }
                if (permission.get().isExported()) {
                    unit.publicNames.add(entry.getKey());
                    unit.privateNames.remove(entry.getKey());
                } else {
                    unit.privateNames.add(entry.getKey());
                    unit.publicNames.remove(entry.getKey());
                }
            }
        }
        unit.pendingAttributes.clear();
        unit.pendingParameters.clear();
    }

    private static void applyAttribute(FortranEntity member, String attribute) {
        Optional<Permission> permission = Permission.fromKeyword(attribute);
        if (permission.isPresent()) {
            member.setExplicitPermission(permission.get());
            return;
        }
        if (!(member instanceof VariableEntity variable)) {
            return;
        }
        Matcher intent = INTENT.matcher(attribute);
        Matcher dimension = DIMENSION.matcher(attribute);
        if (attribute.equals("parameter")) {
            variable.parameter = true;
        } else if (attribute.equals("optional")) {
            variable.optional = true;
        } else if (attribute.equals("value")) {
            variable.value = true;
        } else if (intent.matches()) {
            variable.intent = intent.group(1);
        } else if (dimension.matches()) {
            variable.dimension = dimension.group(1);
        } else if (!attribute.equals("dimension") && !variable.hasAttribute(attribute)) {
            variable.attributes.add(attribute);
        }
    }

    private static void collectPublicNames(ScopingUnit module) {
        for (FortranEntity member : declaredMembers(module)) {
            if (member.permission.isExported() && member.name != null && !member.name.isEmpty()) {
                module.publicNames.add(accessKey(member.name));
            }
        }
    }

    private static void propagateInterfaceAccess(ScopingUnit unit) {
        for (InterfaceEntity block : unit.childrenOf(InterfaceEntity.class)) {
            for (ProcedureEntity procedure : block.getProcedures()) {
                if (!procedure.permissionExplicit) {
                    procedure.permission = block.permission;
                }
            }
        }
    }

    /** Lower-cased name with blanks removed, so {@code operator (+)} and {@code operator(+)} agree. */
    static String accessKey(String name) {
        return name == null ? "" : name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
