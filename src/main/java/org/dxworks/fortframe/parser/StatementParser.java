package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.diagnostics.StructuralParseException;
import org.dxworks.fortframe.model.*;
import org.dxworks.fortframe.reader.DocPlacement;
import org.dxworks.fortframe.reader.FortranTextUtils;
import org.dxworks.fortframe.reader.LineCursor;
import org.dxworks.fortframe.reader.LogicalLine;
import org.dxworks.fortframe.reader.MaskedStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser building the entity tree of one source file from its logical lines.
 * <p>
 * Each container is parsed by {@link #parseBody(Frame)} until its matching {@code end}; nested
 * containers recurse, bounded by the configured nesting depth. Documentation travels with the
 * statement it belongs to: preceding documentation goes to the first entity a statement creates,
 * following documentation to the last one, and documentation-only lines to the entity declared just
 * before them or, when there is none, to the enclosing container.
 */
public class StatementParser {
    private static final Logger logger = LoggerFactory.getLogger(StatementParser.class);

    private static final Pattern LABEL = Pattern.compile("^\\d{1,5}\\s+");
    private static final Pattern GENERIC_SPEC = Pattern.compile("^(operator|assignment)\\s*\\(.*\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NAME = Pattern.compile("^(\\w+)");
    private static final Pattern SIMPLE_CHAIN = Pattern.compile("^\\w+(?:\\s*%\\s*\\w+)*$");
    private static final Pattern COMMON_GROUP = Pattern.compile("/\\s*(\\w*)\\s*/([^/]*)");
    private static final Pattern EXTENDS = Pattern.compile("^extends\\s*\\(\\s*(\\w+)\\s*\\)$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> PROCEDURE_PREFIXES = Set.of(
            "pure", "impure", "elemental", "recursive", "non_recursive", "module");
    private static final Set<StatementKind> CONTAINER_STARTS = EnumSet.of(
            StatementKind.MODULE, StatementKind.SUBMODULE, StatementKind.PROGRAM, StatementKind.SUBROUTINE,
            StatementKind.FUNCTION, StatementKind.BLOCK_DATA, StatementKind.DERIVED_TYPE,
            StatementKind.INTERFACE, StatementKind.ENUM);
    private static final Set<StatementKind> BLOCK_LOCAL = EnumSet.of(
            StatementKind.VARIABLE, StatementKind.USE, StatementKind.PARAMETER, StatementKind.COMMON,
            StatementKind.NAMELIST);

    private final LineCursor cursor;
    private final String file;
    private final FortframeConfig config;
    private final Diagnostics diagnostics;
    private final EntitySealer sealer;
    private final Pattern variablePattern;
    private int lastLine;

    public StatementParser(LineCursor cursor, String file, FortframeConfig config, Diagnostics diagnostics) {
        this.cursor = cursor;
        this.file = file;
        this.config = config;
        this.diagnostics = diagnostics;
        this.sealer = new EntitySealer(file, diagnostics, new DocumentationFinisher(file, diagnostics));
        this.variablePattern = StatementKind.variablePattern(config.getExtraVartypes());
    }

    public SourceFileEntity parse(SourceFileEntity sourceFile) {
        parseBody(new Frame(sourceFile, 0));
        sourceFile.lineEnd = lastLine;
        sealer.seal(sourceFile);
        logger.debug("Parsed {}: {} top-level entities", file, sourceFile.children.size());
        return sourceFile;
    }

    private void parseBody(Frame frame) {
        while (!cursor.atEnd()) {
            LogicalLine line = cursor.advance();
            lastLine = line.getLineNumber();
            if (line.isDocumentationOnly()) {
                attachDocumentationLine(frame, line);
                continue;
            }
            String text = LABEL.matcher(line.getText()).replaceFirst("");
            MaskedStatement masked = MaskedStatement.mask(text);
            Statement statement = classify(frame, masked.text());
            DocCarrier docs = new DocCarrier(frame.takePrecedingDocs(line),
                    line.getPlacement() == DocPlacement.FOLLOWING ? line.getDocumentation() : List.of());

            if (statement.kind == StatementKind.END) {
                if (closes(frame, statement.matcher, line, docs)) {
                    return;
                }
                frame.lastEntity = null;
                continue;
            }
            if (!ContainerGrammar.allows(frame.entity.kind, frame.inContains, statement.kind)) {
                reject(frame, statement, masked, line, docs);
                docs.applyTo(List.of(), frame.entity);
                frame.lastEntity = null;
                continue;
            }
            if (frame.blockLevel > 0 && BLOCK_LOCAL.contains(statement.kind)) {
                // block-local declarations stay out of the tree
                docs.applyTo(List.of(), frame.entity);
                frame.lastEntity = null;
                continue;
            }
            List<FortranEntity> created = dispatch(frame, statement, masked, line, docs);
            frame.lastEntity = docs.applied || created.isEmpty() ? null : created.get(created.size() - 1);
            docs.applyTo(created, frame.entity);
        }
        if (frame.entity.kind != EntityKind.SOURCE_FILE) {
            throw new StructuralParseException(file, lastLine, "file ends inside " + describe(frame.entity));
        }
    }

    private Statement classify(Frame frame, String text) {
        for (StatementKind kind : StatementKind.values()) {
            Pattern pattern = kind == StatementKind.VARIABLE ? variablePattern : kind.pattern();
            if (pattern == null) {
                continue;
            }
            Matcher m = pattern.matcher(text);
            if (m.find() && guard(frame, kind, m)) {
                return new Statement(kind, m);
            }
        }
        return new Statement(StatementKind.EXECUTABLE, null);
    }

    private static boolean guard(Frame frame, StatementKind kind, Matcher m) {
        return switch (kind) {
            case ATTRIBUTE -> frame.blockLevel == 0;
            case MODULE_PROCEDURE -> m.group(1) != null || frame.entity instanceof InterfaceEntity;
            case BOUND_PROCEDURE, FINAL -> frame.entity.kind == EntityKind.DERIVED_TYPE && frame.inContains;
            default -> true;
        };
    }

    private List<FortranEntity> dispatch(Frame frame, Statement statement, MaskedStatement masked,
                                         LogicalLine line, DocCarrier docs) {
        Matcher m = statement.matcher;
        switch (statement.kind) {
            case CONTAINS -> frame.inContains = true;
            case ACCESS_DEFAULT -> accessDefault(frame, m.group(1), line);
            case SEQUENCE -> ((DerivedTypeEntity) frame.entity).sequence = true;
            case PARAMETER -> parameters((ScopingUnit) frame.entity, m.group(1), masked);
            case ATTRIBUTE -> attribute((ScopingUnit) frame.entity, m.group(1), m.group(2), masked);
            case MODULE_PROCEDURE -> {
                if (frame.entity instanceof InterfaceEntity block) {
                    for (String name : FortranTextUtils.parenSplit(m.group(2), ',')) {
                        block.moduleProcedureNames.add(name.replace("::", "").trim());
                    }
                } else {
                    ProcedureEntity procedure = new ProcedureEntity(m.group(2).trim(), ProcedureType.MODULE_PROCEDURE);
                    procedure.attributes.add("module");
                    openContainer(frame, procedure, line, docs, true);
                }
            }
            case BLOCK_DATA, MODULE, SUBMODULE, PROGRAM, SUBROUTINE, FUNCTION, DERIVED_TYPE, ENUM ->
                    openContainer(frame, startContainer(statement, masked, line), line, docs, true);
            case INTERFACE -> openInterface(frame, m, line, docs, true);
            case BLOCK -> frame.blockLevel++;
            case ASSOCIATE -> associate(frame, m.group(1));
            case NAMELIST -> {
                return List.of(namelist(frame, m, line));
            }
            case COMMON -> {
                return common(frame, m.group(1), line);
            }
            case BOUND_PROCEDURE -> {
                return bindings(frame, m, line);
            }
            case FINAL -> {
                return finals(frame, m.group(1), line);
            }
            case VARIABLE -> {
                return declarations(frame, m, masked, line);
            }
            case USE -> use((ScopingUnit) frame.entity, m, line);
            case EXECUTABLE -> scanCalls(frame, masked.text());
            case FORMAT, IGNORED, ARITHMETIC_IF -> {
                // nothing to record
            }
            case END -> throw new IllegalStateException("end statements are handled by the caller");
        }
        return List.of();
    }

    private void reject(Frame frame, Statement statement, MaskedStatement masked, LogicalLine line, DocCarrier docs) {
        String message = statement.kind == StatementKind.EXECUTABLE
                ? "unrecognized statement in " + describe(frame.entity) + ": " + line.getText()
                : "unexpected " + statement.kind.name().toLowerCase(Locale.ROOT).replace('_', ' ')
                + " statement in " + describe(frame.entity) + (frame.inContains ? " after contains" : "");
        if (config.isStrict()) {
            throw new StructuralParseException(file, line.getLineNumber(), message);
        }
        diagnostics.warn(file, line.getLineNumber(), DiagnosticKind.UNRECOGNIZED_STATEMENT, message);
        if (statement.kind == StatementKind.INTERFACE) {
            openInterface(frame, statement.matcher, line, docs, false);
        } else if (CONTAINER_STARTS.contains(statement.kind)) {
            FortranEntity discarded = startContainer(statement, masked, line);
            discarded.parent = frame.entity;
            openContainer(frame, discarded, line, docs, false);
        }
    }

    private boolean closes(Frame frame, Matcher m, LogicalLine line, DocCarrier docs) {
        String endKind = m.group(1) == null ? null : m.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        String endName = m.group(2) == null ? null : m.group(2).trim();
        int lineNumber = line.getLineNumber();

        if ("block".equals(endKind) || "associate".equals(endKind)) {
            if ("block".equals(endKind) && frame.blockLevel > 0) {
                frame.blockLevel--;
            } else if ("associate".equals(endKind) && !frame.associations.isEmpty()) {
                frame.associations.pop();
            } else {
                throw new StructuralParseException(file, lineNumber, "`end " + endKind + "` without an open " + endKind);
            }
            docs.applyTo(List.of(), frame.entity);
            return false;
        }
        if (frame.entity.kind == EntityKind.SOURCE_FILE) {
            throw new StructuralParseException(file, lineNumber, "`end` without an open program unit");
        }
        if (endKind != null && !endKindFits(endKind, frame.entity)) {
            throw new StructuralParseException(file, lineNumber,
                    "`end " + endKind + "` cannot close " + describe(frame.entity));
        }
        if (endName != null && !sameName(frame.entity.name, endName)) {
            throw new StructuralParseException(file, lineNumber,
                    "`end " + endKind + " " + endName + "` does not match " + describe(frame.entity));
        }
        frame.entity.docFragments.addAll(frame.pendingPrecedingDocs);
        frame.pendingPrecedingDocs.clear();
        docs.applyTo(List.of(frame.entity), frame.entity);
        frame.entity.lineEnd = lineNumber;
        return true;
    }

    private static boolean endKindFits(String endKind, FortranEntity entity) {
        return switch (endKind) {
            case "module" -> entity.kind == EntityKind.MODULE;
            case "submodule" -> entity.kind == EntityKind.SUBMODULE;
            case "subroutine" -> isProcedure(entity, ProcedureType.SUBROUTINE);
            case "function" -> isProcedure(entity, ProcedureType.FUNCTION);
            case "procedure" -> isProcedure(entity, ProcedureType.MODULE_PROCEDURE);
            case "program" -> entity.kind == EntityKind.PROGRAM;
            case "type" -> entity.kind == EntityKind.DERIVED_TYPE;
            case "interface" -> entity.kind == EntityKind.INTERFACE || entity.kind == EntityKind.ABSTRACT_INTERFACE;
            case "enum" -> entity.kind == EntityKind.ENUM;
            case "blockdata" -> entity.kind == EntityKind.BLOCK_DATA;
            default -> false;
        };
    }

    private static boolean isProcedure(FortranEntity entity, ProcedureType type) {
        return entity instanceof ProcedureEntity procedure && procedure.procedureType == type;
    }

    private static boolean sameName(String name, String endName) {
        String a = name == null ? "" : name.replaceAll("\\s+", "");
        String b = endName.replaceAll("\\s+", "");
        return a.equalsIgnoreCase(b);
    }

    private void attachDocumentationLine(Frame frame, LogicalLine line) {
        if (line.getPlacement() == DocPlacement.PRECEDING) {
            frame.pendingPrecedingDocs.addAll(line.getDocumentation());
            return;
        }
        FortranEntity target = frame.lastEntity != null ? frame.lastEntity : frame.entity;
        target.docFragments.addAll(line.getDocumentation());
    }

    // ---- containers ----

    private FortranEntity startContainer(Statement statement, MaskedStatement masked, LogicalLine line) {
        Matcher m = statement.matcher;
        return switch (statement.kind) {
            case MODULE -> {
                if (m.group(1) == null) {
                    throw new StructuralParseException(file, line.getLineNumber(), "module statement without a name");
                }
                yield new ModuleEntity(m.group(1));
            }
            case SUBMODULE -> ModuleEntity.submodule(m.group(3), m.group(1), m.group(2));
            case PROGRAM -> new ProgramEntity(m.group(1) == null ? "" : m.group(1));
            case BLOCK_DATA -> new BlockDataEntity(m.group(1) == null ? "" : m.group(1));
            case SUBROUTINE -> {
                ProcedureEntity procedure = new ProcedureEntity(m.group(2), ProcedureType.SUBROUTINE);
                prefix(procedure, m.group(1));
                procedure.argumentNames = argumentNames(m.group(3));
                procedure.bindC = masked.restore(m.group(4));
                yield procedure;
            }
            case FUNCTION -> {
                ProcedureEntity procedure = new ProcedureEntity(m.group(2), ProcedureType.FUNCTION);
                prefix(procedure, m.group(1));
                procedure.argumentNames = argumentNames(m.group(3));
                procedure.resultName = m.group(4);
                procedure.bindC = masked.restore(m.group(5));
                yield procedure;
            }
            case DERIVED_TYPE -> derivedType(m);
            case ENUM -> {
                EnumEntity enumeration = new EnumEntity(m.group(2) == null ? "" : m.group(2));
                enumeration.bindC = m.group(1);
                yield enumeration;
            }
            default -> throw new IllegalArgumentException("not a container statement: " + statement.kind);
        };
    }

    private void openContainer(Frame frame, FortranEntity entity, LogicalLine line, DocCarrier docs, boolean attach) {
        entity.sourceFile = file;
        entity.lineStart = line.getLineNumber();
        if (attach) {
            frame.entity.addChild(entity);
        }
        docs.applyTo(List.of(entity), frame.entity);
        parseBody(frame.child(entity));
        sealer.seal(entity);
    }

    private void openInterface(Frame frame, Matcher m, LogicalLine line, DocCarrier docs, boolean attach) {
        boolean isAbstract = m.group(1) != null;
        String name = m.group(2);
        if (isAbstract && name != null) {
            throw new StructuralParseException(file, line.getLineNumber(), "abstract interface cannot have a name");
        }
        InterfaceType type = isAbstract ? InterfaceType.ABSTRACT
                : name != null ? InterfaceType.GENERIC : InterfaceType.SPECIFIC;
        InterfaceEntity block = new InterfaceEntity(name == null ? "" : name.trim(), type);
        block.sourceFile = file;
        block.lineStart = line.getLineNumber();
        block.parent = frame.entity;
        docs.applyTo(List.of(block), frame.entity);
        parseBody(frame.child(block));
        sealer.seal(block);
        if (!attach) {
            return;
        }
        if (type == InterfaceType.GENERIC) {
            frame.entity.addChild(block);
            return;
        }
        if (!block.moduleProcedureNames.isEmpty()) {
            diagnostics.warn(file, block.lineStart, DiagnosticKind.UNRECOGNIZED_STATEMENT,
                    "module procedure statements are only meaningful in a generic interface");
        }
        for (ProcedureEntity procedure : block.getProcedures()) {
            InterfaceEntity single = new InterfaceEntity(procedure.name, type);
            single.sourceFile = file;
            single.lineStart = procedure.lineStart;
            single.lineEnd = procedure.lineEnd;
            single.documentation = procedure.isDocumented() ? procedure.documentation : block.documentation;
            single.metadata = procedure.metadata.isEmpty() ? block.metadata : procedure.metadata;
            single.addChild(procedure);
            frame.entity.addChild(single);
        }
    }

    private DerivedTypeEntity derivedType(Matcher m) {
        DerivedTypeEntity type = new DerivedTypeEntity(m.group(2));
        if (m.group(1) != null) {
            for (String attribute : FortranTextUtils.parenSplit(m.group(1).replaceFirst("^\\s*,", ""), ',')) {
                String lower = attribute.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
                Matcher extendsMatcher = EXTENDS.matcher(attribute.trim());
                Optional<Permission> permission = Permission.fromKeyword(lower);
                if (extendsMatcher.matches()) {
                    type.extendsName = extendsMatcher.group(1);
                } else if (permission.isPresent()) {
                    type.setExplicitPermission(permission.get());
                } else if (!lower.isEmpty()) {
                    type.attributes.add(lower);
                }
            }
        }
        if (m.group(3) != null) {
            type.typeParameters = FortranTextUtils.parenSplit(FortranTextUtils.unwrapParens(m.group(3)), ',');
        }
        return type;
    }

    private static void prefix(ProcedureEntity procedure, String prefix) {
        if (prefix == null) {
            return;
        }
        List<String> typeWords = new ArrayList<>();
        for (String word : FortranTextUtils.parenSplit(prefix.trim(), ' ')) {
            if (word.isEmpty()) {
                continue;
            }
            String lower = word.toLowerCase(Locale.ROOT);
            if (PROCEDURE_PREFIXES.contains(lower)) {
                procedure.attributes.add(lower);
            } else {
                typeWords.add(word);
            }
        }
        if (!typeWords.isEmpty()) {
            if (procedure.isFunction()) {
                procedure.headerType = String.join(" ", typeWords);
            } else {
                typeWords.forEach(w -> procedure.attributes.add(w.toLowerCase(Locale.ROOT)));
            }
        }
    }

    private static List<String> argumentNames(String group) {
        if (group == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(FortranTextUtils.parenSplit(FortranTextUtils.unwrapParens(group), ','));
    }

    // ---- specification statements ----

    private void accessDefault(Frame frame, String keyword, LogicalLine line) {
        Permission permission = Permission.fromKeyword(keyword).orElseThrow();
        if (frame.entity instanceof DerivedTypeEntity type) {
            if (frame.inContains) {
                type.bindingAccess = permission;
            } else {
                type.componentAccess = permission;
            }
        } else if (frame.entity instanceof ScopingUnit unit) {
            if (permission == Permission.PROTECTED) {
                diagnostics.warn(file, line.getLineNumber(), DiagnosticKind.UNRECOGNIZED_STATEMENT,
                        "protected cannot be a default access in " + describe(unit));
                return;
            }
            unit.defaultAccess = permission;
        }
    }

    private static void parameters(ScopingUnit unit, String assignments, MaskedStatement masked) {
        for (String assignment : FortranTextUtils.parenSplit(assignments, ',')) {
            int eq = assignment.indexOf('=');
            if (eq > 0) {
                unit.pendingParameters.put(assignment.substring(0, eq).trim().toLowerCase(Locale.ROOT),
                        masked.restore(assignment.substring(eq + 1).trim()));
            }
        }
    }

    private static void attribute(ScopingUnit unit, String attribute, String names, MaskedStatement masked) {
        String attr = attribute.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        if (attr.equals("data")) {
            return;
        }
        String list = names.replaceFirst("^::", "").trim();
        if (attr.equals("parameter")) {
            parameters(unit, FortranTextUtils.unwrapParens(list), masked);
            return;
        }
        for (String item : FortranTextUtils.parenSplit(list, ',')) {
            if (item.isEmpty() || item.startsWith("/")) {
                continue;
            }
            String name;
            String detail = attr;
            if (GENERIC_SPEC.matcher(item).matches()) {
                name = item.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            } else {
                Matcher nameMatcher = LEADING_NAME.matcher(item);
                if (!nameMatcher.find()) {
                    continue;
                }
                name = nameMatcher.group(1).toLowerCase(Locale.ROOT);
                String dims = FortranTextUtils.leadingParens(item.substring(nameMatcher.end()));
                if (dims != null && attr.equals("dimension")) {
                    detail = "dimension" + dims.replaceAll("\\s+", "");
                }
            }
            unit.pendingAttributes.computeIfAbsent(name, k -> new ArrayList<>()).add(detail);
        }
    }

    private static void use(ScopingUnit unit, Matcher m, LogicalLine line) {
        UseStatement use = new UseStatement(m.group(2));
        use.intrinsic = m.group(1) != null && m.group(1).equalsIgnoreCase("intrinsic");
        use.line = line.getLineNumber();
        String rest = m.group(3).trim().replaceFirst("^,", "").trim();
        if (rest.toLowerCase(Locale.ROOT).startsWith("only")) {
            int colon = rest.indexOf(':');
            use.only = true;
            rest = colon >= 0 ? rest.substring(colon + 1) : "";
        }
        for (String item : FortranTextUtils.parenSplit(rest, ',')) {
            if (item.isEmpty()) {
                continue;
            }
            int arrow = item.indexOf("=>");
            if (arrow >= 0) {
                use.entities.add(new UseStatement.UseRename(
                        item.substring(0, arrow).replaceAll("\\s+", ""), item.substring(arrow + 2).replaceAll("\\s+", "")));
            } else {
                String name = item.replaceAll("\\s+", "");
                use.entities.add(new UseStatement.UseRename(name, name));
            }
        }
        unit.uses.add(use);
    }

    private List<FortranEntity> declarations(Frame frame, Matcher m, MaskedStatement masked, LogicalLine line) {
        List<VariableEntity> variables = DeclarationParser.parse(m.group(1), m.group(2), masked);
        boolean inEnum = frame.entity.kind == EntityKind.ENUM;
        List<FortranEntity> created = new ArrayList<>();
        for (VariableEntity variable : variables) {
            if (inEnum != "enumerator".equals(variable.vartype)) {
                diagnostics.warn(file, line.getLineNumber(), DiagnosticKind.UNRECOGNIZED_STATEMENT,
                        "unexpected " + variable.vartype + " declaration in " + describe(frame.entity));
                continue;
            }
            if (variable.hasAttribute("external")) {
                continue;
            }
            variable.sourceFile = file;
            variable.lineStart = line.getLineNumber();
            variable.lineEnd = line.getLineNumber();
            frame.entity.addChild(variable);
            created.add(variable);
        }
        return created;
    }

    private List<FortranEntity> bindings(Frame frame, Matcher m, LogicalLine line) {
        List<FortranEntity> created = new ArrayList<>();
        String rest = m.group(4);
        List<String> attributes = m.group(3) == null ? List.of() : FortranTextUtils.parenSplit(m.group(3), ',');
        if (m.group(1).equalsIgnoreCase("generic")) {
            int arrow = DeclarationParser.topLevelIndexOf(rest, "=>");
            if (arrow < 0) {
                diagnostics.warn(file, line.getLineNumber(), DiagnosticKind.UNRECOGNIZED_STATEMENT,
                        "generic binding without `=>` in " + describe(frame.entity));
                return created;
            }
            BoundProcedureEntity generic = new BoundProcedureEntity(
                    rest.substring(0, arrow).replaceAll("\\s+", ""), BindingKind.GENERIC);
            generic.bindingNames.addAll(FortranTextUtils.parenSplit(rest.substring(arrow + 2), ','));
            applyBindingAttributes(generic, attributes);
            created.add(generic);
        } else {
            for (String item : FortranTextUtils.parenSplit(rest, ',')) {
                int arrow = item.indexOf("=>");
                String name = (arrow >= 0 ? item.substring(0, arrow) : item).trim();
                String target = (arrow >= 0 ? item.substring(arrow + 2) : item).trim();
                BoundProcedureEntity binding = new BoundProcedureEntity(name, BindingKind.SPECIFIC);
                binding.bindingNames.add(target);
                if (m.group(2) != null) {
                    binding.prototypeName = FortranTextUtils.unwrapParens(m.group(2));
                }
                applyBindingAttributes(binding, attributes);
                created.add(binding);
            }
        }
        for (FortranEntity binding : created) {
            binding.sourceFile = file;
            binding.lineStart = line.getLineNumber();
            binding.lineEnd = line.getLineNumber();
            frame.entity.addChild(binding);
        }
        return created;
    }

    private static void applyBindingAttributes(BoundProcedureEntity binding, List<String> attributes) {
        for (String attribute : attributes) {
            String lower = attribute.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
            Optional<Permission> permission = Permission.fromKeyword(lower);
            if (permission.isPresent()) {
                binding.setExplicitPermission(permission.get());
            } else if (lower.equals("deferred")) {
                binding.deferred = true;
            } else if (!lower.isEmpty()) {
                binding.attributes.add(lower);
            }
        }
    }

    private List<FortranEntity> finals(Frame frame, String names, LogicalLine line) {
        List<FortranEntity> created = new ArrayList<>();
        for (String name : FortranTextUtils.parenSplit(names, ',')) {
            BoundProcedureEntity fin = new BoundProcedureEntity(name, BindingKind.FINAL);
            fin.bindingNames.add(name);
            fin.sourceFile = file;
            fin.lineStart = line.getLineNumber();
            fin.lineEnd = line.getLineNumber();
            frame.entity.addChild(fin);
            created.add(fin);
        }
        return created;
    }

    private List<FortranEntity> common(Frame frame, String rest, LogicalLine line) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        String text = rest.trim();
        if (!text.startsWith("/")) {
            int slash = text.indexOf('/');
            String blank = slash >= 0 ? text.substring(0, slash) : text;
            groups.computeIfAbsent(CommonBlockEntity.BLANK_COMMON, k -> new ArrayList<>()).addAll(memberNames(blank));
            text = slash >= 0 ? text.substring(slash) : "";
        }
        Matcher m = COMMON_GROUP.matcher(text);
        while (m.find()) {
            String name = m.group(1).isEmpty() ? CommonBlockEntity.BLANK_COMMON : m.group(1);
            groups.computeIfAbsent(name, k -> new ArrayList<>()).addAll(memberNames(m.group(2)));
        }
        List<FortranEntity> created = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            CommonBlockEntity block = frame.entity.childrenOf(CommonBlockEntity.class).stream()
                    .filter(c -> c.nameMatches(group.getKey()))
                    .findFirst()
                    .orElse(null);
            if (block == null) {
                block = new CommonBlockEntity(group.getKey());
                block.sourceFile = file;
                block.lineStart = line.getLineNumber();
                frame.entity.addChild(block);
            }
            block.lineEnd = line.getLineNumber();
            block.memberNames.addAll(group.getValue());
            created.add(block);
        }
        return created;
    }

    private static List<String> memberNames(String list) {
        List<String> names = new ArrayList<>();
        for (String item : FortranTextUtils.parenSplit(list, ',')) {
            Matcher m = LEADING_NAME.matcher(item);
            if (m.find()) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private FortranEntity namelist(Frame frame, Matcher m, LogicalLine line) {
        NamelistEntity namelist = new NamelistEntity(m.group(1));
        namelist.memberNames.addAll(memberNames(m.group(2)));
        namelist.sourceFile = file;
        namelist.lineStart = line.getLineNumber();
        namelist.lineEnd = line.getLineNumber();
        frame.entity.addChild(namelist);
        return namelist;
    }

    // ---- executable statements ----

    private void associate(Frame frame, String associations) {
        Map<String, List<String>> names = new LinkedHashMap<>();
        for (String item : FortranTextUtils.parenSplit(associations, ',')) {
            int arrow = item.indexOf("=>");
            if (arrow < 0) {
                continue;
            }
            String name = item.substring(0, arrow).trim().toLowerCase(Locale.ROOT);
            String target = item.substring(arrow + 2).trim();
            List<List<String>> chains = new ArrayList<>();
            if (SIMPLE_CHAIN.matcher(target).matches()) {
                CallScanner.addChain(chains, target);
            }
            names.put(name, chains.isEmpty() ? null : chains.get(0));
            scanCalls(frame, target);
        }
        frame.associations.push(names);
    }

    private void scanCalls(Frame frame, String maskedText) {
        if (!(frame.entity instanceof ScopingUnit unit)) {
            return;
        }
        for (List<String> chain : CallScanner.scan(maskedText)) {
            List<String> resolved = frame.expandAssociation(chain);
            if (!unit.callChains.contains(resolved)) {
                unit.callChains.add(resolved);
            }
        }
    }

    private static String describe(FortranEntity entity) {
        if (entity.kind == EntityKind.SOURCE_FILE) {
            return "source file";
        }
        return entity.kind.getLabel() + (entity.name == null || entity.name.isEmpty() ? "" : " '" + entity.name + "'");
    }

    private final class Frame {
        final FortranEntity entity;
        final int depth;
        boolean inContains;
        int blockLevel;
        FortranEntity lastEntity;
        final List<String> pendingPrecedingDocs = new ArrayList<>();
        final Deque<Map<String, List<String>>> associations = new ArrayDeque<>();

        Frame(FortranEntity entity, int depth) {
            this.entity = entity;
            this.depth = depth;
        }

        Frame child(FortranEntity nested) {
            if (depth + 1 > config.getMaxNestingDepth()) {
                throw new StructuralParseException(file, lastLine,
                        "nesting deeper than " + config.getMaxNestingDepth() + " levels at " + describe(nested));
            }
            return new Frame(nested, depth + 1);
        }

        List<String> takePrecedingDocs(LogicalLine line) {
            List<String> docs = new ArrayList<>(pendingPrecedingDocs);
            pendingPrecedingDocs.clear();
            if (line.getPlacement() == DocPlacement.PRECEDING) {
                docs.addAll(line.getDocumentation());
            }
            return docs;
        }

        List<String> expandAssociation(List<String> chain) {
            for (Map<String, List<String>> batch : associations) {
                if (batch.containsKey(chain.get(0))) {
                    List<String> target = batch.get(chain.get(0));
                    if (target == null) {
                        return chain;
                    }
                    List<String> expanded = new ArrayList<>(target);
                    expanded.addAll(chain.subList(1, chain.size()));
                    return expanded;
                }
            }
            return chain;
        }
    }

    private static final class Statement {
        final StatementKind kind;
        final Matcher matcher;

        Statement(StatementKind kind, Matcher matcher) {
            this.kind = kind;
            this.matcher = matcher;
        }
    }

    /** Documentation of one statement, handed to whatever the statement creates exactly once. */
    private static final class DocCarrier {
        final List<String> preceding;
        final List<String> following;
        boolean applied;

        DocCarrier(List<String> preceding, List<String> following) {
            this.preceding = preceding;
            this.following = following;
        }

        void applyTo(List<? extends FortranEntity> created, FortranEntity fallback) {
            if (applied) {
                return;
            }
            applied = true;
            if (created.isEmpty()) {
                fallback.docFragments.addAll(preceding);
                fallback.docFragments.addAll(following);
                return;
            }
            created.get(0).docFragments.addAll(preceding);
            created.get(created.size() - 1).docFragments.addAll(following);
        }
    }
}
