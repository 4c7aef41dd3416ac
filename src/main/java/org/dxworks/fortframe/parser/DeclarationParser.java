package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.VariableEntity;
import org.dxworks.fortframe.reader.FortranTextUtils;
import org.dxworks.fortframe.reader.MaskedStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a type declaration statement into one {@link VariableEntity} per declared name.
 * All names share the type and attribute clause; dimensions, lengths and initialisers are per name.
 */
final class DeclarationParser {
    private static final Pattern INTENT = Pattern.compile("^intent\\s*\\(\\s*(in|out|in\\s*out)\\s*\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSION = Pattern.compile("^dimension\\s*(\\(.*\\))$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME = Pattern.compile("^(\\w+)\\s*");
    private static final Pattern CHAR_LENGTH = Pattern.compile("^\\*\\s*(\\d+|\\(.*\\))");

    private DeclarationParser() {
        // utility class
    }

    /**
     * @param keyword type keyword matched by the declaration pattern
     * @param after   masked text following the keyword
     * @param masked  the masked statement, for restoring string literals in initial values
     */
    static List<VariableEntity> parse(String keyword, String after, MaskedStatement masked) {
        TypeSpec spec = TypeSpec.parse(keyword, after);
        String attributePart;
        String declarationPart;
        int separator = topLevelIndexOf(spec.rest, "::");
        if (separator >= 0) {
            attributePart = spec.rest.substring(0, separator);
            declarationPart = spec.rest.substring(separator + 2);
        } else {
            attributePart = "";
            declarationPart = spec.rest.replaceFirst("^\\s*,", "");
        }

        VariableEntity template = new VariableEntity("");
        template.vartype = spec.vartype;
        template.kindSpec = masked.restore(spec.kind);
        template.length = masked.restore(spec.length);
        template.protoName = spec.proto;
        String defaultDimension = null;
        for (String attribute : FortranTextUtils.parenSplit(attributePart.replaceFirst("^\\s*,", ""), ',')) {
            String lower = attribute.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
            if (lower.isEmpty()) {
                continue;
            }
            Optional<Permission> permission = Permission.fromKeyword(lower);
            Matcher intent = INTENT.matcher(lower);
            Matcher dimension = DIMENSION.matcher(attribute.trim());
            if (permission.isPresent()) {
                template.setExplicitPermission(permission.get());
            } else if (lower.equals("optional")) {
                template.optional = true;
            } else if (lower.equals("value")) {
                template.value = true;
            } else if (lower.equals("parameter")) {
                template.parameter = true;
            } else if (intent.matches()) {
                template.intent = intent.group(1).replaceAll("\\s+", "");
            } else if (dimension.matches()) {
                defaultDimension = dimension.group(1).replaceAll("\\s+", "");
            } else {
                template.attributes.add(lower);
            }
        }

        List<VariableEntity> variables = new ArrayList<>();
        for (String declaration : FortranTextUtils.parenSplit(declarationPart, ',')) {
            VariableEntity variable = declare(template, declaration, defaultDimension, masked);
            if (variable != null) {
                variables.add(variable);
            }
        }
        return variables;
    }

    private static VariableEntity declare(VariableEntity template, String declaration, String defaultDimension,
                                          MaskedStatement masked) {
        String lhs = declaration;
        String initial = null;
        boolean points = false;
        int pointer = topLevelIndexOf(declaration, "=>");
        int assign = topLevelAssignment(declaration);
        if (pointer >= 0 && (assign < 0 || pointer < assign)) {
            lhs = declaration.substring(0, pointer);
            initial = declaration.substring(pointer + 2).trim();
            points = true;
        } else if (assign >= 0) {
            lhs = declaration.substring(0, assign);
            initial = declaration.substring(assign + 1).trim();
        }

        Matcher nameMatcher = NAME.matcher(lhs.trim());
        if (!nameMatcher.find()) {
            return null;
        }
        String remainder = lhs.trim().substring(nameMatcher.end());
        VariableEntity variable = template.copyAs(nameMatcher.group(1));
        variable.permissionExplicit = template.permissionExplicit;
        variable.dimension = defaultDimension;

        String dims = FortranTextUtils.leadingParens(remainder);
        if (dims == null && remainder.startsWith("[")) {
            int close = remainder.indexOf(']');
            dims = close > 0 ? remainder.substring(0, close + 1) : null;
        }
        if (dims != null) {
            variable.dimension = dims.replaceAll("\\s+", "");
            remainder = remainder.stripLeading().substring(dims.length()).stripLeading();
        }
        Matcher length = CHAR_LENGTH.matcher(remainder);
        if (length.find()) {
            variable.length = masked.restore(FortranTextUtils.unwrapParens(length.group(1)));
        }
        if (initial != null && !initial.isEmpty()) {
            variable.initial = masked.restore(initial);
            variable.points = points;
        }
        return variable;
    }

    /** Index of {@code token} outside strings and parentheses, or -1. */
    static int topLevelIndexOf(String text, String token) {
        int depth = 0;
        for (int i = 0; i <= text.length() - token.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && text.startsWith(token, i)) {
                return i;
            }
        }
        return -1;
    }

    private static int topLevelAssignment(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && c == '=') {
                boolean comparison = (i + 1 < text.length() && (text.charAt(i + 1) == '=' || text.charAt(i + 1) == '>'))
                        || (i > 0 && "=/<>".indexOf(text.charAt(i - 1)) >= 0);
                if (!comparison) {
                    return i;
                }
            }
        }
        return -1;
    }
}
