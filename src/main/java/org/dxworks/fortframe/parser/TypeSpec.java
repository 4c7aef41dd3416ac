package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.reader.FortranTextUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed type specification of a declaration or function prefix: {@code real(kind=dp)},
 * {@code character(len=*, kind=ck)}, {@code character*10}, {@code type(point)}, {@code procedure(iface)}.
 */
final class TypeSpec {
    private static final Pattern KEYED = Pattern.compile("^\\s*(kind|len)\\s*=\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STAR_LENGTH = Pattern.compile("^\\*\\s*(\\d+|\\(.*?\\))");

    final String vartype;
    final String kind;
    final String length;
    final String proto;
    /** Text after the type specification, e.g. {@code , intent(in) :: x}. */
    final String rest;

    private TypeSpec(String vartype, String kind, String length, String proto, String rest) {
        this.vartype = vartype;
        this.kind = kind;
        this.length = length;
        this.proto = proto;
        this.rest = rest;
    }

    /**
     * @param keyword the type keyword as matched, e.g. {@code double   precision}
     * @param after   everything following the keyword
     */
    static TypeSpec parse(String keyword, String after) {
        String vartype = keyword.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        vartype = switch (vartype) {
            case "doubleprecision" -> "double precision";
            case "doublecomplex" -> "double complex";
            default -> vartype;
        };
        String text = after.stripLeading();

        if (vartype.equals("type") || vartype.equals("class") || vartype.equals("procedure")) {
            String group = FortranTextUtils.leadingParens(text);
            if (group == null) {
                return new TypeSpec(vartype, null, null, null, text);
            }
            String proto = FortranTextUtils.unwrapParens(group);
            return new TypeSpec(vartype, null, null, proto, text.substring(group.length()));
        }

        String kind = null;
        String length = null;
        Matcher star = STAR_LENGTH.matcher(text);
        if (star.find()) {
            String value = FortranTextUtils.unwrapParens(star.group(1));
            if (vartype.equals("character")) {
                length = value;
            } else {
                kind = value;
            }
            return new TypeSpec(vartype, kind, length, null, text.substring(star.end()));
        }

        String group = FortranTextUtils.leadingParens(text);
        if (group == null) {
            return new TypeSpec(vartype, null, null, null, text);
        }
        List<String> args = FortranTextUtils.parenSplit(FortranTextUtils.unwrapParens(group), ',');
        int positional = 0;
        for (String arg : args) {
            Matcher keyed = KEYED.matcher(arg);
            if (keyed.matches()) {
                if (keyed.group(1).equalsIgnoreCase("kind")) {
                    kind = keyed.group(2).trim();
                } else {
                    length = keyed.group(2).trim();
                }
            } else if (vartype.equals("character")) {
                if (positional == 0) {
                    length = arg.trim();
                } else {
                    kind = arg.trim();
                }
                positional++;
            } else {
                kind = arg.trim();
            }
        }
        return new TypeSpec(vartype, kind, length, null, text.substring(group.length()));
    }
}
