package org.dxworks.fortframe.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote- and parenthesis-aware string helpers. Fortran strings use either quote character and
 * escape a quote by doubling it, which the toggling below handles without special cases.
 */
public final class FortranTextUtils {

    private FortranTextUtils() {
        // utility class
    }

    /** Index of the {@code !} starting a comment, ignoring any inside string literals; -1 when absent. */
    public static int findCommentStart(String line) {
        return findCommentStart(line, (char) 0);
    }

    /**
     * As {@link #findCommentStart(String)}, for a line that starts inside a string literal opened by
     * {@code openQuote} on the line it continues; 0 when no string is open.
     */
    public static int findCommentStart(String line, char openQuote) {
        char quote = openQuote;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '!') {
                return i;
            }
        }
        return -1;
    }

    /** Index of the first {@code marker} outside a quoted string, for files commented with another marker; -1 when absent. */
    public static int findCommentStart(String line, String marker) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (line.startsWith(marker, i)) {
                return i;
            } else if (c == '\'' || c == '"') {
                quote = c;
            }
        }
        return -1;
    }

    /** Quote character of the string literal still open at the end of {@code text}, or 0. */
    public static char openQuoteAtEnd(String text, char openQuote) {
        char quote = openQuote;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            }
        }
        return quote;
    }

    /** Splits on {@code separator} occurring outside string literals. Empty pieces are kept. */
    public static List<String> quoteSplit(String text, char separator) {
        List<String> parts = new ArrayList<>();
        char quote = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == separator) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /** Splits on {@code separator} outside strings and outside any parentheses or brackets; pieces are trimmed. */
    public static List<String> parenSplit(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        int depth = 0;
        char quote = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            parts.add(current.toString().trim());
        }
        return parts;
    }

    public static int findMatchingParen(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length()) {
            return -1;
        }
        int depth = 0;
        char quote = 0;
        for (int i = openIdx; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * The balanced parenthesised group at the start of {@code text} (leading blanks skipped),
     * including the parentheses; {@code null} if {@code text} does not start with one.
     */
    public static String leadingParens(String text) {
        String trimmed = text.stripLeading();
        if (!trimmed.startsWith("(")) {
            return null;
        }
        int close = findMatchingParen(trimmed, 0);
        return close < 0 ? null : trimmed.substring(0, close + 1);
    }

    /** Content between the outer parentheses of {@code group}; the group itself if it is not parenthesised. */
    public static String unwrapParens(String group) {
        String trimmed = group.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
