package org.dxworks.fortframe.reader;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A statement whose string literals are replaced by numbered placeholders, so that keyword
 * patterns never match text inside quotes. {@link #restore(String)} puts the literals back.
 */
public final class MaskedStatement {
    private static final Pattern PLACEHOLDER = Pattern.compile("\"(\\d+)\"");

    private final String text;
    private final List<String> literals;

    private MaskedStatement(String text, List<String> literals) {
        this.text = text;
        this.literals = literals;
    }

    public static MaskedStatement mask(String statement) {
        List<String> literals = new ArrayList<>();
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < statement.length()) {
            char c = statement.charAt(i);
            if (c != '\'' && c != '"') {
                out.append(c);
                i++;
                continue;
            }
            int end = i + 1;
            while (end < statement.length()) {
                if (statement.charAt(end) == c) {
                    if (end + 1 < statement.length() && statement.charAt(end + 1) == c) {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            int stop = Math.min(end + 1, statement.length());
            out.append('"').append(literals.size()).append('"');
            literals.add(statement.substring(i, stop));
            i = stop;
        }
        return new MaskedStatement(out.toString(), literals);
    }

    public String text() {
        return text;
    }

    public String restore(String fragment) {
        if (fragment == null || literals.isEmpty()) {
            return fragment;
        }
        Matcher m = PLACEHOLDER.matcher(fragment);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            String replacement = index < literals.size() ? literals.get(index) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
