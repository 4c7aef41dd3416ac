package org.dxworks.fortframe.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites fixed-form source into free form, line for line, so line numbers are preserved.
 * <ul>
 *   <li>{@code c}, {@code C}, {@code *} or {@code !} in column 1 marks a comment line</li>
 *   <li>a character other than blank or {@code 0} in column 6 marks a continuation; the previous
 *       code line gets a trailing {@code &}</li>
 *   <li>columns 1-5 hold a label, which is dropped</li>
 *   <li>with the length limit on, text past the column limit becomes a comment</li>
 * </ul>
 */
public class FixedFormConverter implements LineRewriter {
    private static final String COMMENT_CHARS = "cC*!";

    private final boolean lengthLimit;
    private final int columnLimit;

    public FixedFormConverter(boolean lengthLimit, int columnLimit) {
        this.lengthLimit = lengthLimit;
        this.columnLimit = columnLimit;
    }

    @Override
    public List<String> processLines(List<String> lines) {
        List<ConvertedLine> converted = new ArrayList<>(lines.size());
        int lastCode = -1;
        for (String raw : lines) {
            ConvertedLine line = convert(raw);
            if (line.continuation && lastCode >= 0) {
                converted.get(lastCode).continued = true;
            }
            if (line.continuation || !line.code.isBlank()) {
                lastCode = converted.size();
            }
            converted.add(line);
        }
        List<String> result = new ArrayList<>(converted.size());
        for (ConvertedLine line : converted) {
            result.add(line.render());
        }
        return result;
    }

    private ConvertedLine convert(String raw) {
        if (raw.isEmpty()) {
            return new ConvertedLine("", "", false);
        }
        char first = raw.charAt(0);
        if (COMMENT_CHARS.indexOf(first) >= 0) {
            return commentLine(raw);
        }
        if (raw.startsWith("\t")) {
            return codeLine(raw.substring(1), false);
        }
        if (raw.length() < 6) {
            return codeLine(raw.trim(), false);
        }
        String limited = raw;
        String overflow = "";
        if (lengthLimit && raw.length() > columnLimit) {
            limited = raw.substring(0, columnLimit);
            overflow = raw.substring(columnLimit);
        }
        char marker = limited.charAt(5);
        boolean continuation = marker != ' ' && marker != '0';
        String statementField = limited.length() > 6 ? limited.substring(6) : "";
        ConvertedLine line = codeLine(statementField, continuation);
        if (!overflow.isEmpty() && line.comment.isEmpty()) {
            line.comment = "!" + overflow;
        }
        return line;
    }

    private static ConvertedLine commentLine(String raw) {
        return new ConvertedLine("", "!" + raw.substring(1), false);
    }

    private static ConvertedLine codeLine(String field, boolean continuation) {
        int commentStart = FortranTextUtils.findCommentStart(field);
        String code = commentStart >= 0 ? field.substring(0, commentStart) : field;
        String comment = commentStart >= 0 ? field.substring(commentStart) : "";
        return new ConvertedLine(code.stripTrailing(), comment, continuation);
    }

    private static final class ConvertedLine {
        final String code;
        String comment;
        final boolean continuation;
        boolean continued;

        ConvertedLine(String code, String comment, boolean continuation) {
            this.code = code;
            this.comment = comment;
            this.continuation = continuation;
        }

        String render() {
            StringBuilder sb = new StringBuilder();
            if (continuation) {
                sb.append('&');
            }
            sb.append(code);
            if (continued) {
                sb.append(" &");
            }
            if (!comment.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(comment);
            }
            return sb.toString();
        }
    }
}
