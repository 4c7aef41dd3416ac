package org.dxworks.fortframe.parser;

import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.EntityMetadata;
import org.dxworks.fortframe.model.FortranEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw documentation fragments of an entity into its metadata and markdown documentation.
 * <p>
 * A leading run of {@code key: value} lines with known keys is metadata; the run ends at the first
 * blank or non-matching line. Values continue on lines indented at least four columns deeper than
 * their key. Everything after the run is the documentation, dedented and trimmed.
 */
class DocumentationFinisher {
    private static final Pattern META_LINE = Pattern.compile("^(\\s*)([A-Za-z][\\w-]*)\\s*:\\s*(.*?)\\s*$");
    private static final Parser MARKDOWN = Parser.builder()
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();

    private final String file;
    private final Diagnostics diagnostics;

    DocumentationFinisher(String file, Diagnostics diagnostics) {
        this.file = file;
        this.diagnostics = diagnostics;
    }

    void finish(FortranEntity entity) {
        if (entity.docFragments.isEmpty()) {
            return;
        }
        List<String> fragments = new ArrayList<>(entity.docFragments);
        entity.docFragments.clear();

        int start = 0;
        while (start < fragments.size() && fragments.get(start).isBlank()) {
            start++;
        }
        int index = start;
        while (index < fragments.size()) {
            Matcher m = META_LINE.matcher(fragments.get(index));
            if (!m.matches() || !EntityMetadata.KEYS.contains(m.group(2).toLowerCase(Locale.ROOT))) {
                break;
            }
            int indent = m.group(1).length();
            StringBuilder value = new StringBuilder(m.group(3));
            index++;
            while (index < fragments.size() && indentOf(fragments.get(index)) >= indent + 4
                    && !fragments.get(index).isBlank()) {
                value.append('\n').append(fragments.get(index).trim());
                index++;
            }
            apply(entity, m.group(2).toLowerCase(Locale.ROOT), value.toString().trim());
        }

        entity.documentation = joinDocumentation(fragments.subList(index, fragments.size()));
        if (entity.metadata.summary == null && !entity.documentation.isEmpty()) {
            entity.metadata.summary = firstParagraph(entity.documentation);
        }
    }

    private void apply(FortranEntity entity, String key, String value) {
        EntityMetadata meta = entity.metadata;
        switch (key) {
            case "author" -> meta.author = value;
            case "date" -> meta.date = value;
            case "version" -> meta.version = value;
            case "category" -> meta.category = value;
            case "summary" -> meta.summary = value;
            case "license" -> meta.license = value;
            case "deprecated" -> meta.deprecated = parseBoolean(entity, key, value);
            case "source" -> meta.source = parseBoolean(entity, key, value);
            case "graph" -> meta.graph = parseBoolean(entity, key, value);
            case "proc_internals" -> meta.procInternals = parseBoolean(entity, key, value);
            case "display" -> meta.display = Arrays.stream(value.toLowerCase(Locale.ROOT).split("[\\s,]+"))
                    .filter(v -> !v.isEmpty())
                    .toList();
            default -> throw new IllegalArgumentException("unknown metadata key " + key);
        }
    }

    private Boolean parseBoolean(FortranEntity entity, String key, String value) {
        if (value.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        diagnostics.warn(file, entity.lineStart, DiagnosticKind.METADATA,
                "metadata '" + key + "' of " + entity + " expects true or false, got '" + value + "'");
        return null;
    }

    static String joinDocumentation(List<String> fragments) {
        int start = 0;
        int end = fragments.size();
        while (start < end && fragments.get(start).isBlank()) {
            start++;
        }
        while (end > start && fragments.get(end - 1).isBlank()) {
            end--;
        }
        if (start == end) {
            return "";
        }
        return String.join("\n", fragments.subList(start, end)).stripIndent().strip();
    }

    /** Source text of the first top-level markdown paragraph, or {@code null} if there is none. */
    static String firstParagraph(String markdown) {
        Node document = MARKDOWN.parse(markdown);
        String[] lines = markdown.split("\n", -1);
        for (Node node = document.getFirstChild(); node != null; node = node.getNext()) {
            if (!(node instanceof Paragraph paragraph)) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (SourceSpan span : paragraph.getSourceSpans()) {
                if (span.getLineIndex() >= lines.length) {
                    continue;
                }
                String line = lines[span.getLineIndex()];
                int from = Math.min(span.getColumnIndex(), line.length());
                int to = Math.min(from + span.getLength(), line.length());
                parts.add(line.substring(from, to).strip());
            }
            return String.join("\n", parts);
        }
        return null;
    }

    private static int indentOf(String fragment) {
        int i = 0;
        while (i < fragment.length() && Character.isWhitespace(fragment.charAt(i))) {
            i++;
        }
        return i;
    }
}
