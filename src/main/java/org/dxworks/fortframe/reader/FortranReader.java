package org.dxworks.fortframe.reader;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.diagnostics.StructuralParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Turns source text into logical lines on demand.
 * <p>
 * Physical lines are joined across {@code &} continuations, split on {@code ;}, and stripped of
 * comments. Documentation comments ({@code !} followed by one of the configured marks) are kept:
 * inline and following ones travel with the statement they trail, preceding ones are held back for
 * the next statement, and comment-only documentation blocks become documentation-only lines.
 */
public class FortranReader implements LineCursor {

    private final String file;
    private final List<String> lines;
    private final String docmark;
    private final String docmarkAlt;
    private final String predocmark;
    private final String predocmarkAlt;
    private final boolean lower;
    private final boolean keepComments;

    private final Deque<LogicalLine> pending = new ArrayDeque<>();
    private int index;
    private boolean finished;

    private StringBuilder statement;
    private int statementLine;
    private boolean continued;
    private char openQuote;
    private boolean lastWasDocLine;
    private List<String> statementPreDocs = new ArrayList<>();
    private final List<String> precedingDocs = new ArrayList<>();
    private final List<String> inlineDocs = new ArrayList<>();
    private final List<String> comments = new ArrayList<>();
    private DocBlock block;

    public FortranReader(String file, String text, SourceForm form, FortframeConfig config) {
        this.file = file;
        List<String> physical = Arrays.asList(text.split("\\R", -1));
        if (form == SourceForm.FIXED) {
            physical = new FixedFormConverter(config.isFixedLengthLimit(), config.getFixedColumnLimit())
                    .processLines(physical);
        }
        this.lines = physical;
        this.docmark = config.getDocmark();
        this.docmarkAlt = config.getDocmarkAlt();
        this.predocmark = config.getPredocmark();
        this.predocmarkAlt = config.getPredocmarkAlt();
        this.lower = config.isLower();
        this.keepComments = config.isKeepComments();
    }

    public String getFile() {
        return file;
    }

    @Override
    public LogicalLine peek() {
        fill();
        return pending.peekFirst();
    }

    @Override
    public LogicalLine advance() {
        fill();
        if (pending.isEmpty()) {
            throw new NoSuchElementException("no more logical lines in " + file);
        }
        return pending.removeFirst();
    }

    @Override
    public boolean atEnd() {
        fill();
        return pending.isEmpty();
    }

    /** Drains the reader. */
    public List<LogicalLine> readAll() {
        List<LogicalLine> all = new ArrayList<>();
        while (!atEnd()) {
            all.add(advance());
        }
        return all;
    }

    private void fill() {
        while (pending.isEmpty() && index < lines.size()) {
            String raw = lines.get(index);
            index++;
            readPhysicalLine(raw, index);
        }
        if (pending.isEmpty() && !finished) {
            finish();
        }
    }

    private void finish() {
        finished = true;
        if (statement != null) {
            emitStatement();
        }
        flushBlock();
        if (!precedingDocs.isEmpty()) {
            pending.add(LogicalLine.documentationOnly(trimTrailingBlanks(precedingDocs),
                    DocPlacement.PRECEDING, file, lines.size()));
            precedingDocs.clear();
        }
    }

    private void readPhysicalLine(String raw, int lineNumber) {
        if (raw.strip().startsWith("#")) {
            return;
        }
        char startQuote = continued ? openQuote : 0;
        int commentStart = FortranTextUtils.findCommentStart(raw, startQuote);
        String code = (commentStart >= 0 ? raw.substring(0, commentStart) : raw).strip();
        String comment = commentStart >= 0 ? raw.substring(commentStart) : null;
        DocComment doc = comment == null ? null : classify(comment, code.isEmpty());

        if (code.isEmpty()) {
            if (doc != null) {
                commentOnlyDocumentation(doc, lineNumber);
                lastWasDocLine = true;
            } else {
                if (comment != null && keepComments) {
                    comments.add(comment.substring(1));
                }
                if (block != null && !continued) {
                    block.fragments.add("");
                }
                lastWasDocLine = false;
            }
            return;
        }

        boolean joinDirectly = false;
        if (code.startsWith("&")) {
            if (lastWasDocLine) {
                throw new StructuralParseException(file, lineNumber,
                        "cannot continue a statement with `&` from within documentation");
            }
            if (!continued) {
                throw new StructuralParseException(file, lineNumber, "cannot start a new statement with `&`");
            }
            code = code.substring(1);
            joinDirectly = true;
        }
        lastWasDocLine = false;

        boolean continues = code.endsWith("&");
        if (continues) {
            code = code.substring(0, code.length() - 1);
        }
        openQuote = continues ? FortranTextUtils.openQuoteAtEnd(code, startQuote) : 0;
        if (doc != null) {
            if (doc.alternate) {
                throw new StructuralParseException(file, lineNumber, "alternate documentation lines cannot be inline");
            }
            if (continues) {
                throw new StructuralParseException(file, lineNumber,
                        "documentation cannot be inline within a continued statement");
            }
        }

        if (statement == null) {
            flushBlock();
            statementPreDocs = new ArrayList<>(trimTrailingBlanks(precedingDocs));
            precedingDocs.clear();
            statement = new StringBuilder(code);
            statementLine = lineNumber;
        } else {
            if (!joinDirectly && statement.length() > 0
                    && !Character.isWhitespace(statement.charAt(statement.length() - 1))) {
                statement.append(' ');
            }
            statement.append(code);
        }

        if (doc != null) {
            if (doc.placement == DocPlacement.FOLLOWING) {
                inlineDocs.add(doc.fragment);
            } else {
                precedingDocs.add(doc.fragment);
            }
        } else if (comment != null && keepComments) {
            comments.add(comment.substring(1));
        }

        continued = continues;
        if (!continued) {
            emitStatement();
        }
    }

    private void commentOnlyDocumentation(DocComment doc, int lineNumber) {
        if (statement != null && continued) {
            if (doc.placement == DocPlacement.FOLLOWING) {
                inlineDocs.add(doc.fragment);
            } else {
                precedingDocs.add(doc.fragment);
            }
            return;
        }
        if (block == null || block.placement != doc.placement) {
            flushBlock();
            block = new DocBlock(doc.placement, lineNumber);
        }
        block.alternate |= doc.alternate;
        block.fragments.add(doc.fragment);
    }

    private void flushBlock() {
        if (block == null) {
            return;
        }
        List<String> fragments = trimTrailingBlanks(block.fragments);
        if (block.placement == DocPlacement.FOLLOWING) {
            if (!fragments.isEmpty()) {
                pending.add(LogicalLine.documentationOnly(fragments, DocPlacement.FOLLOWING, file, block.line));
            }
        } else {
            precedingDocs.addAll(fragments);
        }
        block = null;
    }

    private void emitStatement() {
        List<String> parts = new ArrayList<>();
        for (String part : FortranTextUtils.quoteSplit(statement.toString(), ';')) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(lower ? lowerOutsideStrings(trimmed) : trimmed);
            }
        }
        List<String> trailing = trimTrailingBlanks(inlineDocs);
        if (parts.isEmpty()) {
            if (!statementPreDocs.isEmpty()) {
                pending.add(LogicalLine.documentationOnly(statementPreDocs, DocPlacement.PRECEDING, file, statementLine));
            }
            if (!trailing.isEmpty()) {
                pending.add(LogicalLine.documentationOnly(trailing, DocPlacement.FOLLOWING, file, statementLine));
            }
        }
        for (int i = 0; i < parts.size(); i++) {
            boolean first = i == 0;
            boolean last = i == parts.size() - 1;
            List<String> lineComments = first ? comments : List.of();
            if (first && !statementPreDocs.isEmpty()) {
                pending.add(new LogicalLine(parts.get(i), statementPreDocs, DocPlacement.PRECEDING,
                        file, statementLine, lineComments));
                if (last && !trailing.isEmpty()) {
                    pending.add(LogicalLine.documentationOnly(trailing, DocPlacement.FOLLOWING, file, statementLine));
                }
            } else {
                List<String> docs = last ? trailing : List.of();
                pending.add(new LogicalLine(parts.get(i), docs, DocPlacement.FOLLOWING,
                        file, statementLine, lineComments));
            }
        }
        statement = null;
        continued = false;
        statementPreDocs = new ArrayList<>();
        inlineDocs.clear();
        comments.clear();
    }

    private DocComment classify(String comment, boolean commentOnly) {
        String rest = comment.substring(1);
        if (startsWithMark(rest, docmark)) {
            return new DocComment(DocPlacement.FOLLOWING, false, rest.substring(docmark.length()));
        }
        if (startsWithMark(rest, predocmark)) {
            return new DocComment(DocPlacement.PRECEDING, false, rest.substring(predocmark.length()));
        }
        if (startsWithMark(rest, docmarkAlt)) {
            return new DocComment(DocPlacement.FOLLOWING, true, rest.substring(docmarkAlt.length()));
        }
        if (startsWithMark(rest, predocmarkAlt)) {
            return new DocComment(DocPlacement.PRECEDING, true, rest.substring(predocmarkAlt.length()));
        }
        if (commentOnly && block != null && block.alternate && !continued) {
            return new DocComment(block.placement, true, rest);
        }
        return null;
    }

    private static boolean startsWithMark(String text, String mark) {
        return !mark.isEmpty() && text.startsWith(mark);
    }

    private static List<String> trimTrailingBlanks(List<String> fragments) {
        int end = fragments.size();
        while (end > 0 && fragments.get(end - 1).isBlank()) {
            end--;
        }
        return new ArrayList<>(fragments.subList(0, end));
    }

    private static String lowerOutsideStrings(String text) {
        MaskedStatement masked = MaskedStatement.mask(text);
        return masked.restore(masked.text().toLowerCase(Locale.ROOT));
    }

    private static final class DocComment {
        final DocPlacement placement;
        final boolean alternate;
        final String fragment;

        DocComment(DocPlacement placement, boolean alternate, String fragment) {
            this.placement = placement;
            this.alternate = alternate;
            this.fragment = fragment;
        }
    }

    private static final class DocBlock {
        final DocPlacement placement;
        final int line;
        final List<String> fragments = new ArrayList<>();
        boolean alternate;

        DocBlock(DocPlacement placement, int line) {
            this.placement = placement;
            this.line = line;
        }
    }
}
