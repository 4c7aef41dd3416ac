package org.dxworks.fortframe.reader;

import java.util.List;

/**
 * One statement after continuation joining, or a documentation-only line when {@link #text} is empty.
 */
public final class LogicalLine {
    private final String text;
    private final List<String> documentation;
    private final DocPlacement placement;
    private final String file;
    private final int lineNumber;
    private final List<String> comments;

    public LogicalLine(String text, List<String> documentation, DocPlacement placement,
                       String file, int lineNumber, List<String> comments) {
        this.text = text;
        this.documentation = List.copyOf(documentation);
        this.placement = placement;
        this.file = file;
        this.lineNumber = lineNumber;
        this.comments = List.copyOf(comments);
    }

    public static LogicalLine documentationOnly(List<String> documentation, DocPlacement placement,
                                                String file, int lineNumber) {
        return new LogicalLine("", documentation, placement, file, lineNumber, List.of());
    }

    public String getText() {
        return text;
    }

    public List<String> getDocumentation() {
        return documentation;
    }

    public DocPlacement getPlacement() {
        return placement;
    }

    public String getFile() {
        return file;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public List<String> getComments() {
        return comments;
    }

    public boolean isDocumentationOnly() {
        return text.isEmpty();
    }

    public boolean hasDocumentation() {
        return !documentation.isEmpty();
    }

    @Override
    public String toString() {
        return lineNumber + ": " + (text.isEmpty() ? "<doc " + placement + ">" : text)
                + (documentation.isEmpty() ? "" : " " + documentation);
    }
}
