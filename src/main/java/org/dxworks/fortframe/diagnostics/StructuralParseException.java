package org.dxworks.fortframe.diagnostics;

/**
 * The logical-line grammar of a file is violated. Fatal for that file.
 */
public class StructuralParseException extends FortframeException {
    private final String file;
    private final int line;
    private final String reason;

    public StructuralParseException(String file, int line, String reason) {
        super(format(file, line, reason));
        this.file = file;
        this.line = line;
        this.reason = reason;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }

    private static String format(String file, int line, String reason) {
        return (file == null ? "<source>" : file) + ":" + line + ": " + reason;
    }
}
