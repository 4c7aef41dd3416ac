package org.dxworks.fortframe.diagnostics;

public class SourceEncodingException extends FortframeException {
    private final String file;

    public SourceEncodingException(String file, String charset, Throwable cause) {
        super(file + ": cannot decode as " + charset, cause);
        this.file = file;
    }

    public String getFile() {
        return file;
    }
}
