package org.dxworks.fortframe.diagnostics;

public class PreprocessingException extends FortframeException {
    private final String file;

    public PreprocessingException(String file, String message) {
        super(file + ": preprocessing failed: " + message);
        this.file = file;
    }

    public PreprocessingException(String file, String message, Throwable cause) {
        super(file + ": preprocessing failed: " + message, cause);
        this.file = file;
    }

    public String getFile() {
        return file;
    }
}
