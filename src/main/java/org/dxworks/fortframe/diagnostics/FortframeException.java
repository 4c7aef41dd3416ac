package org.dxworks.fortframe.diagnostics;

public class FortframeException extends RuntimeException {
    public FortframeException(String message) {
        super(message);
    }

    public FortframeException(String message, Throwable cause) {
        super(message, cause);
    }
}
