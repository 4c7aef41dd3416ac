package org.dxworks.fortframe.diagnostics;

public class ConfigurationException extends FortframeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
