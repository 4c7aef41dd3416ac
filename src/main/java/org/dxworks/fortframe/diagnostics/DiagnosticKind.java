package org.dxworks.fortframe.diagnostics;

public enum DiagnosticKind {
    STRUCTURAL,
    UNRECOGNIZED_STATEMENT,
    UNRESOLVED_REFERENCE,
    ENCODING,
    PREPROCESSING,
    CONFIGURATION,
    METADATA
}
