package org.dxworks.fortframe.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnostic {
    public final String file;
    public final int line;
    public final Severity severity;
    public final DiagnosticKind kind;
    public final String message;

    public Diagnostic(String file, int line, Severity severity, DiagnosticKind kind, String message) {
        this.file = file;
        this.line = line;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
    }

    @Override
    public String toString() {
        return severity + " " + (file == null ? "" : file + ":" + line + ": ") + message;
    }
}
