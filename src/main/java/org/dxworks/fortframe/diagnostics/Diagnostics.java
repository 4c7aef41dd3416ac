package org.dxworks.fortframe.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered accumulator of non-fatal problems. One instance per file parse; merged into the project
 * in file order. Not thread-safe.
 */
public class Diagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(String file, int line, Severity severity, DiagnosticKind kind, String message) {
        entries.add(new Diagnostic(file, line, severity, kind, message));
    }

    public void warn(String file, int line, DiagnosticKind kind, String message) {
        report(file, line, Severity.WARNING, kind, message);
    }

    public void add(Diagnostic diagnostic) {
        entries.add(diagnostic);
    }

    public void addAll(Diagnostics other) {
        entries.addAll(other.entries);
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.kind == kind).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
