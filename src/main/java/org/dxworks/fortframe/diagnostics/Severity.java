package org.dxworks.fortframe.diagnostics;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
