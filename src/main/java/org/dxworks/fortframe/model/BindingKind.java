package org.dxworks.fortframe.model;

public enum BindingKind {
    SPECIFIC,
    GENERIC,
    FINAL
}
