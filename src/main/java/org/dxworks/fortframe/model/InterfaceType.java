package org.dxworks.fortframe.model;

public enum InterfaceType {
    /** Named interface grouping several specific procedures under one generic name. */
    GENERIC,
    /** Unnamed interface block describing a single external or dummy procedure. */
    SPECIFIC,
    ABSTRACT
}
