package org.dxworks.fortframe;

public enum SourceForm {
    FREE,
    FIXED
}
