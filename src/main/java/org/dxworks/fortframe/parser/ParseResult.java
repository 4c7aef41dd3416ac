package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.SourceFileEntity;

/** Entity tree of one file together with the non-fatal problems found while building it. */
public class ParseResult {
    private final SourceFileEntity sourceFile;
    private final Diagnostics diagnostics;

    public ParseResult(SourceFileEntity sourceFile, Diagnostics diagnostics) {
        this.sourceFile = sourceFile;
        this.diagnostics = diagnostics;
    }

    public SourceFileEntity getSourceFile() {
        return sourceFile;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
