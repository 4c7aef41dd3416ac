package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.SourceFileEntity;
import org.dxworks.fortframe.reader.FortranReader;

/**
 * Entry point for parsing one source text. Holds no per-file state, so one instance can serve
 * several threads.
 */
public class FortranParser {
    private final FortframeConfig config;

    public FortranParser(FortframeConfig config) {
        this.config = config;
    }

    /**
     * @throws org.dxworks.fortframe.diagnostics.StructuralParseException when the text violates the
     *         line or block structure
     */
    public ParseResult parse(String filePath, String sourceCode, SourceForm form) {
        Diagnostics diagnostics = new Diagnostics();
        FortranReader reader = new FortranReader(filePath, sourceCode, form, config);
        SourceFileEntity sourceFile = new SourceFileEntity(filePath, form);
        new StatementParser(reader, filePath, config, diagnostics).parse(sourceFile);
        return new ParseResult(sourceFile, diagnostics);
    }
}
