package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.GenericSourceEntity;
import org.dxworks.fortframe.reader.GenericCommentReader;

/** Reads the documentation of a non-Fortran file into a {@link GenericSourceEntity}. */
public class GenericSourceParser {
    private final FortframeConfig config;

    public GenericSourceParser(FortframeConfig config) {
        this.config = config;
    }

    public GenericSourceEntity parse(String filePath, String text, String commentMarker, Diagnostics diagnostics) {
        GenericSourceEntity source = new GenericSourceEntity(filePath, commentMarker);
        source.lineStart = 1;
        source.lineEnd = text.isEmpty() ? 0 : (int) text.lines().count();
        source.docFragments.addAll(new GenericCommentReader(commentMarker, config).read(text));
        new DocumentationFinisher(filePath, diagnostics).finish(source);
        return source;
    }
}
