package org.dxworks.fortframe.model;

import org.dxworks.fortframe.SourceForm;

public class SourceFileEntity extends FortranEntity {
    public String path;
    public SourceForm form;
    public boolean preprocessed;

    public SourceFileEntity(String path, SourceForm form) {
        super(EntityKind.SOURCE_FILE, fileName(path));
        this.path = path;
        this.form = form;
        this.sourceFile = path;
    }

    static String fileName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
