package org.dxworks.fortframe.model;

/**
 * A non-Fortran file listed by extension in the extra file types. Only its documentation comments
 * are read; it has no children and takes no part in correlation.
 */
public class GenericSourceEntity extends FortranEntity {
    public String path;
    public String commentMarker;

    public GenericSourceEntity(String path, String commentMarker) {
        super(EntityKind.GENERIC_SOURCE, SourceFileEntity.fileName(path));
        this.path = path;
        this.commentMarker = commentMarker;
        this.sourceFile = path;
    }

    @Override
    public void addChild(FortranEntity child) {
        throw new IllegalStateException("generic source " + name + " cannot contain " + child);
    }
}
