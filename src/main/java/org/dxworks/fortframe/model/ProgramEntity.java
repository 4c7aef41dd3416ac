package org.dxworks.fortframe.model;

public class ProgramEntity extends ScopingUnit {
    public ProgramEntity(String name) {
        super(EntityKind.PROGRAM, name);
    }
}
