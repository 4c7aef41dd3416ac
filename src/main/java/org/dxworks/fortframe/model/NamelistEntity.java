package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

public class NamelistEntity extends FortranEntity {
    public List<String> memberNames = new ArrayList<>();
    public List<EntityRef> members = new ArrayList<>();

    public NamelistEntity(String name) {
        super(EntityKind.NAMELIST, name);
    }
}
