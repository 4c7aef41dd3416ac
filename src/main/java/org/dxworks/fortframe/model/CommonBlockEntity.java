package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

public class CommonBlockEntity extends FortranEntity {
    public static final String BLANK_COMMON = "//";

    public List<String> memberNames = new ArrayList<>();
    public List<EntityRef> members = new ArrayList<>();

    public CommonBlockEntity(String name) {
        super(EntityKind.COMMON_BLOCK, name);
    }
}
