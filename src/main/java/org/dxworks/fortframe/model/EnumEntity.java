package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {@code enum, bind(c)} block; its children are the enumerators. */
public class EnumEntity extends FortranEntity {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String bindC;

    public EnumEntity(String name) {
        super(EntityKind.ENUM, name);
    }
}
