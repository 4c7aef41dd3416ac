package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Interface block. Generic interfaces own several procedures and may name further module procedures;
 * specific and abstract interfaces wrap exactly one procedure and carry its name.
 */
public class InterfaceEntity extends FortranEntity {
    public InterfaceType interfaceType;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> moduleProcedureNames = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<EntityRef> moduleProcedures = new ArrayList<>();

    public InterfaceEntity(String name, InterfaceType interfaceType) {
        super(interfaceType == InterfaceType.ABSTRACT ? EntityKind.ABSTRACT_INTERFACE : EntityKind.INTERFACE, name);
        this.interfaceType = interfaceType;
    }

    @JsonIgnore
    public List<ProcedureEntity> getProcedures() {
        return childrenOf(ProcedureEntity.class);
    }

    /** The wrapped procedure of a specific or abstract interface. */
    @JsonIgnore
    public ProcedureEntity getProcedure() {
        List<ProcedureEntity> procedures = getProcedures();
        return procedures.isEmpty() ? null : procedures.get(0);
    }

    @JsonIgnore
    public boolean isGeneric() {
        return interfaceType == InterfaceType.GENERIC;
    }
}
