package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** Type-bound procedure, generic binding or final procedure of a derived type. */
public class BoundProcedureEntity extends FortranEntity {
    public BindingKind bindingKind;
    public boolean deferred;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> attributes = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String prototypeName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public EntityRef prototype;

    /** Implementation names after {@code =>}, or the binding name itself when none is given. */
    public List<String> bindingNames = new ArrayList<>();

    public List<EntityRef> bindings = new ArrayList<>();

    public BoundProcedureEntity(String name, BindingKind bindingKind) {
        super(EntityKind.BOUND_PROCEDURE, name);
        this.bindingKind = bindingKind;
    }

    @Override
    public void addChild(FortranEntity child) {
        throw new IllegalStateException("binding " + name + " cannot contain " + child);
    }
}
