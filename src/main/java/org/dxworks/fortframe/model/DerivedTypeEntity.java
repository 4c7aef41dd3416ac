package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived type. Components and bindings are children; inherited members are references into the
 * ancestors and are recomputed on every correlation.
 */
public class DerivedTypeEntity extends FortranEntity {
    @JsonIgnore
    public String extendsName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public EntityRef extendsType;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> attributes = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> typeParameters = new ArrayList<>();

    public boolean sequence;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<EntityRef> inheritedComponents = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<EntityRef> inheritedBindings = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public EntityRef constructor;

    /** Access given to bindings after {@code contains}; set by a bare {@code private} there. */
    @JsonIgnore
    public Permission bindingAccess = Permission.PUBLIC;

    /** Access given to components; set by a bare {@code private} before {@code contains}. */
    @JsonIgnore
    public Permission componentAccess = Permission.PUBLIC;

    public DerivedTypeEntity(String name) {
        super(EntityKind.DERIVED_TYPE, name);
    }

    @JsonIgnore
    public List<VariableEntity> getComponents() {
        return childrenOf(VariableEntity.class);
    }

    @JsonIgnore
    public List<BoundProcedureEntity> getBindings() {
        return childrenOf(BoundProcedureEntity.class);
    }

    @JsonIgnore
    public boolean isAbstract() {
        return attributes.contains("abstract");
    }

    @JsonIgnore
    public DerivedTypeEntity getParentType() {
        return extendsType != null && extendsType.target instanceof DerivedTypeEntity parentType ? parentType : null;
    }
}
