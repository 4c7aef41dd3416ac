package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** Variable, dummy argument, component, function result or enumerator. Always a leaf. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableEntity extends FortranEntity {
    public String vartype;
    public String kindSpec;
    public String length;
    public String dimension;
    public String intent;
    public String initial;

    /** {@code true} when {@link #initial} is a pointer association ({@code =>}). */
    public boolean points;
    public boolean optional;
    public boolean value;
    public boolean parameter;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> attributes = new ArrayList<>();

    /** Type, interface or procedure named inside {@code type(..)}, {@code class(..)} or {@code procedure(..)}. */
    @JsonIgnore
    public String protoName;

    public EntityRef prototype;

    public VariableEntity(String name) {
        super(EntityKind.VARIABLE, name);
    }

    @Override
    public void addChild(FortranEntity child) {
        throw new IllegalStateException("variable " + name + " cannot contain " + child);
    }

    public boolean hasAttribute(String attribute) {
        return attributes.stream().anyMatch(a -> a.equalsIgnoreCase(attribute));
    }

    public VariableEntity copyAs(String newName) {
        VariableEntity copy = new VariableEntity(newName);
        copy.vartype = vartype;
        copy.kindSpec = kindSpec;
        copy.length = length;
        copy.protoName = protoName;
        copy.attributes = new ArrayList<>(attributes);
        copy.intent = intent;
        copy.optional = optional;
        copy.value = value;
        copy.parameter = parameter;
        copy.permission = permission;
        return copy;
    }
}
