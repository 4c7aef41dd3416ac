package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Subroutine, function or separate module procedure. Dummy arguments and the function result are
 * owned by the procedure through {@link #arguments} and {@link #returnVariable}, not through children.
 */
public class ProcedureEntity extends ScopingUnit {
    public ProcedureType procedureType;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> attributes = new ArrayList<>();

    @JsonIgnore
    public List<String> argumentNames = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<VariableEntity> arguments = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public VariableEntity returnVariable;

    /** Name given in {@code result(...)}, if any. */
    @JsonIgnore
    public String resultName;

    /** Type prefix of a function header, e.g. {@code real(kind=8)}. */
    @JsonIgnore
    public String headerType;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String bindC;

    /** For separate module procedures: the interface body declaring them. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public EntityRef moduleInterface;

    public ProcedureEntity(String name, ProcedureType procedureType) {
        super(EntityKind.PROCEDURE, name);
        this.procedureType = procedureType;
    }

    public void addArgument(VariableEntity argument) {
        argument.parent = this;
        arguments.add(argument);
    }

    public void setReturnVariable(VariableEntity variable) {
        variable.parent = this;
        returnVariable = variable;
    }

    @JsonIgnore
    public boolean isFunction() {
        return procedureType == ProcedureType.FUNCTION;
    }

    /** Declared with the {@code module} prefix, i.e. an interface for or body of a separate module procedure. */
    @JsonIgnore
    public boolean isSeparateModuleProcedure() {
        return procedureType == ProcedureType.MODULE_PROCEDURE || attributes.contains("module");
    }

    @Override
    public List<FortranEntity> ownedMembers() {
        List<FortranEntity> all = new ArrayList<>(arguments);
        if (returnVariable != null) {
            all.add(returnVariable);
        }
        all.addAll(children);
        return all;
    }
}
