package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/** A module or, with kind {@link EntityKind#SUBMODULE}, a submodule. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModuleEntity extends ScopingUnit {
    public String ancestorModuleName;
    public String parentSubmoduleName;
    public EntityRef ancestorModule;
    public EntityRef parentSubmodule;

    public ModuleEntity(String name) {
        super(EntityKind.MODULE, name);
    }

    private ModuleEntity(EntityKind kind, String name) {
        super(kind, name);
    }

    public static ModuleEntity submodule(String name, String ancestorModuleName, String parentSubmoduleName) {
        ModuleEntity submodule = new ModuleEntity(EntityKind.SUBMODULE, name);
        submodule.ancestorModuleName = ancestorModuleName;
        submodule.parentSubmoduleName = parentSubmoduleName;
        submodule.defaultAccess = Permission.PRIVATE;
        return submodule;
    }

    @JsonIgnore
    public boolean isSubmodule() {
        return kind == EntityKind.SUBMODULE;
    }
}
