package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A name as written in source plus the entity it was resolved to, if any.
 * Unresolved references are kept so renderers can still show the name as plain text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "resolved", "targetKind", "targetFile", "externalUrl"})
public final class EntityRef {
    public final String name;

    @JsonIgnore
    public final FortranEntity target;

    public EntityRef(String name, FortranEntity target) {
        this.name = name;
        this.target = target;
    }

    public static EntityRef unresolved(String name) {
        return new EntityRef(name, null);
    }

    public static EntityRef to(FortranEntity target) {
        return new EntityRef(target.name, target);
    }

    public boolean isResolved() {
        return target != null;
    }

    public EntityKind getTargetKind() {
        return target == null ? null : target.kind;
    }

    public String getTargetFile() {
        return target == null ? null : target.sourceFile;
    }

    public String getExternalUrl() {
        return target == null ? null : target.externalUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRef other)) return false;
        return Objects.equals(name, other.name) && target == other.target;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, System.identityHashCode(target));
    }

    @Override
    public String toString() {
        return target == null ? name + " (unresolved)" : name + " -> " + target.kind.getLabel();
    }
}
