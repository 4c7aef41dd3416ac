package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Common record of every Fortran construct. The {@link #kind} tag identifies the variant;
 * consumers switch on it instead of relying on virtual dispatch.
 * <p>
 * {@link #children} is the only ownership edge. {@link #parent} and every {@link EntityRef}
 * are lookups into the tree and never own what they point to.
 */
public abstract class FortranEntity {
    public final EntityKind kind;
    public String name;
    public String documentation = "";

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public EntityMetadata metadata = new EntityMetadata();

    public Permission permission = Permission.PUBLIC;

    /** Set when the declaration itself names an access attribute; defaults never override it. */
    @JsonIgnore
    public boolean permissionExplicit;
    public String sourceFile;
    public int lineStart;
    public int lineEnd;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String externalUrl;

    /** Effective display list after inheritance; filled by correlation. */
    @JsonIgnore
    public List<String> effectiveDisplay = List.of();

    /** Whether the owner's effective display admits this entity; filled by correlation. */
    public boolean visible = true;

    @JsonIgnore
    public FortranEntity parent;

    /** Raw documentation fragments in arrival order, consumed when the entity is sealed. */
    @JsonIgnore
    public final List<String> docFragments = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<FortranEntity> children = new ArrayList<>();

    protected FortranEntity(EntityKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public void addChild(FortranEntity child) {
        child.parent = this;
        children.add(child);
    }

    public void setExplicitPermission(Permission explicit) {
        this.permission = explicit;
        this.permissionExplicit = true;
    }

    public void removeChild(FortranEntity child) {
        children.remove(child);
    }

    public <T extends FortranEntity> List<T> childrenOf(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (FortranEntity child : children) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** Entities owned outside {@link #children}, e.g. procedure arguments. */
    @JsonIgnore
    public List<FortranEntity> ownedMembers() {
        return children;
    }

    public boolean nameMatches(String other) {
        return name != null && other != null && name.equalsIgnoreCase(other.trim());
    }

    @JsonIgnore
    public String getLowerName() {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isExternal() {
        return externalUrl != null;
    }

    @JsonIgnore
    public boolean isDocumented() {
        return documentation != null && !documentation.isEmpty();
    }

    /** Closest enclosing entity of one of the given kinds, or {@code null}. */
    public FortranEntity enclosing(EntityKind... kinds) {
        FortranEntity current = parent;
        while (current != null) {
            for (EntityKind k : kinds) {
                if (current.kind == k) {
                    return current;
                }
            }
            current = current.parent;
        }
        return null;
    }

    @Override
    public String toString() {
        return kind.getLabel() + " " + name;
    }
}
