package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entities that carry a specification part: modules, submodules, programs, procedures and block data.
 */
public abstract class ScopingUnit extends FortranEntity {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<UseStatement> uses = new ArrayList<>();

    /** Access applied to children without an explicit attribute. */
    public Permission defaultAccess = Permission.PUBLIC;

    /** Lower-cased names exported by this unit, including re-exported use-associated names. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Set<String> publicNames = new LinkedHashSet<>();

    /** Lower-cased names made private by an attribute statement without a local declaration. */
    @JsonIgnore
    public final Set<String> privateNames = new LinkedHashSet<>();

    /** Lower-cased call chains as scanned from executable statements, e.g. {@code [obj, method]}. */
    @JsonIgnore
    public final List<List<String>> callChains = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<EntityRef> calls = new ArrayList<>();

    /** Standalone attribute statements ({@code public :: a}) waiting to be applied at seal time. */
    @JsonIgnore
    public final Map<String, List<String>> pendingAttributes = new LinkedHashMap<>();

    @JsonIgnore
    public final Map<String, String> pendingParameters = new LinkedHashMap<>();

    protected ScopingUnit(EntityKind kind, String name) {
        super(kind, name);
    }
}
