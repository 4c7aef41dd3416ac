package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum EntityKind {
    SOURCE_FILE("sourcefile"),
    MODULE("module"),
    SUBMODULE("submodule"),
    PROGRAM("program"),
    PROCEDURE("proc"),
    INTERFACE("interface"),
    ABSTRACT_INTERFACE("absinterface"),
    DERIVED_TYPE("type"),
    BOUND_PROCEDURE("boundproc"),
    VARIABLE("variable"),
    BLOCK_DATA("blockdata"),
    COMMON_BLOCK("common"),
    ENUM("enum"),
    NAMELIST("namelist"),
    GENERIC_SOURCE("genericsource");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static EntityKind forLabel(String label) {
        return fromLabel(label).orElseThrow(() -> new IllegalArgumentException("unknown entity kind " + label));
    }

    public static Optional<EntityKind> fromLabel(String label) {
        for (EntityKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public boolean isContainer() {
        return this != VARIABLE && this != COMMON_BLOCK && this != NAMELIST && this != BOUND_PROCEDURE;
    }
}
