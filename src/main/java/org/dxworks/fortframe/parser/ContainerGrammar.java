package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.model.EntityKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.dxworks.fortframe.parser.StatementKind.*;

/**
 * Statement kinds each container accepts, split into the specification part and the part after
 * {@code contains}. {@code END} is always accepted and handled separately.
 */
final class ContainerGrammar {

    private static final Set<StatementKind> SPECIFICATION = EnumSet.of(
            ACCESS_DEFAULT, PARAMETER, ATTRIBUTE, DERIVED_TYPE, INTERFACE, ENUM, COMMON, NAMELIST,
            VARIABLE, USE, IGNORED, CONTAINS);

    private static final Set<StatementKind> EXECUTION = EnumSet.of(
            FORMAT, BLOCK, ASSOCIATE, ARITHMETIC_IF, EXECUTABLE);

    private static final Map<EntityKind, Set<StatementKind>> BEFORE_CONTAINS = new EnumMap<>(EntityKind.class);
    private static final Map<EntityKind, Set<StatementKind>> AFTER_CONTAINS = new EnumMap<>(EntityKind.class);

    static {
        BEFORE_CONTAINS.put(EntityKind.SOURCE_FILE,
                EnumSet.of(MODULE, SUBMODULE, PROGRAM, SUBROUTINE, FUNCTION, BLOCK_DATA));

        Set<StatementKind> module = EnumSet.copyOf(SPECIFICATION);
        BEFORE_CONTAINS.put(EntityKind.MODULE, module);
        BEFORE_CONTAINS.put(EntityKind.SUBMODULE, module);
        Set<StatementKind> moduleContains = EnumSet.of(SUBROUTINE, FUNCTION, MODULE_PROCEDURE, ACCESS_DEFAULT);
        AFTER_CONTAINS.put(EntityKind.MODULE, moduleContains);
        AFTER_CONTAINS.put(EntityKind.SUBMODULE, moduleContains);

        Set<StatementKind> executable = EnumSet.copyOf(SPECIFICATION);
        executable.remove(ACCESS_DEFAULT);
        executable.addAll(EXECUTION);
        BEFORE_CONTAINS.put(EntityKind.PROGRAM, executable);
        BEFORE_CONTAINS.put(EntityKind.PROCEDURE, executable);
        Set<StatementKind> internal = EnumSet.of(SUBROUTINE, FUNCTION);
        AFTER_CONTAINS.put(EntityKind.PROGRAM, internal);
        AFTER_CONTAINS.put(EntityKind.PROCEDURE, internal);

        BEFORE_CONTAINS.put(EntityKind.INTERFACE,
                EnumSet.of(SUBROUTINE, FUNCTION, MODULE_PROCEDURE, IGNORED));
        BEFORE_CONTAINS.put(EntityKind.ABSTRACT_INTERFACE,
                EnumSet.of(SUBROUTINE, FUNCTION, IGNORED));

        BEFORE_CONTAINS.put(EntityKind.DERIVED_TYPE,
                EnumSet.of(ACCESS_DEFAULT, SEQUENCE, VARIABLE, CONTAINS, IGNORED));
        AFTER_CONTAINS.put(EntityKind.DERIVED_TYPE,
                EnumSet.of(ACCESS_DEFAULT, BOUND_PROCEDURE, FINAL));

        BEFORE_CONTAINS.put(EntityKind.BLOCK_DATA,
                EnumSet.of(PARAMETER, ATTRIBUTE, DERIVED_TYPE, COMMON, VARIABLE, USE, IGNORED));

        BEFORE_CONTAINS.put(EntityKind.ENUM, EnumSet.of(VARIABLE));
    }

    private ContainerGrammar() {
        // utility class
    }

    static boolean allows(EntityKind container, boolean inContains, StatementKind statement) {
        Map<EntityKind, Set<StatementKind>> table = inContains ? AFTER_CONTAINS : BEFORE_CONTAINS;
        Set<StatementKind> allowed = table.get(container);
        return allowed != null && allowed.contains(statement);
    }
}
