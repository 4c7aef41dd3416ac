package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.FortranEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Names visible inside one scoping unit. Lookup goes through local declarations, then use-associated
 * names, then the host scope; within a layer candidates keep declaration order.
 */
class Scope {
    static final Scope EMPTY = new Scope(Map.of(), Map.of(), null);

    private final Map<String, List<FortranEntity>> local;
    private final Map<String, List<FortranEntity>> imported;
    private final Scope host;

    Scope(Map<String, List<FortranEntity>> local, Map<String, List<FortranEntity>> imported, Scope host) {
        this.local = local;
        this.imported = imported;
        this.host = host;
    }

    /** Candidates of the innermost layer that declares {@code name}. */
    List<FortranEntity> lookup(String name) {
        String key = key(name);
        for (Scope scope = this; scope != null; scope = scope.host) {
            List<FortranEntity> found = scope.local.get(key);
            if (found == null) {
                found = scope.imported.get(key);
            }
            if (found != null && !found.isEmpty()) {
                return found;
            }
        }
        return List.of();
    }

    /**
     * First candidate named {@code name} whose kind is one of {@code kinds}, searching layer by layer.
     * Without kinds the first candidate of the innermost declaring layer wins.
     */
    FortranEntity find(String name, EntityKind... kinds) {
        if (kinds.length == 0) {
            List<FortranEntity> found = lookup(name);
            return found.isEmpty() ? null : found.get(0);
        }
        String key = key(name);
        for (Scope scope = this; scope != null; scope = scope.host) {
            FortranEntity found = firstOfKind(scope.local.get(key), kinds);
            if (found == null) {
                found = firstOfKind(scope.imported.get(key), kinds);
            }
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static FortranEntity firstOfKind(List<FortranEntity> candidates, EntityKind... kinds) {
        if (candidates == null) {
            return null;
        }
        for (FortranEntity candidate : candidates) {
            for (EntityKind kind : kinds) {
                if (candidate.kind == kind) {
                    return candidate;
                }
            }
        }
        return null;
    }

    static String key(String name) {
        return name == null ? "" : name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    static void declare(Map<String, List<FortranEntity>> names, String name, FortranEntity entity) {
        List<FortranEntity> candidates = names.computeIfAbsent(key(name), k -> new ArrayList<>());
        for (FortranEntity existing : candidates) {
            if (existing == entity) {
                return;
            }
        }
        candidates.add(entity);
    }

    static Map<String, List<FortranEntity>> names() {
        return new LinkedHashMap<>();
    }
}
