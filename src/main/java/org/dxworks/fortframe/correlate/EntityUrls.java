package org.dxworks.fortframe.correlate;

import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.FortranEntity;

/**
 * Documentation page addresses of entities, relative to a project base URL. Program units and types
 * get their own page; members are anchors on their owner's page.
 */
public final class EntityUrls {

    private EntityUrls() {
        // utility class
    }

    public static String urlFor(FortranEntity entity, String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (hasOwnPage(entity.kind) || entity.parent == null) {
            return base + "/" + entity.kind.getLabel() + "/" + pageName(entity) + ".html";
        }
        FortranEntity owner = entity.parent;
        while (owner.parent != null && !hasOwnPage(owner.kind)) {
            owner = owner.parent;
        }
        return urlFor(owner, baseUrl) + "#" + entity.kind.getLabel() + "-" + pageName(entity);
    }

    private static boolean hasOwnPage(EntityKind kind) {
        return switch (kind) {
            case MODULE, SUBMODULE, PROGRAM, PROCEDURE, INTERFACE, ABSTRACT_INTERFACE, DERIVED_TYPE,
                 BLOCK_DATA, SOURCE_FILE -> true;
            default -> false;
        };
    }

    private static String pageName(FortranEntity entity) {
        return entity.getLowerName().replaceAll("[^a-z0-9_]+", "_");
    }
}
