package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** One {@code use} statement with its only-list and renames. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class UseStatement {
    public String moduleName;
    public boolean intrinsic;
    public boolean only;
    public List<UseRename> entities = new ArrayList<>();
    public int line;

    /** Resolved module, or an unresolved placeholder. Overwritten on every correlation. */
    public EntityRef module;

    public UseStatement() {
    }

    public UseStatement(String moduleName) {
        this.moduleName = moduleName;
    }

    /** Local names under which {@code remoteName} becomes visible; empty if it is not imported. */
    public List<String> localNamesFor(String remoteName) {
        List<String> names = new ArrayList<>();
        for (UseRename rename : entities) {
            if (rename.useName.equalsIgnoreCase(remoteName)) {
                names.add(rename.localName.toLowerCase(Locale.ROOT));
            }
        }
        if (names.isEmpty() && !only) {
            names.add(remoteName.toLowerCase(Locale.ROOT));
        }
        return names;
    }

    public static class UseRename {
        public String localName;
        public String useName;

        public UseRename() {
        }

        public UseRename(String localName, String useName) {
            this.localName = localName;
            this.useName = useName;
        }
    }
}
