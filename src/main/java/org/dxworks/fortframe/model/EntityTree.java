package org.dxworks.fortframe.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Traversals over the ownership tree, including members owned outside {@code children}. */
public final class EntityTree {

    private EntityTree() {
        // utility class
    }

    /** The root and all its descendants, in pre-order. */
    public static List<FortranEntity> flatten(FortranEntity root) {
        List<FortranEntity> all = new ArrayList<>();
        Deque<FortranEntity> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FortranEntity current = stack.pop();
            all.add(current);
            List<FortranEntity> members = current.ownedMembers();
            for (int i = members.size() - 1; i >= 0; i--) {
                stack.push(members.get(i));
            }
        }
        return all;
    }
}
