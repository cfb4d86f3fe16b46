package org.irdump.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Copies list-valued node properties into unmodifiable lists. {@code null} becomes an empty list.
 */
public final class NodeLists {

    private NodeLists() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param list The list to copy, may be {@code null} and may contain {@code null} elements.
     * @return An unmodifiable snapshot of the list.
     */
    public static <T> List<T> copyOf(List<T> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
