package com.columncascade.core.engine;

import com.columncascade.core.model.Column;

import java.util.Comparator;
import java.util.List;

/**
 * Rendering order of an artifact's columns: surrogate keys, business keys, attributes,
 * technical fields; then declared order; then id.
 */
public final class ColumnOrdering {

    /** Hierarchy comparator. */
    public static final Comparator<Column> HIERARCHY = Comparator
        .comparingInt((Column column) -> column.effectiveGroup().rank())
        .thenComparingInt(Column::order)
        .thenComparingLong(Column::columnId);

    private ColumnOrdering() {
        // Utility class
    }

    /**
     * Returns the columns sorted into rendering order.
     *
     * @param columns columns of one artifact
     * @return sorted copy
     */
    public static List<Column> sorted(List<Column> columns) {
        return columns.stream().sorted(HIERARCHY).toList();
    }

    /**
     * Returns true if the group ranks never decrease along the list.
     *
     * @param columns columns of one artifact in store order
     * @return true when the group hierarchy holds
     */
    public static boolean respectsHierarchy(List<Column> columns) {
        int previous = Integer.MIN_VALUE;
        for (Column column : columns) {
            int rank = column.effectiveGroup().rank();
            if (rank < previous) {
                return false;
            }
            previous = rank;
        }
        return true;
    }
}
