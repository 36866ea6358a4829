package com.columncascade.core.engine;

import java.util.List;

/**
 * Outcome of a cleanup pass.
 *
 * @param duplicatesRemoved columns removed because an earlier column had the same artifact and name
 * @param columnsRenumbered columns whose id changed during re-enumeration
 * @param removed descriptions of the removed columns ({@code artifact.column #id})
 */
public record CleanupReport(
    int duplicatesRemoved,
    int columnsRenumbered,
    List<String> removed
) {
    /**
     * Compact constructor with defaults.
     */
    public CleanupReport {
        removed = removed == null ? List.of() : List.copyOf(removed);
    }

    public static CleanupReport empty() {
        return new CleanupReport(0, 0, List.of());
    }

    public CleanupReport withRenumbered(int renumbered) {
        return new CleanupReport(duplicatesRemoved, renumbered, removed);
    }
}
