package com.columncascade.core.engine;

import com.columncascade.core.model.Column;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of cascading one target artifact.
 *
 * @param artifactId target artifact id
 * @param referencesProcessed upstream references a relation strategy was applied to
 * @param referencesSkipped upstream references skipped (unknown artifact, stage or relation kind)
 * @param addedColumns columns added to the target, with their assigned ids and order
 * @param duplicatesSkipped candidates dropped because the target already had the name
 * @param warnings non-fatal issues in the order they were found
 */
public record ArtifactCascadeResult(
    String artifactId,
    int referencesProcessed,
    int referencesSkipped,
    List<Column> addedColumns,
    int duplicatesSkipped,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ArtifactCascadeResult {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        addedColumns = addedColumns == null ? List.of() : List.copyOf(addedColumns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates the result of an artifact without upstream references.
     *
     * @param artifactId target artifact id
     * @return result with nothing processed
     */
    public static ArtifactCascadeResult noOp(String artifactId) {
        return new ArtifactCascadeResult(artifactId, 0, 0, List.of(), 0, List.of());
    }

    /**
     * Returns true if upstream references were declared but none could be processed.
     *
     * @return true for a fully skipped artifact
     */
    public boolean isSkipped() {
        return referencesProcessed == 0 && referencesSkipped > 0;
    }
}
