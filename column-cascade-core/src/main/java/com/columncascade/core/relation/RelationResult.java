package com.columncascade.core.relation;

import com.columncascade.core.model.RelationKind;
import com.columncascade.core.model.StageTransition;

import java.util.List;

/**
 * Candidate downstream column set produced for one upstream reference.
 *
 * @param kind relation kind that produced the result, null for an unrecognized kind
 * @param transition stage transition of the reference
 * @param columns candidates derived from upstream columns
 * @param technicalColumns stage and artifact-kind technical fields to inject
 * @param warnings non-fatal issues encountered while processing
 */
public record RelationResult(
    RelationKind kind,
    StageTransition transition,
    List<DerivedColumn> columns,
    List<DerivedColumn> technicalColumns,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public RelationResult {
        if (transition == null) {
            transition = StageTransition.UNSPECIFIED;
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
        technicalColumns = technicalColumns == null ? List.of() : List.copyOf(technicalColumns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates an empty result carrying warnings only.
     *
     * @param kind relation kind, may be null
     * @param warnings warning messages
     * @return empty result
     */
    public static RelationResult empty(RelationKind kind, List<String> warnings) {
        return new RelationResult(kind, StageTransition.UNSPECIFIED, List.of(), List.of(), warnings);
    }

    public boolean isEmpty() {
        return columns.isEmpty() && technicalColumns.isEmpty();
    }
}
