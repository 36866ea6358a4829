package com.columncascade.core.relation;

import com.columncascade.core.model.ColumnGroup;

import java.util.Objects;

/**
 * Candidate column produced by a relation strategy, before identity and order are assigned.
 *
 * @param name resolved column name
 * @param businessName business name carried from upstream, may be null
 * @param dataType data type after platform translation
 * @param group group classification
 * @param upstreamOrder declared order of the upstream column or technical field
 * @param comment column comment
 * @param sourceColumnName upstream column this candidate derives from
 * @param lookupFields lookup field list carried from upstream
 * @param etlSimpleTransformation simple transformation carried from upstream
 * @param aiTransformationPrompt transformation prompt carried from upstream
 * @param etlAiTransformation suggested transformation carried from upstream
 */
public record DerivedColumn(
    String name,
    String businessName,
    String dataType,
    ColumnGroup group,
    int upstreamOrder,
    String comment,
    String sourceColumnName,
    String lookupFields,
    String etlSimpleTransformation,
    String aiTransformationPrompt,
    String etlAiTransformation
) {
    /**
     * Compact constructor with validation.
     */
    public DerivedColumn {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (dataType == null) {
            dataType = "";
        }
        if (group == null) {
            group = ColumnGroup.UNCLASSIFIED;
        }
    }

    /**
     * Creates an injected technical column.
     *
     * @param name field name
     * @param dataType field data type
     * @param order declared order of the field
     * @param comment column comment
     * @return technical candidate
     */
    public static DerivedColumn technical(String name, String dataType, int order, String comment) {
        return new DerivedColumn(name, null, dataType, ColumnGroup.TECHNICAL, order, comment, name,
            null, null, null, null);
    }
}
