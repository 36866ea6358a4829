package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A column of an artifact, as stored in the {@code columns} table.
 *
 * @param stageId owning artifact's stage id
 * @param stageName owning artifact's stage name
 * @param artifactId owning artifact id
 * @param artifactName owning artifact name
 * @param columnId globally unique column identifier
 * @param columnName resolved column name
 * @param order declared order used for downstream rendering
 * @param dataType platform-specific data type
 * @param columnComment free-text comment
 * @param columnBusinessName business name, may be blank
 * @param columnGroup group classification
 * @param sourceColumnName name of the upstream column this one derives from
 * @param lookupFields lookup field list
 * @param etlSimpleTransformation simple transformation expression
 * @param aiTransformationPrompt prompt for a suggested transformation
 * @param etlAiTransformation suggested transformation expression
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Column(
    @JsonProperty("stage_id") String stageId,
    @JsonProperty("stage_name") String stageName,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("artifact_name") String artifactName,
    @JsonProperty("column_id") long columnId,
    @JsonProperty("column_name") String columnName,
    @JsonProperty("order") int order,
    @JsonProperty("data_type") String dataType,
    @JsonProperty("column_comment") String columnComment,
    @JsonProperty("column_business_name") String columnBusinessName,
    @JsonProperty("column_group") ColumnGroup columnGroup,
    @JsonProperty("source_column_name") String sourceColumnName,
    @JsonProperty("lookup_fields") String lookupFields,
    @JsonProperty("etl_simple_transformation") String etlSimpleTransformation,
    @JsonProperty("ai_transformation_prompt") String aiTransformationPrompt,
    @JsonProperty("etl_ai_transformation") String etlAiTransformation
) {
    /**
     * Compact constructor with validation.
     */
    public Column {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        if (columnName == null) {
            columnName = "";
        }
        if (dataType == null) {
            dataType = "";
        }
        if (columnGroup == null) {
            columnGroup = ColumnGroup.UNCLASSIFIED;
        }
    }

    /**
     * Creates a column with only the fields the cascading engine needs.
     *
     * @param artifactId owning artifact id
     * @param columnId column identifier
     * @param columnName column name
     * @param order declared order
     * @param dataType data type
     * @param group group classification
     * @return new column
     */
    public static Column of(String artifactId, long columnId, String columnName, int order,
                            String dataType, ColumnGroup group) {
        return new Column(null, null, artifactId, null, columnId, columnName, order, dataType,
            null, null, group, null, null, null, null, null);
    }

    /**
     * Returns the name this column resolves to downstream: the business name when
     * present and non-blank, otherwise the technical name.
     *
     * @return resolved name, never null
     */
    @JsonIgnore
    public String resolvedName() {
        if (columnBusinessName != null && !columnBusinessName.isBlank()) {
            return columnBusinessName.trim();
        }
        return columnName;
    }

    /**
     * Returns the classification used for ordering and relation filtering.
     *
     * <p>An explicit group wins; an unclassified column is classified by its name.
     *
     * @return effective group
     */
    @JsonIgnore
    public ColumnGroup effectiveGroup() {
        if (columnGroup != ColumnGroup.UNCLASSIFIED) {
            return columnGroup;
        }
        return ColumnGroup.inferFromName(columnName);
    }

    public Column withColumnId(long newColumnId) {
        return new Column(stageId, stageName, artifactId, artifactName, newColumnId, columnName, order,
            dataType, columnComment, columnBusinessName, columnGroup, sourceColumnName, lookupFields,
            etlSimpleTransformation, aiTransformationPrompt, etlAiTransformation);
    }

    public Column withOrder(int newOrder) {
        return new Column(stageId, stageName, artifactId, artifactName, columnId, columnName, newOrder,
            dataType, columnComment, columnBusinessName, columnGroup, sourceColumnName, lookupFields,
            etlSimpleTransformation, aiTransformationPrompt, etlAiTransformation);
    }
}
