package com.columncascade.core.store;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.TypeMapping;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Persisted form of a workbook: the four tables plus the column id high-water mark.
 *
 * @param stages rows of the {@code stages} table
 * @param artifacts rows of the {@code artifacts} table
 * @param columns rows of the {@code columns} table
 * @param dataTypeMappings rows of the {@code data_type_mappings} table
 * @param columnIdHighWaterMark largest column id ever issued
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"stages", "artifacts", "columns", "data_type_mappings", "column_id_high_water_mark"})
public record WorkbookDocument(
    @JsonProperty("stages") List<Stage> stages,
    @JsonProperty("artifacts") List<Artifact> artifacts,
    @JsonProperty("columns") List<Column> columns,
    @JsonProperty("data_type_mappings") List<TypeMapping> dataTypeMappings,
    @JsonProperty("column_id_high_water_mark") long columnIdHighWaterMark
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public WorkbookDocument {
        stages = stages == null ? List.of() : List.copyOf(stages);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        columns = columns == null ? List.of() : List.copyOf(columns);
        dataTypeMappings = dataTypeMappings == null ? List.of() : List.copyOf(dataTypeMappings);
        if (columnIdHighWaterMark < 0) {
            columnIdHighWaterMark = 0;
        }
    }
}
