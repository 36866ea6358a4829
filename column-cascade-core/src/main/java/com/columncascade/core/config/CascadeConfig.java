package com.columncascade.core.config;

import com.columncascade.core.model.TypeMapping;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of the cascading engine.
 *
 * <p>Loaded from {@code cascade.yaml}. Every section is optional; missing sections
 * fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * lookup:
 *   limit: 3
 *
 * ordering:
 *   attributeStart: 100
 *   offset: 100
 *
 * technicalFields:
 *   - layer: gold
 *     name: __gold_lastChanged_DT
 *     dataType: TIMESTAMP
 *     order: 900
 *   - layer: gold
 *     name: __goldPartition_LoadYear
 *     dataType: INT
 *     order: 905
 *     takeToNextLevel: false
 *   - layer: gold
 *     name: __gold_measure_type
 *     dataType: STRING
 *     artifactType: fact
 *     order: 911
 *
 * typeMappings:
 *   - source_platform: sql_server
 *     source_data_type: NVARCHAR
 *     target_platform: databricks
 *     target_data_type: STRING
 * }</pre>
 *
 * @param lookup lookup relation settings
 * @param ordering order assignment settings
 * @param technicalFields technical fields injected by main cascades
 * @param typeMappings additional data type mappings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeConfig(
    @JsonProperty("lookup") LookupConfig lookup,
    @JsonProperty("ordering") OrderingConfig ordering,
    @JsonProperty("technicalFields") List<TechnicalFieldDefinition> technicalFields,
    @JsonProperty("typeMappings") List<TypeMapping> typeMappings
) {
    /** Default number of columns a lookup relation yields. */
    public static final int DEFAULT_LOOKUP_LIMIT = 3;

    /** Default first order value of the attribute block. */
    public static final int DEFAULT_ATTRIBUTE_START = 100;

    /** Default offset added to upstream order values. */
    public static final int DEFAULT_ORDER_OFFSET = 100;

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public CascadeConfig {
        if (lookup == null) {
            lookup = new LookupConfig(DEFAULT_LOOKUP_LIMIT);
        }
        if (ordering == null) {
            ordering = new OrderingConfig(DEFAULT_ATTRIBUTE_START, DEFAULT_ORDER_OFFSET);
        }
        if (technicalFields == null) {
            technicalFields = defaultTechnicalFields();
        }
        if (typeMappings == null) {
            typeMappings = List.of();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CascadeConfig defaults() {
        return new CascadeConfig(null, null, null, null);
    }

    /**
     * Returns the built-in technical fields per layer.
     *
     * @return default technical field definitions
     */
    public static List<TechnicalFieldDefinition> defaultTechnicalFields() {
        return List.of(
            new TechnicalFieldDefinition("bronze", "__SourceSystem", "STRING", null, 900, true),
            new TechnicalFieldDefinition("bronze", "__SourceFileName", "STRING", null, 901, true),
            new TechnicalFieldDefinition("bronze", "__SourceFilePath", "STRING", null, 902, true),
            new TechnicalFieldDefinition("bronze", "__bronze_insertDT", "TIMESTAMP", null, 903, true),
            new TechnicalFieldDefinition("bronze", "__bronzePartition_InsertYear", "INT", null, 904, false),
            new TechnicalFieldDefinition("bronze", "__bronzePartition_InsertMonth", "INT", null, 905, false),
            new TechnicalFieldDefinition("bronze", "__bronzePartition_InsertDate", "INT", null, 906, false),
            new TechnicalFieldDefinition("silver", "__silver_lastChanged_DT", "TIMESTAMP", null, 900, true),
            new TechnicalFieldDefinition("silver", "__silver_validFrom", "TIMESTAMP", "dimension", 910, true),
            new TechnicalFieldDefinition("silver", "__silver_validTo", "TIMESTAMP", "dimension", 911, true),
            new TechnicalFieldDefinition("silver", "__silver_isCurrent", "BOOLEAN", "dimension", 912, true),
            new TechnicalFieldDefinition("gold", "__gold_lastChanged_DT", "TIMESTAMP", null, 900, true),
            new TechnicalFieldDefinition("gold", "__gold_aggregation_level", "STRING", "fact", 910, true),
            new TechnicalFieldDefinition("gold", "__gold_measure_type", "STRING", "fact", 911, true),
            new TechnicalFieldDefinition("mart", "__mart_lastChanged_DT", "TIMESTAMP", null, 900, true)
        );
    }

    /**
     * Lookup relation settings.
     *
     * @param limit maximum number of columns a lookup relation yields
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LookupConfig(
        @JsonProperty("limit") Integer limit
    ) {
        public LookupConfig {
            if (limit == null || limit < 0) {
                limit = DEFAULT_LOOKUP_LIMIT;
            }
        }
    }

    /**
     * Order assignment settings.
     *
     * @param attributeStart first order value of the attribute block
     * @param offset offset added to the upstream order of non-attribute columns
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrderingConfig(
        @JsonProperty("attributeStart") Integer attributeStart,
        @JsonProperty("offset") Integer offset
    ) {
        public OrderingConfig {
            if (attributeStart == null) {
                attributeStart = DEFAULT_ATTRIBUTE_START;
            }
            if (offset == null) {
                offset = DEFAULT_ORDER_OFFSET;
            }
        }
    }
}
