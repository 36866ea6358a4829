package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One row of the data type mapping table.
 *
 * @param sourcePlatform platform the source type belongs to
 * @param sourceDataType source data type
 * @param targetPlatform platform the target type belongs to
 * @param targetDataType target data type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeMapping(
    @JsonProperty("source_platform") String sourcePlatform,
    @JsonProperty("source_data_type") String sourceDataType,
    @JsonProperty("target_platform") String targetPlatform,
    @JsonProperty("target_data_type") String targetDataType
) {
    /**
     * Compact constructor with validation.
     */
    public TypeMapping {
        Objects.requireNonNull(sourcePlatform, "sourcePlatform must not be null");
        Objects.requireNonNull(sourceDataType, "sourceDataType must not be null");
        Objects.requireNonNull(targetPlatform, "targetPlatform must not be null");
        Objects.requireNonNull(targetDataType, "targetDataType must not be null");
    }
}
