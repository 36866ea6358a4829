package com.columncascade.core.config;

import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.PipelineLayer;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Technical or audit field injected into artifacts of a pipeline layer.
 *
 * @param layer layer name ({@code bronze}, {@code silver}, ...) or stage id
 * @param name column name of the field
 * @param dataType data type of the field
 * @param artifactType artifact kind the field is limited to; null or blank means all kinds
 * @param order declared order of the field before the downstream offset is applied
 * @param takeToNextLevel whether {@code main} carries the field on to the next layer; defaults to true
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TechnicalFieldDefinition(
    @JsonProperty("layer") String layer,
    @JsonProperty("name") String name,
    @JsonProperty("dataType") String dataType,
    @JsonProperty("artifactType") String artifactType,
    @JsonProperty("order") Integer order,
    @JsonProperty("takeToNextLevel") Boolean takeToNextLevel
) {
    /**
     * Compact constructor with validation.
     */
    public TechnicalFieldDefinition {
        Objects.requireNonNull(layer, "layer must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (dataType == null) {
            dataType = "";
        }
        if (order == null) {
            order = 900;
        }
        if (takeToNextLevel == null) {
            takeToNextLevel = Boolean.TRUE;
        }
    }

    /**
     * Returns the pipeline layer this field belongs to.
     *
     * @return resolved layer, or {@code null} if {@link #layer()} names no known layer
     */
    @JsonIgnore
    public PipelineLayer pipelineLayer() {
        return PipelineLayer.fromStageId(layer);
    }

    /**
     * Returns true if the field applies to artifacts of the given kind.
     *
     * @param type artifact kind
     * @return true when no kind restriction is set or the kinds match
     */
    public boolean appliesTo(ArtifactType type) {
        if (artifactType == null || artifactType.isBlank()) {
            return true;
        }
        return ArtifactType.detect(null, artifactType) == type;
    }

    /**
     * Returns true if the field is limited to one artifact kind.
     *
     * @return true for artifact-kind-specific fields
     */
    @JsonIgnore
    public boolean isArtifactTypeSpecific() {
        return artifactType != null && !artifactType.isBlank();
    }
}
