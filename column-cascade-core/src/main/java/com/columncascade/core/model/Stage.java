package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named layer of the pipeline (landing, bronze, silver, gold, mart, semantic model).
 *
 * <p>Stages are created during pipeline setup and are immutable once artifacts
 * reference them.
 *
 * @param stageId stage identifier (e.g. {@code s3})
 * @param stageName display name (e.g. {@code 3_gold})
 * @param platform target platform of the stage's artifacts
 * @param side naming side of the stage
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Stage(
    @JsonProperty("stage_id") String stageId,
    @JsonProperty("stage_name") String stageName,
    @JsonProperty("platform") String platform,
    @JsonProperty("side") StageSide side
) {
    /**
     * Compact constructor with validation.
     */
    public Stage {
        Objects.requireNonNull(stageId, "stageId must not be null");
        if (stageName == null) {
            stageName = stageId;
        }
        if (platform == null) {
            platform = "";
        }
        if (side == null) {
            side = StageSide.SOURCE;
        }
    }

    /**
     * Returns the pipeline layer this stage belongs to.
     *
     * @return resolved layer, or {@code null} if neither id nor name identify one
     */
    @JsonIgnore
    public PipelineLayer layer() {
        return PipelineLayer.resolve(stageId, stageName);
    }

    /**
     * Returns true if this stage exposes business-facing naming.
     *
     * @return true for business-side stages
     */
    @JsonIgnore
    public boolean isBusinessSide() {
        return side == StageSide.BUSINESS;
    }
}
