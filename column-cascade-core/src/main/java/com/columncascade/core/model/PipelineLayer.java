package com.columncascade.core.model;

import java.util.Locale;

/**
 * Known layers of the pipeline, in flow order.
 *
 * <p>A stage is mapped to a layer by its identifier ({@code s0}..{@code s5} or the
 * layer name) and, failing that, by keywords in its display name.
 */
public enum PipelineLayer {
    LANDING("s0", "landing", "drop"),
    BRONZE("s1", "bronze"),
    SILVER("s2", "silver"),
    GOLD("s3", "gold"),
    MART("s4", "mart"),
    SEMANTIC_MODEL("s5", "semantic", "pbi");

    private final String stageId;
    private final String[] keywords;

    PipelineLayer(String stageId, String... keywords) {
        this.stageId = stageId;
        this.keywords = keywords;
    }

    /**
     * Returns the conventional stage identifier of this layer.
     *
     * @return stage id such as {@code s2}
     */
    public String stageId() {
        return stageId;
    }

    /**
     * Returns the lowercase layer name used in configuration files.
     *
     * @return layer name such as {@code semantic_model}
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a layer from a stage identifier alone.
     *
     * @param stageId stage identifier
     * @return matching layer, or {@code null}
     */
    public static PipelineLayer fromStageId(String stageId) {
        return resolve(stageId, null);
    }

    /**
     * Resolves a layer from a stage identifier, falling back to the stage name.
     *
     * @param stageId stage identifier, may be null
     * @param stageName stage display name, may be null
     * @return matching layer, or {@code null} if nothing matches
     */
    public static PipelineLayer resolve(String stageId, String stageName) {
        PipelineLayer byId = byExactName(stageId);
        if (byId != null) {
            return byId;
        }
        PipelineLayer byName = byExactName(stageName);
        if (byName != null) {
            return byName;
        }
        return byKeyword(stageName);
    }

    private static PipelineLayer byExactName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PipelineLayer layer : values()) {
            if (layer.stageId.equals(normalized) || layer.configName().equals(normalized)) {
                return layer;
            }
        }
        return null;
    }

    private static PipelineLayer byKeyword(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (PipelineLayer layer : values()) {
            for (String keyword : layer.keywords) {
                if (normalized.contains(keyword)) {
                    return layer;
                }
            }
        }
        return null;
    }
}
