package com.columncascade.core.model;

/**
 * Transition between two consecutive pipeline layers.
 *
 * <p>Pairs that are not consecutive known layers map to {@link #UNSPECIFIED}, which
 * carries no stage-specific technical fields.
 */
public enum StageTransition {
    LANDING_TO_BRONZE(PipelineLayer.LANDING, PipelineLayer.BRONZE),
    BRONZE_TO_SILVER(PipelineLayer.BRONZE, PipelineLayer.SILVER),
    SILVER_TO_GOLD(PipelineLayer.SILVER, PipelineLayer.GOLD),
    GOLD_TO_MART(PipelineLayer.GOLD, PipelineLayer.MART),
    MART_TO_SEMANTIC_MODEL(PipelineLayer.MART, PipelineLayer.SEMANTIC_MODEL),
    UNSPECIFIED(null, null);

    private final PipelineLayer from;
    private final PipelineLayer to;

    StageTransition(PipelineLayer from, PipelineLayer to) {
        this.from = from;
        this.to = to;
    }

    public PipelineLayer from() {
        return from;
    }

    public PipelineLayer to() {
        return to;
    }

    /**
     * Returns true for every transition except {@link #UNSPECIFIED}.
     *
     * @return true if this is a known transition
     */
    public boolean isKnown() {
        return this != UNSPECIFIED;
    }

    /**
     * Maps an ordered pair of layers to a transition.
     *
     * @param source upstream layer, may be null
     * @param target downstream layer, may be null
     * @return matching transition, or {@link #UNSPECIFIED}
     */
    public static StageTransition of(PipelineLayer source, PipelineLayer target) {
        if (source == null || target == null) {
            return UNSPECIFIED;
        }
        for (StageTransition transition : values()) {
            if (transition.from == source && transition.to == target) {
                return transition;
            }
        }
        return UNSPECIFIED;
    }
}
