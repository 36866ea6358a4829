package com.columncascade.core.relation;

import com.columncascade.core.config.CascadeConfig;
import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.PipelineLayer;
import com.columncascade.core.model.RelationKind;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.StageTransition;
import com.columncascade.core.relation.impl.GetKeyRelation;
import com.columncascade.core.relation.impl.LookupRelation;
import com.columncascade.core.relation.impl.MainRelation;
import com.columncascade.core.relation.impl.PbiRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches an upstream column set to the strategy of its relation kind.
 *
 * <p>The processor is pure: it never touches the store. An unrecognized relation kind
 * yields an empty result with a warning.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RelationProcessor processor = new RelationProcessor(CascadeConfig.defaults());
 * RelationResult result = processor.process("main", upstreamColumns, context);
 * }</pre>
 */
public class RelationProcessor {

    private static final Logger log = LoggerFactory.getLogger(RelationProcessor.class);

    private final Map<RelationKind, RelationStrategy> strategies;

    public RelationProcessor() {
        this(CascadeConfig.defaults());
    }

    public RelationProcessor(CascadeConfig config) {
        this(defaultStrategies(TechnicalFieldCatalog.from(config)));
    }

    /**
     * Creates a processor over the given strategies; a later strategy replaces an earlier
     * one of the same kind.
     *
     * @param strategies relation strategies
     */
    public RelationProcessor(List<RelationStrategy> strategies) {
        Map<RelationKind, RelationStrategy> byKind = new EnumMap<>(RelationKind.class);
        for (RelationStrategy strategy : strategies) {
            byKind.put(strategy.getKind(), strategy);
        }
        this.strategies = Collections.unmodifiableMap(byKind);
    }

    /**
     * Returns the built-in strategy for every relation kind.
     *
     * @param technicalFields technical fields injected by {@code main}
     * @return strategies in relation kind order
     */
    public static List<RelationStrategy> defaultStrategies(TechnicalFieldCatalog technicalFields) {
        return List.of(
            new MainRelation(technicalFields),
            new GetKeyRelation(),
            new LookupRelation(),
            new PbiRelation()
        );
    }

    /**
     * Processes an upstream column set for a relation kind given as text.
     *
     * @param relationKind relation kind as stored, e.g. {@code get_key}
     * @param upstreamColumns upstream columns in store order
     * @param context graph context
     * @return candidates, or an empty result with a warning for an unknown kind
     */
    public RelationResult process(String relationKind, List<Column> upstreamColumns, RelationContext context) {
        Optional<RelationKind> kind = RelationKind.fromValue(relationKind);
        if (kind.isEmpty()) {
            String message = String.format("Unknown relation kind '%s' for upstream %s; nothing cascaded",
                relationKind, context.upstreamArtifactId());
            log.warn(message);
            return RelationResult.empty(null, List.of(message));
        }
        return process(kind.get(), upstreamColumns, context);
    }

    /**
     * Processes an upstream column set for a relation kind.
     *
     * @param kind relation kind
     * @param upstreamColumns upstream columns in store order
     * @param context graph context
     * @return candidates
     */
    public RelationResult process(RelationKind kind, List<Column> upstreamColumns, RelationContext context) {
        RelationStrategy strategy = strategies.get(kind);
        if (strategy == null) {
            String message = String.format("No strategy registered for relation kind '%s'; nothing cascaded",
                kind.value());
            log.warn(message);
            return RelationResult.empty(kind, List.of(message));
        }
        List<Column> columns = upstreamColumns == null ? List.of() : upstreamColumns;
        return strategy.process(columns, context);
    }

    /**
     * Detects the kind of an artifact.
     *
     * @param name artifact name
     * @param explicitField explicit artifact type, may be blank
     * @return detected kind
     * @see ArtifactType#detect(String, String)
     */
    public ArtifactType detectArtifactType(String name, String explicitField) {
        return ArtifactType.detect(name, explicitField);
    }

    /**
     * Detects the transition between two stage identifiers.
     *
     * @param sourceStageId upstream stage id
     * @param targetStageId target stage id
     * @return known transition, or {@link StageTransition#UNSPECIFIED}
     */
    public StageTransition detectTransition(String sourceStageId, String targetStageId) {
        return StageTransition.of(PipelineLayer.fromStageId(sourceStageId), PipelineLayer.fromStageId(targetStageId));
    }

    /**
     * Detects the transition between two stages, using their names when ids are not conventional.
     *
     * @param source upstream stage
     * @param target target stage
     * @return known transition, or {@link StageTransition#UNSPECIFIED}
     */
    public StageTransition detectTransition(Stage source, Stage target) {
        return StageTransition.of(source.layer(), target.layer());
    }

    public Collection<RelationStrategy> strategies() {
        return strategies.values();
    }
}
