package com.columncascade.core.relation.impl;

import com.columncascade.core.config.TechnicalFieldDefinition;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.PipelineLayer;
import com.columncascade.core.model.RelationKind;
import com.columncascade.core.model.StageTransition;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.TechnicalFieldCatalog;
import com.columncascade.core.relation.base.AbstractRelationStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Full propagation: every upstream column flows downstream.
 *
 * <p>Partition markers and technical fields marked {@code takeToNextLevel: false}
 * are not carried over.
 *
 * <p>For a known stage transition the target layer's technical fields are added,
 * followed by the fields specific to the target's artifact kind (the SCD2 validity
 * window for silver dimensions, grain and measure markers for gold facts).
 * An unspecified transition injects nothing.
 */
public class MainRelation extends AbstractRelationStrategy {

    private final TechnicalFieldCatalog technicalFields;

    public MainRelation(TechnicalFieldCatalog technicalFields) {
        this.technicalFields = Objects.requireNonNull(technicalFields, "technicalFields must not be null");
    }

    @Override
    public RelationKind getKind() {
        return RelationKind.MAIN;
    }

    @Override
    public String getDescription() {
        return "Propagates every upstream column except partition markers and injects stage technical fields";
    }

    @Override
    public RelationResult process(List<Column> upstreamColumns, RelationContext context) {
        List<String> warnings = new ArrayList<>();
        List<Column> carried = upstreamColumns.stream()
            .filter(column -> technicalFields.propagates(column.columnName()))
            .toList();
        if (carried.size() < upstreamColumns.size()) {
            log.debug("main {} -> {}: {} partition or layer-local columns not carried",
                context.upstreamArtifactId(), context.targetStageId(), upstreamColumns.size() - carried.size());
        }
        List<DerivedColumn> columns = deriveAll(carried, context, warnings);
        List<DerivedColumn> technical = technicalColumns(context);
        log.debug("main {} -> {}: {} columns, {} technical fields",
            context.upstreamArtifactId(), context.targetStageId(), columns.size(), technical.size());
        return buildResult(columns, technical, warnings, context);
    }

    private List<DerivedColumn> technicalColumns(RelationContext context) {
        StageTransition transition = context.transition();
        if (!transition.isKnown()) {
            return List.of();
        }
        PipelineLayer layer = transition.to();
        List<DerivedColumn> technical = new ArrayList<>();
        for (TechnicalFieldDefinition field : technicalFields.fieldsFor(layer, context.targetArtifactType())) {
            technical.add(DerivedColumn.technical(field.name(), field.dataType(), field.order(),
                "Technical column for " + layer.configName() + " stage"));
        }
        return technical;
    }
}
