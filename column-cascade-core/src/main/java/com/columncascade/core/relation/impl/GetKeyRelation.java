package com.columncascade.core.relation.impl;

import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.RelationKind;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.base.AbstractRelationStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Foreign-key extraction: only surrogate and business keys of the upstream flow downstream.
 */
public class GetKeyRelation extends AbstractRelationStrategy {

    @Override
    public RelationKind getKind() {
        return RelationKind.GET_KEY;
    }

    @Override
    public String getDescription() {
        return "Copies the surrogate and business keys of a dimension";
    }

    @Override
    public RelationResult process(List<Column> upstreamColumns, RelationContext context) {
        List<String> warnings = new ArrayList<>();
        if (context.sourceArtifactType() != ArtifactType.DIMENSION) {
            log.debug("get_key upstream {} is a {}, not a dimension",
                context.upstreamArtifactId(), context.sourceArtifactType().value());
        }
        List<Column> keys = upstreamColumns.stream()
            .filter(column -> column.effectiveGroup().isKey())
            .toList();
        List<DerivedColumn> columns = deriveAll(keys, context, warnings);
        return buildResult(columns, List.of(), warnings, context);
    }
}
