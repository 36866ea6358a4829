package com.columncascade.core.relation.impl;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import com.columncascade.core.model.RelationKind;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.base.AbstractRelationStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Limited lookup: at most {@link RelationContext#lookupLimit()} columns, surrogate keys
 * first, then business keys, then attributes.
 *
 * <p>Within each group the upstream order is kept. Technical and unclassified columns
 * are never selected.
 */
public class LookupRelation extends AbstractRelationStrategy {

    private static final List<ColumnGroup> PRIORITY =
        List.of(ColumnGroup.SURROGATE_KEY, ColumnGroup.BUSINESS_KEY, ColumnGroup.ATTRIBUTE);

    @Override
    public RelationKind getKind() {
        return RelationKind.LOOKUP;
    }

    @Override
    public String getDescription() {
        return "Copies up to the lookup limit of key and attribute columns";
    }

    @Override
    public RelationResult process(List<Column> upstreamColumns, RelationContext context) {
        int limit = context.lookupLimit();
        List<Column> selected = new ArrayList<>();
        for (ColumnGroup group : PRIORITY) {
            for (Column column : upstreamColumns) {
                if (selected.size() >= limit) {
                    break;
                }
                if (column.effectiveGroup() == group) {
                    selected.add(column);
                }
            }
        }
        List<String> warnings = new ArrayList<>();
        List<DerivedColumn> columns = deriveAll(selected, context, warnings);
        return buildResult(columns, List.of(), warnings, context);
    }
}
