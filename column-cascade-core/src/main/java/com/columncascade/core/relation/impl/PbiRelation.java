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
import java.util.Locale;
import java.util.Set;

/**
 * Semantic-model cascade: keys and numeric measure attributes, no technical fields.
 */
public class PbiRelation extends AbstractRelationStrategy {

    private static final Set<String> NUMERIC_TYPES = Set.of(
        "int", "integer", "bigint", "smallint", "tinyint", "int64", "long", "short",
        "decimal", "numeric", "number", "float", "double", "real", "money", "smallmoney");

    @Override
    public RelationKind getKind() {
        return RelationKind.PBI;
    }

    @Override
    public String getDescription() {
        return "Copies keys and numeric measures for the semantic model";
    }

    @Override
    public RelationResult process(List<Column> upstreamColumns, RelationContext context) {
        List<Column> selected = upstreamColumns.stream()
            .filter(PbiRelation::isKeyOrMeasure)
            .toList();
        List<String> warnings = new ArrayList<>();
        List<DerivedColumn> columns = deriveAll(selected, context, warnings);
        return buildResult(columns, List.of(), warnings, context);
    }

    private static boolean isKeyOrMeasure(Column column) {
        ColumnGroup group = column.effectiveGroup();
        if (group.isKey()) {
            return true;
        }
        return group == ColumnGroup.ATTRIBUTE && isNumeric(column.dataType());
    }

    /**
     * Returns true if the data type is numeric, ignoring any precision suffix.
     *
     * @param dataType data type such as {@code decimal(18,2)}
     * @return true for numeric types
     */
    static boolean isNumeric(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return false;
        }
        String base = dataType.trim().toLowerCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren > 0) {
            base = base.substring(0, paren).trim();
        }
        return NUMERIC_TYPES.contains(base);
    }
}
