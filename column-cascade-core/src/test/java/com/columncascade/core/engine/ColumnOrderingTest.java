package com.columncascade.core.engine;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ColumnOrdering}.
 */
class ColumnOrderingTest {

    @Test
    void sorted_ordersByGroupThenOrderThenId() {
        List<Column> columns = List.of(
            Column.of("a", 1, "__audit", 900, "TIMESTAMP", ColumnGroup.TECHNICAL),
            Column.of("a", 2, "name", 100, "STRING", ColumnGroup.ATTRIBUTE),
            Column.of("a", 3, "code", 102, "STRING", ColumnGroup.BUSINESS_KEY),
            Column.of("a", 4, "id", 101, "BIGINT", ColumnGroup.SURROGATE_KEY),
            Column.of("a", 5, "city", 100, "STRING", ColumnGroup.UNCLASSIFIED));

        assertThat(ColumnOrdering.sorted(columns)).extracting(Column::columnName)
            .containsExactly("id", "code", "name", "city", "__audit");
    }

    @Test
    void sorted_unclassifiedColumn_usesNameConvention() {
        List<Column> columns = List.of(
            Column.of("a", 1, "name", 100, "STRING", ColumnGroup.ATTRIBUTE),
            Column.of("a", 2, "customer_SK", 200, "BIGINT", ColumnGroup.UNCLASSIFIED));

        assertThat(ColumnOrdering.sorted(columns)).extracting(Column::columnName)
            .containsExactly("customer_SK", "name");
    }

    @Test
    void respectsHierarchy_detectsAttributeBeforeKey() {
        List<Column> columns = List.of(
            Column.of("a", 1, "name", 100, "STRING", ColumnGroup.ATTRIBUTE),
            Column.of("a", 2, "id", 101, "BIGINT", ColumnGroup.SURROGATE_KEY));

        assertThat(ColumnOrdering.respectsHierarchy(columns)).isFalse();
        assertThat(ColumnOrdering.respectsHierarchy(ColumnOrdering.sorted(columns))).isTrue();
        assertThat(ColumnOrdering.respectsHierarchy(List.of())).isTrue();
    }
}
