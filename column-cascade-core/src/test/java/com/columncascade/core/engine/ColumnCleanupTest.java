package com.columncascade.core.engine;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ColumnCleanup}.
 */
class ColumnCleanupTest extends CascadeTestBase {

    @Test
    void removeDuplicateColumns_keepsFirstOccurrence() {
        artifact("dim_customer", "s2");
        column("dim_customer", 1, "customer_sk", 1, "BIGINT", ColumnGroup.SURROGATE_KEY);
        column("dim_customer", 2, "customer_name", 2, "STRING", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 3, "customer_name", 3, "INT", ColumnGroup.ATTRIBUTE);

        CleanupReport report = new ColumnCleanup(workbook).removeDuplicateColumns();

        assertThat(report.duplicatesRemoved()).isEqualTo(1);
        assertThat(report.removed()).containsExactly("dim_customer.customer_name #3");
        assertThat(columnsOf("dim_customer")).extracting(Column::columnId).containsExactly(1L, 2L);
    }

    @Test
    void removeDuplicateColumns_sameNameInDifferentArtifacts_keepsBoth() {
        artifact("dim_customer", "s2");
        artifact("dim_product", "s2");
        column("dim_customer", 1, "name", 1, "STRING", ColumnGroup.ATTRIBUTE);
        column("dim_product", 2, "name", 1, "STRING", ColumnGroup.ATTRIBUTE);

        CleanupReport report = new ColumnCleanup(workbook).removeDuplicateColumns();

        assertThat(report.duplicatesRemoved()).isZero();
        assertThat(workbook.columns()).hasSize(2);
    }

    @Test
    void removeDuplicateColumns_runTwice_secondRunChangesNothing() {
        artifact("dim_customer", "s2");
        column("dim_customer", 1, "a", 1, "STRING", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 2, "a", 2, "STRING", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 3, "a", 3, "STRING", ColumnGroup.ATTRIBUTE);
        ColumnCleanup cleanup = new ColumnCleanup(workbook);
        cleanup.removeDuplicateColumns();
        List<Column> afterFirst = workbook.columns().stream().toList();

        CleanupReport second = cleanup.removeDuplicateColumns();

        assertThat(second.duplicatesRemoved()).isZero();
        assertThat(workbook.columns()).isEqualTo(afterFirst);
    }

    @Test
    void reenumerateIds_producesDenseSequenceByArtifactThenHierarchy() {
        artifact("dim_customer", "s2");
        artifact("dim_product", "s2");
        column("dim_product", 40, "product_sk", 1, "BIGINT", ColumnGroup.SURROGATE_KEY);
        column("dim_customer", 17, "customer_name", 100, "STRING", ColumnGroup.ATTRIBUTE);
        column("dim_customer", 9, "customer_sk", 101, "BIGINT", ColumnGroup.SURROGATE_KEY);
        column("unknown_artifact", 3, "stray", 1, "STRING", ColumnGroup.ATTRIBUTE);

        int changed = new ColumnCleanup(workbook).reenumerateIds();

        assertThat(workbook.columns()).extracting(Column::columnName)
            .containsExactly("customer_sk", "customer_name", "product_sk", "stray");
        assertThat(workbook.columns()).extracting(Column::columnId).containsExactly(1L, 2L, 3L, 4L);
        assertThat(changed).isEqualTo(4);
        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(4L);
    }

    @Test
    void reenumerateIds_alreadyDense_changesNothing() {
        artifact("dim_customer", "s2");
        column("dim_customer", 1, "customer_sk", 101, "BIGINT", ColumnGroup.SURROGATE_KEY);
        column("dim_customer", 2, "customer_name", 100, "STRING", ColumnGroup.ATTRIBUTE);

        int changed = new ColumnCleanup(workbook).reenumerateIds();

        assertThat(changed).isZero();
        assertThat(columnNames("dim_customer")).containsExactly("customer_sk", "customer_name");
    }
}
