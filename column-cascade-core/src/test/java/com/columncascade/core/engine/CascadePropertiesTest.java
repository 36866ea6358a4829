package com.columncascade.core.engine;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Store-wide properties that hold after cascading a whole pipeline.
 */
class CascadePropertiesTest extends CascadeTestBase {

    @BeforeEach
    void givenPipeline() {
        artifact("src_orders", "s0");
        column("src_orders", 1, "OrderID", 1, "int", ColumnGroup.BUSINESS_KEY);
        column("src_orders", 2, "CustomerID", 2, "int", ColumnGroup.UNCLASSIFIED);
        column("src_orders", 3, "Amount", 3, "decimal(18,2)", ColumnGroup.ATTRIBUTE);
        businessColumn("src_orders", 4, "Note", "", 4, "nvarchar(max)", ColumnGroup.ATTRIBUTE);
        artifact("src_customers", "s0");
        column("src_customers", 5, "CustomerID", 1, "int", ColumnGroup.BUSINESS_KEY);
        businessColumn("src_customers", 6, "CustNm", "customer_name", 2, "nvarchar(100)", ColumnGroup.ATTRIBUTE);

        artifact("orders_bronze", "s1", "src_orders", "main");
        artifact("customers_bronze", "s1", "src_customers", "main");
        artifact("orders_silver", "s2", "orders_bronze", "main");
        artifact("dim_customer", "s2", "customers_bronze", "main");
        column("dim_customer", 7, "customer_sk", 0, "BIGINT", ColumnGroup.SURROGATE_KEY);
        artifact("fact_orders_gold", "s3", "orders_silver", "main");
        workbook.addArtifact(new Artifact("fact_orders_gold_keys", "fact_orders_gold", "s3", "fact",
            "dim_customer", "get_key"));
        artifact("customer_lookup_mart", "s4", "dim_customer", "lookup");
        artifact("orders_pbi", "s5", "fact_orders_gold", "pbi");
        artifact("dangling_mart", "s4", "ghost, fact_orders_gold", "main");
    }

    @Test
    void cascadeAll_columnIdsAreUniqueAcrossTheStore() {
        new CascadeEngine(workbook).cascadeAll();

        List<Long> ids = workbook.columns().stream().map(Column::columnId).toList();
        assertThat(ids).doesNotHaveDuplicates();
        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(ids.stream().mapToLong(Long::longValue).max().orElse(0));
    }

    @Test
    void cascadeAll_everyColumnHasANonBlankName() {
        new CascadeEngine(workbook).cascadeAll();

        assertThat(workbook.columns()).allSatisfy(column -> assertThat(column.columnName()).isNotBlank());
    }

    @Test
    void cascadeAll_namesAreUniquePerArtifact() {
        new CascadeEngine(workbook).cascadeAll();

        Set<String> pairs = new HashSet<>();
        for (Column column : workbook.columns()) {
            assertThat(pairs.add(column.artifactId() + "/" + column.columnName()))
                .as("duplicate %s.%s", column.artifactId(), column.columnName())
                .isTrue();
        }
    }

    @Test
    void cascadeAll_cascadedArtifactsRespectGroupHierarchy() {
        CascadeReport report = new CascadeEngine(workbook).cascadeAll();

        for (ArtifactCascadeResult result : report.results()) {
            assertThat(ColumnOrdering.respectsHierarchy(columnsOf(result.artifactId())))
                .as(result.artifactId())
                .isTrue();
        }
    }

    @Test
    void cascadeAll_lookupNeverExceedsLimit() {
        new CascadeEngine(workbook).cascadeAll();

        assertThat(columnsOf("customer_lookup_mart")).hasSizeLessThanOrEqualTo(3);
        assertThat(columnNames("customer_lookup_mart")).startsWith("customer_sk", "CustomerID");
    }

    @Test
    void cascadeAll_reportsDanglingReferenceButProcessesTheRest() {
        CascadeReport report = new CascadeEngine(workbook).cascadeAll();

        assertThat(report.failed()).isZero();
        assertThat(report.processed()).isEqualTo(9);
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning).contains("ghost"));
    }

    @Test
    void cascadeAndCleanupTwice_yieldsSameColumnsAsOnce() {
        CascadeEngine engine = new CascadeEngine(workbook);
        ColumnCleanup cleanup = new ColumnCleanup(workbook);
        engine.cascadeArtifact("orders_bronze");
        cleanup.removeDuplicateColumns();
        List<Column> once = List.copyOf(workbook.columns());

        engine.cascadeArtifact("orders_bronze");
        cleanup.removeDuplicateColumns();
        engine.cascadeArtifact("orders_bronze");
        cleanup.removeDuplicateColumns();

        assertThat(workbook.columns()).isEqualTo(once);
    }

    @Test
    void cascadeAllTwice_secondRunAddsNothing() {
        CascadeEngine engine = new CascadeEngine(workbook);
        engine.cascadeAll();
        List<Column> afterFirst = List.copyOf(workbook.columns());

        CascadeReport second = engine.cascadeAll();

        assertThat(second.columnsAdded()).isZero();
        assertThat(workbook.columns()).isEqualTo(afterFirst);
    }
}
