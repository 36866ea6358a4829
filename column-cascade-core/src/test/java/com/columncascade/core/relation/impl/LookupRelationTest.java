package com.columncascade.core.relation.impl;

import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.RelationTestBase;
import com.columncascade.core.relation.TypeMappingTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LookupRelation}.
 */
class LookupRelationTest extends RelationTestBase {

    private final LookupRelation relation = new LookupRelation();

    private final List<Column> upstream = List.of(
        col(1, "city", 1, "STRING", ColumnGroup.ATTRIBUTE),
        col(2, "customer_bk", 2, "STRING", ColumnGroup.BUSINESS_KEY),
        col(3, "__loaded_at", 3, "TIMESTAMP", ColumnGroup.TECHNICAL),
        col(4, "customer_sk", 4, "BIGINT", ColumnGroup.SURROGATE_KEY),
        col(5, "country", 5, "STRING", ColumnGroup.ATTRIBUTE),
        col(6, "segment", 6, "STRING", ColumnGroup.ATTRIBUTE));

    @Test
    void process_defaultLimit_selectsByKeyPriority() {
        RelationResult result = relation.process(upstream, context(SILVER, GOLD));

        assertThat(result.columns()).extracting(DerivedColumn::name)
            .containsExactly("customer_sk", "customer_bk", "city");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 10})
    void process_neverExceedsLimit(int limit) {
        RelationContext context = new RelationContext("dim_customer", ArtifactType.DIMENSION, ArtifactType.FACT,
            SILVER, GOLD, TypeMappingTable.empty(), limit);

        RelationResult result = relation.process(upstream, context);

        assertThat(result.columns()).hasSize(Math.min(limit, 5));
    }

    @Test
    void process_neverSelectsTechnicalColumns() {
        RelationContext context = new RelationContext("dim_customer", ArtifactType.DIMENSION, ArtifactType.FACT,
            SILVER, GOLD, TypeMappingTable.empty(), 10);

        RelationResult result = relation.process(upstream, context);

        assertThat(result.columns()).extracting(DerivedColumn::name)
            .containsExactly("customer_sk", "customer_bk", "city", "country", "segment");
    }

    @Test
    void process_fewerCandidatesThanLimit_returnsAll() {
        RelationResult result = relation.process(
            List.of(col(1, "city", 1, "STRING", ColumnGroup.ATTRIBUTE)), context(SILVER, GOLD));

        assertThat(result.columns()).hasSize(1);
    }
}
