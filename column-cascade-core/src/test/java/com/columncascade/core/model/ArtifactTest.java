package com.columncascade.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Artifact}.
 */
class ArtifactTest {

    @Test
    void upstreamReferences_splitsOnCommaAndSemicolon() {
        Artifact artifact = new Artifact("fact_sales_gold", null, "s3", null,
            "order_lines_silver, returns_silver;refunds_silver", "main");

        assertThat(artifact.upstreamReferences()).extracting(UpstreamReference::artifactId)
            .containsExactly("order_lines_silver", "returns_silver", "refunds_silver");
        assertThat(artifact.upstreamReferences()).allSatisfy(reference ->
            assertThat(reference.relationKind()).contains(RelationKind.MAIN));
    }

    @Test
    void upstreamReferences_ignoresBlanksAndRepeats() {
        Artifact artifact = new Artifact("a", "a", "s3", "", " , b,,b ; c ;", "lookup");

        assertThat(artifact.upstreamReferences()).extracting(UpstreamReference::artifactId)
            .containsExactly("b", "c");
    }

    @Test
    void hasUpstream_blankUpstream_isFalse() {
        assertThat(new Artifact("a", "a", "s3", "", "  ", "main").hasUpstream()).isFalse();
        assertThat(new Artifact("a", "a", "s3", "", null, null).upstreamReferences()).isEmpty();
    }

    @Test
    void constructor_defaultsNameToId() {
        Artifact artifact = new Artifact("dim_customer", null, null, null, null, null);

        assertThat(artifact.artifactName()).isEqualTo("dim_customer");
        assertThat(artifact.stageId()).isEmpty();
        assertThat(artifact.resolvedType()).isEqualTo(ArtifactType.DIMENSION);
    }

    @Test
    void constructor_nullId_throws() {
        assertThatThrownBy(() -> new Artifact(null, "x", "s1", "", "", ""))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void upstreamReference_unknownRelationType_hasNoKind() {
        assertThat(new UpstreamReference("a", "explode").relationKind()).isEmpty();
        assertThat(new UpstreamReference("a", null).relationType()).isEmpty();
    }
}
