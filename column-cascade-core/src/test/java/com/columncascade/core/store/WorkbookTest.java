package com.columncascade.core.store;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import com.columncascade.core.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Workbook}.
 */
class WorkbookTest {

    @Test
    void addColumn_raisesHighWaterMark() {
        Workbook workbook = new Workbook()
            .addColumn(Column.of("a", 7, "x", 1, "INT", ColumnGroup.ATTRIBUTE))
            .addColumn(Column.of("a", 3, "y", 2, "INT", ColumnGroup.ATTRIBUTE));

        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(7L);
    }

    @Test
    void raiseColumnIdHighWaterMark_neverDecreases() {
        Workbook workbook = new Workbook();
        workbook.raiseColumnIdHighWaterMark(10);
        workbook.raiseColumnIdHighWaterMark(4);

        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(10L);

        workbook.resetColumnIdHighWaterMark(4);
        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(4L);
    }

    @Test
    void replaceArtifactColumns_keepsBlockPosition() {
        Workbook workbook = new Workbook()
            .addColumn(Column.of("a", 1, "a1", 1, "INT", null))
            .addColumn(Column.of("b", 2, "b1", 1, "INT", null))
            .addColumn(Column.of("b", 3, "b2", 2, "INT", null))
            .addColumn(Column.of("c", 4, "c1", 1, "INT", null));

        workbook.replaceArtifactColumns("b", List.of(
            Column.of("b", 3, "b2", 1, "INT", null),
            Column.of("b", 2, "b1", 2, "INT", null),
            Column.of("b", 9, "b3", 3, "INT", null)));

        assertThat(workbook.columns()).extracting(Column::columnName)
            .containsExactly("a1", "b2", "b1", "b3", "c1");
        assertThat(workbook.columnIdHighWaterMark()).isEqualTo(9L);
    }

    @Test
    void replaceArtifactColumns_newArtifact_appends() {
        Workbook workbook = new Workbook()
            .addColumn(Column.of("a", 1, "a1", 1, "INT", null));

        workbook.replaceArtifactColumns("z", List.of(Column.of("z", 2, "z1", 1, "INT", null)));

        assertThat(workbook.columns()).extracting(Column::artifactId).containsExactly("a", "z");
    }

    @Test
    void copy_isIndependent() {
        Workbook workbook = new Workbook().addStage(new Stage("s1", "1_bronze", "databricks", null));

        Workbook copy = workbook.copy();
        copy.addArtifact(new Artifact("x", null, "s1", null, null, null));

        assertThat(workbook.artifacts()).isEmpty();
        assertThat(copy.findStage("s1")).isPresent();
    }

    @Test
    void tableViews_areUnmodifiable() {
        Workbook workbook = new Workbook();

        assertThatThrownBy(() -> workbook.columns().add(Column.of("a", 1, "x", 1, "", null)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toDocument_fromDocument_keepsTablesAndMark() {
        Workbook workbook = new Workbook()
            .addStage(new Stage("s1", "1_bronze", "databricks", null))
            .addArtifact(new Artifact("x", null, "s1", null, null, null))
            .addColumn(Column.of("x", 5, "id", 1, "INT", null));
        workbook.raiseColumnIdHighWaterMark(12);

        Workbook restored = Workbook.fromDocument(workbook.toDocument());

        assertThat(restored.columnsOf("x")).hasSize(1);
        assertThat(restored.findArtifact("x")).isPresent();
        assertThat(restored.columnIdHighWaterMark()).isEqualTo(12L);
    }
}
