package com.columncascade.core.store;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.TypeMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable working copy of the persisted tables.
 *
 * <p>List order is store order. A workbook is not thread-safe; a cascading run holds it
 * exclusively through a {@link WorkbookSession}.
 */
public class Workbook {

    private final List<Stage> stages;
    private final List<Artifact> artifacts;
    private final List<Column> columns;
    private final List<TypeMapping> dataTypeMappings;
    private long columnIdHighWaterMark;

    public Workbook() {
        this(List.of(), List.of(), List.of(), List.of(), 0L);
    }

    public Workbook(List<Stage> stages, List<Artifact> artifacts, List<Column> columns,
                    List<TypeMapping> dataTypeMappings, long columnIdHighWaterMark) {
        this.stages = new ArrayList<>(stages);
        this.artifacts = new ArrayList<>(artifacts);
        this.columns = new ArrayList<>(columns);
        this.dataTypeMappings = new ArrayList<>(dataTypeMappings);
        this.columnIdHighWaterMark = Math.max(0L, columnIdHighWaterMark);
    }

    public static Workbook fromDocument(WorkbookDocument document) {
        return new Workbook(document.stages(), document.artifacts(), document.columns(),
            document.dataTypeMappings(), document.columnIdHighWaterMark());
    }

    public WorkbookDocument toDocument() {
        return new WorkbookDocument(stages, artifacts, columns, dataTypeMappings, columnIdHighWaterMark);
    }

    /**
     * Creates an independent copy of this workbook.
     *
     * @return deep copy of the table lists (rows are immutable and shared)
     */
    public Workbook copy() {
        return new Workbook(stages, artifacts, columns, dataTypeMappings, columnIdHighWaterMark);
    }

    // ==================== Tables ====================

    public List<Stage> stages() {
        return Collections.unmodifiableList(stages);
    }

    public List<Artifact> artifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    public List<TypeMapping> dataTypeMappings() {
        return Collections.unmodifiableList(dataTypeMappings);
    }

    public long columnIdHighWaterMark() {
        return columnIdHighWaterMark;
    }

    /**
     * Records the largest column id issued. The mark never decreases except through
     * {@link #resetColumnIdHighWaterMark(long)}.
     *
     * @param mark issued column id
     */
    public void raiseColumnIdHighWaterMark(long mark) {
        if (mark > columnIdHighWaterMark) {
            columnIdHighWaterMark = mark;
        }
    }

    /**
     * Overwrites the high-water mark; used after a full re-enumeration.
     *
     * @param mark new mark
     */
    public void resetColumnIdHighWaterMark(long mark) {
        this.columnIdHighWaterMark = Math.max(0L, mark);
    }

    // ==================== Lookups ====================

    public Optional<Stage> findStage(String stageId) {
        return stages.stream().filter(stage -> stage.stageId().equals(stageId)).findFirst();
    }

    public Optional<Artifact> findArtifact(String artifactId) {
        return artifacts.stream().filter(artifact -> artifact.artifactId().equals(artifactId)).findFirst();
    }

    /**
     * Returns the columns of one artifact in store order.
     *
     * @param artifactId owning artifact id
     * @return snapshot of the artifact's columns
     */
    public List<Column> columnsOf(String artifactId) {
        return columns.stream().filter(column -> column.artifactId().equals(artifactId)).toList();
    }

    // ==================== Mutations ====================

    public Workbook addStage(Stage stage) {
        stages.add(Objects.requireNonNull(stage, "stage must not be null"));
        return this;
    }

    public Workbook addArtifact(Artifact artifact) {
        artifacts.add(Objects.requireNonNull(artifact, "artifact must not be null"));
        return this;
    }

    public Workbook addTypeMapping(TypeMapping mapping) {
        dataTypeMappings.add(Objects.requireNonNull(mapping, "mapping must not be null"));
        return this;
    }

    public Workbook addColumn(Column column) {
        columns.add(Objects.requireNonNull(column, "column must not be null"));
        raiseColumnIdHighWaterMark(column.columnId());
        return this;
    }

    /**
     * Replaces the whole columns table.
     *
     * @param replacement new table content in store order
     */
    public void replaceColumns(List<Column> replacement) {
        columns.clear();
        columns.addAll(replacement);
    }

    /**
     * Replaces one artifact's columns, keeping them where the artifact's first column was.
     *
     * <p>An artifact with no columns yet gets its block appended at the end of the table.
     *
     * @param artifactId owning artifact id
     * @param replacement the artifact's new columns in store order
     */
    public void replaceArtifactColumns(String artifactId, List<Column> replacement) {
        int insertAt = -1;
        List<Column> rebuilt = new ArrayList<>(columns.size() + replacement.size());
        for (Column column : columns) {
            if (column.artifactId().equals(artifactId)) {
                if (insertAt < 0) {
                    insertAt = rebuilt.size();
                }
                continue;
            }
            rebuilt.add(column);
        }
        if (insertAt < 0) {
            insertAt = rebuilt.size();
        }
        rebuilt.addAll(insertAt, replacement);
        replaceColumns(rebuilt);
        replacement.forEach(column -> raiseColumnIdHighWaterMark(column.columnId()));
    }
}
