package com.columncascade.core.engine;

import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.store.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Idempotent maintenance passes over the whole columns table.
 */
public class ColumnCleanup {

    private static final Logger log = LoggerFactory.getLogger(ColumnCleanup.class);

    private final Workbook workbook;

    public ColumnCleanup(Workbook workbook) {
        this.workbook = Objects.requireNonNull(workbook, "workbook must not be null");
    }

    /**
     * Removes every column whose (artifact id, column name) pair already occurred earlier
     * in store order. Running it again changes nothing.
     *
     * @return number and description of removed columns
     */
    public CleanupReport removeDuplicateColumns() {
        Set<String> seen = new HashSet<>();
        List<Column> kept = new ArrayList<>(workbook.columns().size());
        List<String> removed = new ArrayList<>();
        for (Column column : workbook.columns()) {
            if (seen.add(column.artifactId() + '\u0000' + column.columnName())) {
                kept.add(column);
            } else {
                removed.add(column.artifactId() + "." + column.columnName() + " #" + column.columnId());
            }
        }
        if (!removed.isEmpty()) {
            workbook.replaceColumns(kept);
            log.info("Removed {} duplicate columns", removed.size());
        } else {
            log.debug("No duplicate columns found");
        }
        return new CleanupReport(removed.size(), 0, removed);
    }

    /**
     * Rewrites all column ids into the dense sequence {@code 1..N}.
     *
     * <p>Columns are sorted by artifact (artifacts table order, columns of unknown
     * artifacts last by artifact id) and then into {@link ColumnOrdering#HIERARCHY} order.
     * The high-water mark is reset to N.
     *
     * @return number of columns whose id changed
     */
    public int reenumerateIds() {
        Map<String, Integer> artifactPosition = new HashMap<>();
        List<Artifact> artifacts = workbook.artifacts();
        for (int i = 0; i < artifacts.size(); i++) {
            artifactPosition.putIfAbsent(artifacts.get(i).artifactId(), i);
        }
        Comparator<Column> byArtifact = Comparator
            .comparingInt((Column column) -> artifactPosition.getOrDefault(column.artifactId(), Integer.MAX_VALUE))
            .thenComparing(Column::artifactId);
        List<Column> sorted = workbook.columns().stream()
            .sorted(byArtifact.thenComparing(ColumnOrdering.HIERARCHY))
            .toList();

        List<Column> renumbered = new ArrayList<>(sorted.size());
        int changed = 0;
        long nextId = 1;
        for (Column column : sorted) {
            if (column.columnId() != nextId) {
                changed++;
            }
            renumbered.add(column.withColumnId(nextId++));
        }
        workbook.replaceColumns(renumbered);
        workbook.resetColumnIdHighWaterMark(renumbered.size());
        log.info("Re-enumerated {} columns ({} ids changed)", renumbered.size(), changed);
        return changed;
    }
}
