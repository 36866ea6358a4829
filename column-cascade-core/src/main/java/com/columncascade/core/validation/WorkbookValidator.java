package com.columncascade.core.validation;

import com.columncascade.core.engine.ColumnOrdering;
import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.RelationKind;
import com.columncascade.core.model.UpstreamReference;
import com.columncascade.core.store.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the store invariants of a workbook.
 *
 * <p>Errors: duplicate column ids, duplicate (artifact, column name) pairs, blank column
 * names, group hierarchy broken in store order. Warnings: columns of unknown artifacts,
 * upstream references to unknown artifacts, unknown relation kinds.
 */
public class WorkbookValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkbookValidator.class);

    public static final String UNIQUE_COLUMN_ID = "unique-column-id";
    public static final String UNIQUE_COLUMN_NAME = "unique-column-name";
    public static final String NON_BLANK_NAME = "non-blank-name";
    public static final String GROUP_HIERARCHY = "group-hierarchy";
    public static final String KNOWN_ARTIFACT = "known-artifact";
    public static final String KNOWN_UPSTREAM = "known-upstream";
    public static final String KNOWN_RELATION = "known-relation";

    /**
     * Validates a workbook.
     *
     * @param workbook workbook to check
     * @return violations, errors before warnings, each in store order
     */
    public List<InvariantViolation> validate(Workbook workbook) {
        List<InvariantViolation> errors = new ArrayList<>();
        List<InvariantViolation> warnings = new ArrayList<>();
        Set<String> artifactIds = new HashSet<>();
        workbook.artifacts().forEach(artifact -> artifactIds.add(artifact.artifactId()));

        Map<Long, Column> byId = new HashMap<>();
        Set<String> names = new HashSet<>();
        Map<String, List<Column>> byArtifact = new LinkedHashMap<>();
        for (Column column : workbook.columns()) {
            Column previous = byId.putIfAbsent(column.columnId(), column);
            if (previous != null) {
                errors.add(InvariantViolation.error(UNIQUE_COLUMN_ID, column.artifactId(), column.columnName(),
                    "Column id " + column.columnId() + " is also used by "
                        + previous.artifactId() + "." + previous.columnName()));
            }
            if (column.columnName().isBlank()) {
                errors.add(InvariantViolation.error(NON_BLANK_NAME, column.artifactId(), null,
                    "Column " + column.columnId() + " has a blank name"));
            } else if (!names.add(column.artifactId() + '\u0000' + column.columnName())) {
                errors.add(InvariantViolation.error(UNIQUE_COLUMN_NAME, column.artifactId(), column.columnName(),
                    "Column name appears more than once in " + column.artifactId()));
            }
            if (!artifactIds.contains(column.artifactId())) {
                warnings.add(InvariantViolation.warning(KNOWN_ARTIFACT, column.artifactId(), column.columnName(),
                    "Column belongs to unknown artifact " + column.artifactId()));
            }
            byArtifact.computeIfAbsent(column.artifactId(), id -> new ArrayList<>()).add(column);
        }

        byArtifact.forEach((artifactId, columns) -> {
            if (!ColumnOrdering.respectsHierarchy(columns)) {
                errors.add(InvariantViolation.error(GROUP_HIERARCHY, artifactId, null,
                    "Columns of " + artifactId + " are not ordered surrogate keys, business keys, attributes, technical"));
            }
        });

        for (Artifact artifact : workbook.artifacts()) {
            List<UpstreamReference> references = artifact.upstreamReferences();
            if (references.isEmpty()) {
                continue;
            }
            if (RelationKind.fromValue(artifact.relationType()).isEmpty()) {
                warnings.add(InvariantViolation.warning(KNOWN_RELATION, artifact.artifactId(), null,
                    "Unknown relation kind '" + artifact.relationType() + "'"));
            }
            for (UpstreamReference reference : references) {
                if (!artifactIds.contains(reference.artifactId())) {
                    warnings.add(InvariantViolation.warning(KNOWN_UPSTREAM, artifact.artifactId(), null,
                        "Upstream artifact " + reference.artifactId() + " does not exist"));
                }
            }
        }

        List<InvariantViolation> violations = new ArrayList<>(errors);
        violations.addAll(warnings);
        log.debug("Validation found {} errors and {} warnings", errors.size(), warnings.size());
        return List.copyOf(violations);
    }
}
