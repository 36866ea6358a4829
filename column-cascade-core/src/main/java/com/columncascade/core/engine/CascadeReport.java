package com.columncascade.core.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a cascading run over several artifacts.
 *
 * @param processed artifacts with at least one processed upstream reference
 * @param skipped artifacts whose upstream references were all skipped
 * @param failed artifacts whose cascade raised an error
 * @param columnsAdded columns added across all artifacts
 * @param results per-artifact results of processed and skipped artifacts
 * @param failures failure messages, one per failed artifact
 * @param warnings warnings of all artifacts, prefixed with the artifact id
 */
public record CascadeReport(
    int processed,
    int skipped,
    int failed,
    int columnsAdded,
    List<ArtifactCascadeResult> results,
    List<String> failures,
    List<String> warnings
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public CascadeReport {
        results = results == null ? List.of() : List.copyOf(results);
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    /**
     * Returns a one-line summary.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format("Processed: %d, Skipped: %d, Failed: %d, Columns added: %d, Warnings: %d",
            processed, skipped, failed, columnsAdded, warnings.size());
    }

    /**
     * Builder for constructing CascadeReport incrementally.
     */
    public static class Builder {
        private int processed = 0;
        private int skipped = 0;
        private int failed = 0;
        private int columnsAdded = 0;
        private final List<ArtifactCascadeResult> results = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public Builder add(ArtifactCascadeResult result) {
            results.add(result);
            if (result.isSkipped()) {
                skipped++;
            } else {
                processed++;
            }
            columnsAdded += result.addedColumns().size();
            result.warnings().forEach(warning -> warnings.add(result.artifactId() + ": " + warning));
            return this;
        }

        public Builder addFailure(String artifactId, String message) {
            failed++;
            failures.add(artifactId + ": " + message);
            return this;
        }

        public CascadeReport build() {
            return new CascadeReport(processed, skipped, failed, columnsAdded, results, failures, warnings);
        }
    }
}
