package com.columncascade.core.validation;

import java.util.Objects;

/**
 * A broken workbook invariant.
 *
 * @param rule identifier of the violated rule, e.g. {@code unique-column-id}
 * @param artifactId affected artifact, may be null
 * @param columnName affected column, may be null
 * @param message human-readable description
 * @param severity violation severity
 */
public record InvariantViolation(
    String rule,
    String artifactId,
    String columnName,
    String message,
    ViolationSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public InvariantViolation {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static InvariantViolation error(String rule, String artifactId, String columnName, String message) {
        return new InvariantViolation(rule, artifactId, columnName, message, ViolationSeverity.ERROR);
    }

    public static InvariantViolation warning(String rule, String artifactId, String columnName, String message) {
        return new InvariantViolation(rule, artifactId, columnName, message, ViolationSeverity.WARNING);
    }

    public boolean isError() {
        return severity == ViolationSeverity.ERROR;
    }
}
