package com.columncascade.core.validation;

/**
 * Severity of an invariant violation.
 */
public enum ViolationSeverity {
    /** Informational, no action required. */
    INFO,
    /** The workbook is usable but probably not what was intended. */
    WARNING,
    /** A store invariant is broken. */
    ERROR
}
