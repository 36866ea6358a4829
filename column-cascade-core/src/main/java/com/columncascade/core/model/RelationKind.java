package com.columncascade.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared propagation strategy between an artifact and one of its upstream artifacts.
 */
public enum RelationKind {
    /** Propagate every upstream column and inject technical fields. */
    MAIN("main"),
    /** Take only surrogate and business keys, for fact foreign keys. */
    GET_KEY("get_key"),
    /** Take a limited, priority-ordered subset of columns. */
    LOOKUP("lookup"),
    /** Keys and numeric measures only, for the semantic model. */
    PBI("pbi");

    private final String value;

    RelationKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a persisted relation kind.
     *
     * @param value relation value such as {@code get_key}
     * @return matching kind, or empty when blank or unrecognized
     */
    public static Optional<RelationKind> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RelationKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
