package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Group classification of a column.
 *
 * <p>The rank defines the rendering hierarchy: surrogate keys first, then business
 * keys, then attributes, then technical fields. Unclassified columns sort with
 * attributes.
 */
public enum ColumnGroup {
    SURROGATE_KEY("surrogate_key", 0),
    BUSINESS_KEY("business_key", 1),
    ATTRIBUTE("attribute", 2),
    TECHNICAL("technical", 3),
    UNCLASSIFIED("unclassified", 2);

    private static final Set<String> SURROGATE_ALIASES =
        Set.of("surrogate_key", "surrogate key", "surrogate keys", "sk", "sks");
    private static final Set<String> BUSINESS_ALIASES =
        Set.of("business_key", "business key", "business keys", "bk", "bks",
            "primary_key", "primary key", "primarykey", "pk");
    private static final Set<String> ATTRIBUTE_ALIASES =
        Set.of("attribute", "attributes", "fact", "facts", "measure", "measures");
    private static final Set<String> TECHNICAL_ALIASES =
        Set.of("technical", "technical_fields", "technical fields", "technical_field", "partition");

    private final String value;
    private final int rank;

    ColumnGroup(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns the position of this group in the rendering hierarchy.
     *
     * @return rank, lower sorts first
     */
    public int rank() {
        return rank;
    }

    /**
     * Returns true for surrogate and business keys.
     *
     * @return true if this group is a key group
     */
    public boolean isKey() {
        return this == SURROGATE_KEY || this == BUSINESS_KEY;
    }

    /**
     * Parses a persisted group value leniently.
     *
     * @param value group value such as {@code SKs} or {@code business key}
     * @return matching group, or {@link #UNCLASSIFIED}
     */
    @JsonCreator
    public static ColumnGroup parse(String value) {
        if (value == null || value.isBlank()) {
            return UNCLASSIFIED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (SURROGATE_ALIASES.contains(normalized)) {
            return SURROGATE_KEY;
        }
        if (BUSINESS_ALIASES.contains(normalized)) {
            return BUSINESS_KEY;
        }
        if (ATTRIBUTE_ALIASES.contains(normalized)) {
            return ATTRIBUTE;
        }
        if (TECHNICAL_ALIASES.contains(normalized)) {
            return TECHNICAL;
        }
        return UNCLASSIFIED;
    }

    /**
     * Infers a group from a column naming convention.
     *
     * @param columnName column name
     * @return {@code _SK} suffix: surrogate key; {@code _BK}/{@code _PK}: business key;
     *         {@code __} prefix: technical; otherwise unclassified
     */
    public static ColumnGroup inferFromName(String columnName) {
        if (columnName == null || columnName.isBlank()) {
            return UNCLASSIFIED;
        }
        String upper = columnName.trim().toUpperCase(Locale.ROOT);
        if (upper.startsWith("__")) {
            return TECHNICAL;
        }
        if (upper.endsWith("_SK")) {
            return SURROGATE_KEY;
        }
        if (upper.endsWith("_BK") || upper.endsWith("_PK")) {
            return BUSINESS_KEY;
        }
        return UNCLASSIFIED;
    }
}
