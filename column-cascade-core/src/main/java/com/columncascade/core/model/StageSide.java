package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Naming side of a pipeline stage.
 *
 * <p>{@code source} stages keep raw source-oriented naming, {@code business} stages
 * expose business-facing naming and platform-converted data types.
 */
public enum StageSide {
    SOURCE("source"),
    BUSINESS("business");

    private final String value;

    StageSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a side value, ignoring case and surrounding whitespace.
     *
     * @param value persisted side value
     * @return matching side, or {@link #SOURCE} when blank or unrecognized
     */
    @JsonCreator
    public static StageSide fromValue(String value) {
        if (value != null && BUSINESS.value.equalsIgnoreCase(value.trim())) {
            return BUSINESS;
        }
        return SOURCE;
    }
}
