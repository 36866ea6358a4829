package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dimensional-model kind of an artifact.
 */
public enum ArtifactType {
    DIMENSION("dimension"),
    FACT("fact"),
    BRIDGE("bridge"),
    UNKNOWN("unknown");

    private final String value;

    ArtifactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Detects the artifact kind from an explicit type field and the artifact name.
     *
     * <p>A non-blank explicit field wins when it names a known kind. Otherwise the name
     * is matched: {@code dim*}, {@code dimension*} or {@code d_*} is a dimension;
     * {@code fact*}, {@code f_*} or any name containing "fact" is a fact;
     * {@code bridge*}, {@code br_*} or any name containing "bridge" is a bridge.
     *
     * @param name artifact name, may be null
     * @param explicitField explicit artifact type, may be null or blank
     * @return detected kind, never null
     */
    public static ArtifactType detect(String name, String explicitField) {
        if (explicitField != null && !explicitField.isBlank()) {
            String explicit = explicitField.trim().toLowerCase(Locale.ROOT);
            for (ArtifactType type : values()) {
                if (type.value.equals(explicit)) {
                    return type;
                }
            }
        }
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("dim") || lower.startsWith("d_")) {
            return DIMENSION;
        }
        if (lower.startsWith("f_") || lower.contains("fact")) {
            return FACT;
        }
        if (lower.startsWith("br_") || lower.contains("bridge")) {
            return BRIDGE;
        }
        return UNKNOWN;
    }
}
