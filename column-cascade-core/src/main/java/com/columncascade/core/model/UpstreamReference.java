package com.columncascade.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One upstream edge of an artifact.
 *
 * @param artifactId upstream artifact id
 * @param relationType relation kind as persisted; may name an unknown kind
 */
public record UpstreamReference(
    String artifactId,
    String relationType
) {
    /**
     * Compact constructor with validation.
     */
    public UpstreamReference {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        if (relationType == null) {
            relationType = "";
        }
    }

    /**
     * Returns the parsed relation kind.
     *
     * @return relation kind, or empty if {@link #relationType()} is not recognized
     */
    public Optional<RelationKind> relationKind() {
        return RelationKind.fromValue(relationType);
    }
}
