package com.columncascade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A table-like entity belonging to a stage.
 *
 * <p>{@code upstreamArtifact} holds zero or more upstream artifact ids separated by
 * {@code ,} or {@code ;}; all of them share {@code relationType}.
 *
 * @param artifactId artifact identifier
 * @param artifactName artifact name
 * @param stageId owning stage id
 * @param artifactType explicit artifact type, may be blank
 * @param upstreamArtifact separated upstream artifact ids, may be blank
 * @param relationType relation kind shared by all upstream ids, may be blank
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("artifact_name") String artifactName,
    @JsonProperty("stage_id") String stageId,
    @JsonProperty("artifact_type") String artifactType,
    @JsonProperty("upstream_artifact") String upstreamArtifact,
    @JsonProperty("relation_type") String relationType
) {
    private static final Pattern UPSTREAM_SEPARATOR = Pattern.compile("[,;]");

    /**
     * Compact constructor with validation.
     */
    public Artifact {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        if (artifactName == null) {
            artifactName = artifactId;
        }
        if (stageId == null) {
            stageId = "";
        }
        if (artifactType == null) {
            artifactType = "";
        }
        if (upstreamArtifact == null) {
            upstreamArtifact = "";
        }
        if (relationType == null) {
            relationType = "";
        }
    }

    /**
     * Returns the upstream references in declaration order, without blanks or repeats.
     *
     * @return upstream references, empty if none are declared
     */
    @JsonIgnore
    public List<UpstreamReference> upstreamReferences() {
        Set<String> ids = new LinkedHashSet<>();
        for (String part : UPSTREAM_SEPARATOR.split(upstreamArtifact)) {
            String id = part.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        List<UpstreamReference> references = new ArrayList<>(ids.size());
        for (String id : ids) {
            references.add(new UpstreamReference(id, relationType));
        }
        return List.copyOf(references);
    }

    /**
     * Returns true if at least one upstream artifact is declared.
     *
     * @return true when the artifact has upstream references
     */
    @JsonIgnore
    public boolean hasUpstream() {
        return !upstreamReferences().isEmpty();
    }

    /**
     * Returns the artifact kind, from the explicit field or the naming convention.
     *
     * @return detected kind
     */
    @JsonIgnore
    public ArtifactType resolvedType() {
        return ArtifactType.detect(artifactName, artifactType);
    }
}
