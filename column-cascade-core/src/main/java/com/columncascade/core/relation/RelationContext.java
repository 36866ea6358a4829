package com.columncascade.core.relation;

import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.StageSide;
import com.columncascade.core.model.StageTransition;

import java.util.Objects;

/**
 * Graph context of one upstream reference being processed.
 *
 * @param upstreamArtifactId id of the upstream artifact
 * @param sourceArtifactType kind of the upstream artifact
 * @param targetArtifactType kind of the target artifact
 * @param sourceStage stage of the upstream artifact
 * @param targetStage stage of the target artifact
 * @param typeMappings data type mapping table
 * @param lookupLimit maximum number of columns a lookup relation yields
 */
public record RelationContext(
    String upstreamArtifactId,
    ArtifactType sourceArtifactType,
    ArtifactType targetArtifactType,
    Stage sourceStage,
    Stage targetStage,
    TypeMappingTable typeMappings,
    int lookupLimit
) {
    /**
     * Compact constructor with validation.
     */
    public RelationContext {
        Objects.requireNonNull(sourceStage, "sourceStage must not be null");
        Objects.requireNonNull(targetStage, "targetStage must not be null");
        if (upstreamArtifactId == null) {
            upstreamArtifactId = "";
        }
        if (sourceArtifactType == null) {
            sourceArtifactType = ArtifactType.UNKNOWN;
        }
        if (targetArtifactType == null) {
            targetArtifactType = ArtifactType.UNKNOWN;
        }
        if (typeMappings == null) {
            typeMappings = TypeMappingTable.empty();
        }
        if (lookupLimit < 0) {
            lookupLimit = 0;
        }
    }

    public String sourceStageId() {
        return sourceStage.stageId();
    }

    public String targetStageId() {
        return targetStage.stageId();
    }

    public StageSide sourceSide() {
        return sourceStage.side();
    }

    public StageSide targetSide() {
        return targetStage.side();
    }

    /**
     * Returns the stage transition this reference crosses.
     *
     * @return known transition, or {@link StageTransition#UNSPECIFIED}
     */
    public StageTransition transition() {
        return StageTransition.of(sourceStage.layer(), targetStage.layer());
    }
}
