package com.columncascade.core.relation;

import com.columncascade.core.config.CascadeConfig;
import com.columncascade.core.config.TechnicalFieldDefinition;
import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.PipelineLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Technical and audit fields per pipeline layer, optionally limited to one artifact kind.
 */
public final class TechnicalFieldCatalog {

    private static final Logger log = LoggerFactory.getLogger(TechnicalFieldCatalog.class);
    private static final String PARTITION_MARKER = "partition";

    private final List<TechnicalFieldDefinition> definitions;

    /**
     * Creates a catalog, dropping definitions whose layer is not recognized.
     *
     * @param definitions field definitions
     */
    public TechnicalFieldCatalog(List<TechnicalFieldDefinition> definitions) {
        List<TechnicalFieldDefinition> valid = new ArrayList<>();
        if (definitions != null) {
            for (TechnicalFieldDefinition definition : definitions) {
                if (definition.pipelineLayer() == null) {
                    log.warn("Ignoring technical field {}: unknown layer '{}'", definition.name(), definition.layer());
                    continue;
                }
                valid.add(definition);
            }
        }
        this.definitions = List.copyOf(valid);
    }

    /**
     * Creates the catalog configured in a {@link CascadeConfig}.
     *
     * @param config cascading configuration
     * @return catalog of the configured technical fields
     */
    public static TechnicalFieldCatalog from(CascadeConfig config) {
        return new TechnicalFieldCatalog(config.technicalFields());
    }

    /**
     * Returns the fields to inject into an artifact of the given layer and kind.
     *
     * <p>Stage-wide fields come first, then fields specific to the artifact kind.
     *
     * @param layer target layer
     * @param artifactType target artifact kind
     * @return matching definitions, empty for a null layer
     */
    public List<TechnicalFieldDefinition> fieldsFor(PipelineLayer layer, ArtifactType artifactType) {
        if (layer == null) {
            return List.of();
        }
        List<TechnicalFieldDefinition> stageWide = new ArrayList<>();
        List<TechnicalFieldDefinition> kindSpecific = new ArrayList<>();
        for (TechnicalFieldDefinition definition : definitions) {
            if (definition.pipelineLayer() != layer || !definition.appliesTo(artifactType)) {
                continue;
            }
            if (definition.isArtifactTypeSpecific()) {
                kindSpecific.add(definition);
            } else {
                stageWide.add(definition);
            }
        }
        stageWide.addAll(kindSpecific);
        return List.copyOf(stageWide);
    }

    /**
     * Returns true if an upstream column of this name may flow on to the next layer.
     *
     * <p>Partition markers (any name containing "partition") and fields defined with
     * {@code takeToNextLevel: false} stay in the layer that owns them.
     *
     * @param columnName upstream column name
     * @return false for partition markers and non-propagating technical fields
     */
    public boolean propagates(String columnName) {
        if (columnName == null) {
            return true;
        }
        if (columnName.toLowerCase(Locale.ROOT).contains(PARTITION_MARKER)) {
            return false;
        }
        for (TechnicalFieldDefinition definition : definitions) {
            if (!definition.takeToNextLevel() && definition.name().equalsIgnoreCase(columnName)) {
                return false;
            }
        }
        return true;
    }

    public List<TechnicalFieldDefinition> definitions() {
        return definitions;
    }
}
