package com.columncascade.core.engine;

import com.columncascade.core.config.CascadeConfig;
import com.columncascade.core.model.Artifact;
import com.columncascade.core.model.Column;
import com.columncascade.core.model.ColumnGroup;
import com.columncascade.core.model.Stage;
import com.columncascade.core.model.UpstreamReference;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationProcessor;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.TypeMappingTable;
import com.columncascade.core.store.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives downstream column sets by walking the artifact graph of a workbook.
 *
 * <p>Each target artifact is a fold over its upstream references: every reference is run
 * through the {@link RelationProcessor}, and the candidates are merged into the target
 * against a running set of names already present. Merged columns get fresh ids from a
 * {@link ColumnIdAllocator}, then the target's columns are rewritten in
 * {@link ColumnOrdering#HIERARCHY} order.
 *
 * <p>Order values: attribute columns are numbered sequentially from
 * {@code max(attributeStart, highest existing attribute order + 1)}; every other column
 * gets its upstream order plus the configured offset.
 *
 * <p>The engine is single-threaded and assumes exclusive access to the workbook.
 */
public class CascadeEngine {

    private static final Logger log = LoggerFactory.getLogger(CascadeEngine.class);

    private final Workbook workbook;
    private final CascadeConfig config;
    private final RelationProcessor processor;
    private final TypeMappingTable typeMappings;

    public CascadeEngine(Workbook workbook) {
        this(workbook, CascadeConfig.defaults());
    }

    public CascadeEngine(Workbook workbook, CascadeConfig config) {
        this(workbook, config, new RelationProcessor(config));
    }

    public CascadeEngine(Workbook workbook, CascadeConfig config, RelationProcessor processor) {
        this.workbook = Objects.requireNonNull(workbook, "workbook must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.typeMappings = new TypeMappingTable(workbook.dataTypeMappings()).withFallback(config.typeMappings());
    }

    /**
     * Cascades every artifact that declares upstream references, in store order.
     *
     * <p>A failing artifact is recorded in the report and the run continues.
     *
     * @return counts of processed, skipped and failed artifacts with their warnings
     */
    public CascadeReport cascadeAll() {
        ColumnIdAllocator allocator = new ColumnIdAllocator(workbook);
        CascadeReport.Builder report = new CascadeReport.Builder();
        for (Artifact artifact : List.copyOf(workbook.artifacts())) {
            if (!artifact.hasUpstream()) {
                continue;
            }
            try {
                report.add(cascade(artifact, allocator));
            } catch (RuntimeException e) {
                log.error("Cascade of {} failed: {}", artifact.artifactId(), e.getMessage(), e);
                report.addFailure(artifact.artifactId(), e.getMessage());
            }
        }
        CascadeReport result = report.build();
        log.info("Cascade run finished. {}", result.getSummary());
        return result;
    }

    /**
     * Cascades one target artifact from all of its upstream references.
     *
     * @param targetArtifactId target artifact id
     * @return columns added and warnings
     * @throws CascadeException if the target artifact or its stage does not exist
     */
    public ArtifactCascadeResult cascadeArtifact(String targetArtifactId) {
        Artifact target = workbook.findArtifact(targetArtifactId)
            .orElseThrow(() -> new CascadeException("Unknown target artifact: " + targetArtifactId));
        return cascade(target, new ColumnIdAllocator(workbook));
    }

    private ArtifactCascadeResult cascade(Artifact target, ColumnIdAllocator allocator) {
        List<UpstreamReference> references = target.upstreamReferences();
        if (references.isEmpty()) {
            log.debug("{} has no upstream artifacts; nothing to cascade", target.artifactId());
            return ArtifactCascadeResult.noOp(target.artifactId());
        }
        Stage targetStage = workbook.findStage(target.stageId())
            .orElseThrow(() -> new CascadeException(
                "Artifact " + target.artifactId() + " belongs to unknown stage '" + target.stageId() + "'"));

        Merge merge = new Merge(target, targetStage, workbook.columnsOf(target.artifactId()), allocator);
        int processed = 0;
        int skipped = 0;
        for (UpstreamReference reference : references) {
            Optional<RelationContext> context = resolve(target, targetStage, reference, merge.warnings);
            if (context.isEmpty()) {
                skipped++;
                continue;
            }
            List<Column> upstreamColumns = workbook.columnsOf(reference.artifactId());
            RelationResult result = processor.process(reference.relationType(), upstreamColumns, context.get());
            merge.warnings.addAll(result.warnings());
            if (result.kind() == null) {
                skipped++;
                continue;
            }
            processed++;
            result.columns().forEach(merge::add);
            if (!merge.technicalInjected && !result.technicalColumns().isEmpty()) {
                result.technicalColumns().forEach(merge::add);
                merge.technicalInjected = true;
            }
        }

        if (!merge.added.isEmpty()) {
            List<Column> all = new ArrayList<>(workbook.columnsOf(target.artifactId()));
            all.addAll(merge.added);
            workbook.replaceArtifactColumns(target.artifactId(), ColumnOrdering.sorted(all));
        }
        log.info("Cascaded {}: {} columns added, {} duplicates skipped, {} of {} upstream references processed",
            target.artifactId(), merge.added.size(), merge.duplicates, processed, references.size());
        return new ArtifactCascadeResult(target.artifactId(), processed, skipped, merge.added,
            merge.duplicates, merge.warnings);
    }

    private Optional<RelationContext> resolve(Artifact target, Stage targetStage, UpstreamReference reference,
                                              List<String> warnings) {
        if (reference.artifactId().equals(target.artifactId())) {
            return skip(warnings, "Artifact %s lists itself as upstream; reference skipped", target.artifactId());
        }
        Optional<Artifact> upstream = workbook.findArtifact(reference.artifactId());
        if (upstream.isEmpty()) {
            return skip(warnings, "Upstream artifact '%s' not found; reference skipped", reference.artifactId());
        }
        Optional<Stage> sourceStage = workbook.findStage(upstream.get().stageId());
        if (sourceStage.isEmpty()) {
            return skip(warnings, "Upstream artifact '%s' belongs to unknown stage '%s'; reference skipped",
                reference.artifactId(), upstream.get().stageId());
        }
        return Optional.of(new RelationContext(
            reference.artifactId(),
            upstream.get().resolvedType(),
            target.resolvedType(),
            sourceStage.get(),
            targetStage,
            typeMappings,
            config.lookup().limit()));
    }

    private static Optional<RelationContext> skip(List<String> warnings, String format, Object... args) {
        String message = String.format(format, args);
        log.warn(message);
        warnings.add(message);
        return Optional.empty();
    }

    /**
     * Running state of one target artifact's merge.
     */
    private final class Merge {
        private final Artifact target;
        private final Stage targetStage;
        private final ColumnIdAllocator allocator;
        private final Set<String> seenNames = new HashSet<>();
        private final List<Column> added = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int nextAttributeOrder;
        private int duplicates;
        private boolean technicalInjected;

        private Merge(Artifact target, Stage targetStage, List<Column> existing, ColumnIdAllocator allocator) {
            this.target = target;
            this.targetStage = targetStage;
            this.allocator = allocator;
            int maxAttributeOrder = Integer.MIN_VALUE;
            for (Column column : existing) {
                seenNames.add(column.columnName());
                if (column.effectiveGroup() == ColumnGroup.ATTRIBUTE) {
                    maxAttributeOrder = Math.max(maxAttributeOrder, column.order());
                }
            }
            int attributeStart = config.ordering().attributeStart();
            this.nextAttributeOrder = maxAttributeOrder == Integer.MIN_VALUE
                ? attributeStart
                : Math.max(attributeStart, maxAttributeOrder + 1);
        }

        private void add(DerivedColumn candidate) {
            if (!seenNames.add(candidate.name())) {
                duplicates++;
                log.debug("{} already has column {}; skipped", target.artifactId(), candidate.name());
                return;
            }
            int order = candidate.group() == ColumnGroup.ATTRIBUTE
                ? nextAttributeOrder++
                : candidate.upstreamOrder() + config.ordering().offset();
            added.add(new Column(
                targetStage.stageId(),
                targetStage.stageName(),
                target.artifactId(),
                target.artifactName(),
                allocator.next(),
                candidate.name(),
                order,
                candidate.dataType(),
                candidate.comment(),
                candidate.businessName(),
                candidate.group(),
                candidate.sourceColumnName(),
                candidate.lookupFields(),
                candidate.etlSimpleTransformation(),
                candidate.aiTransformationPrompt(),
                candidate.etlAiTransformation()));
        }
    }
}
