package com.columncascade.core.relation.base;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.Stage;
import com.columncascade.core.relation.DerivedColumn;
import com.columncascade.core.relation.RelationContext;
import com.columncascade.core.relation.RelationResult;
import com.columncascade.core.relation.RelationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Abstract base class for relation strategies providing common derivation helpers.
 *
 * <p>This class reduces duplication across relation kinds by providing:
 * <ul>
 *   <li>Logger initialization (one logger per strategy class)</li>
 *   <li>Name resolution and lineage ({@link #derive(Column, RelationContext, List)})</li>
 *   <li>Data type translation for business-side sources ({@link #convertDataType(Column, RelationContext, List)})</li>
 *   <li>Result creation ({@link #buildResult(List, List, List, RelationContext)})</li>
 * </ul>
 *
 * @see RelationStrategy
 * @see RelationContext
 */
public abstract class AbstractRelationStrategy implements RelationStrategy {

    /**
     * Logger instance for this strategy.
     * Automatically initialized with the concrete strategy class name.
     */
    protected final Logger log;

    protected AbstractRelationStrategy() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Derives a candidate from one upstream column.
     *
     * <p>A business-side source yields the business name, falling back to the technical
     * name; a source-side stage keeps the technical name. The data type is translated
     * when the source stage is business-side, and lineage fields are carried over.
     *
     * @param upstream upstream column
     * @param context graph context
     * @param warnings collector for type mapping warnings
     * @return derived candidate, or empty if the column has no usable name
     */
    protected Optional<DerivedColumn> derive(Column upstream, RelationContext context, List<String> warnings) {
        String name = context.sourceStage().isBusinessSide()
            ? upstream.resolvedName()
            : upstream.columnName();
        if (name == null || name.isBlank()) {
            String message = String.format("Skipping column %d of %s: no technical or business name",
                upstream.columnId(), context.upstreamArtifactId());
            log.warn(message);
            warnings.add(message);
            return Optional.empty();
        }
        return Optional.of(new DerivedColumn(
            name,
            upstream.columnBusinessName(),
            convertDataType(upstream, context, warnings),
            upstream.effectiveGroup(),
            upstream.order(),
            upstream.columnComment(),
            upstream.columnName(),
            upstream.lookupFields(),
            upstream.etlSimpleTransformation(),
            upstream.aiTransformationPrompt(),
            upstream.etlAiTransformation()
        ));
    }

    /**
     * Translates the data type of an upstream column to the target platform.
     *
     * <p>Only business-side sources are translated. Equal platforms pass through
     * silently; a missing mapping passes through with a warning.
     *
     * @param upstream upstream column
     * @param context graph context
     * @param warnings collector for unmapped type warnings
     * @return target data type
     */
    protected String convertDataType(Column upstream, RelationContext context, List<String> warnings) {
        String dataType = upstream.dataType();
        Stage source = context.sourceStage();
        Stage target = context.targetStage();
        if (!source.isBusinessSide() || dataType.isBlank()) {
            return dataType;
        }
        if (source.platform().trim().equalsIgnoreCase(target.platform().trim())) {
            return dataType;
        }
        Optional<String> mapped = context.typeMappings().lookup(source.platform(), dataType, target.platform());
        if (mapped.isPresent()) {
            log.debug("Mapped {} '{}' -> '{}' ({} -> {})",
                upstream.columnName(), dataType, mapped.get(), source.platform(), target.platform());
            return mapped.get();
        }
        String message = String.format("No data type mapping for '%s' (%s -> %s) on column %s.%s; kept unchanged",
            dataType, source.platform(), target.platform(), context.upstreamArtifactId(), upstream.resolvedName());
        log.warn(message);
        warnings.add(message);
        return dataType;
    }

    /**
     * Derives candidates for the given upstream columns.
     *
     * @param upstreamColumns columns to derive
     * @param context graph context
     * @param warnings collector for warnings
     * @return derived candidates in input order
     */
    protected List<DerivedColumn> deriveAll(List<Column> upstreamColumns, RelationContext context,
                                            List<String> warnings) {
        return upstreamColumns.stream()
            .map(column -> derive(column, context, warnings))
            .flatMap(Optional::stream)
            .toList();
    }

    /**
     * Creates a result for this strategy's kind.
     *
     * @param columns derived candidates
     * @param technicalColumns technical fields to inject
     * @param warnings warnings collected while processing
     * @param context graph context
     * @return relation result
     */
    protected RelationResult buildResult(List<DerivedColumn> columns, List<DerivedColumn> technicalColumns,
                                         List<String> warnings, RelationContext context) {
        return new RelationResult(getKind(), context.transition(), columns, technicalColumns, warnings);
    }
}
