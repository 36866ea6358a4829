package com.columncascade.core.relation;

import com.columncascade.core.model.Column;
import com.columncascade.core.model.RelationKind;

import java.util.List;

/**
 * Derivation rule for one relation kind.
 *
 * <p>Strategies are pure: they read the upstream columns and the context and return
 * candidates. Identity, ordering and de-duplication are the cascading engine's job.
 *
 * @see RelationProcessor
 */
public interface RelationStrategy {

    /**
     * Returns the relation kind this strategy implements.
     *
     * @return relation kind
     */
    RelationKind getKind();

    /**
     * Returns a one-line description for CLI listings.
     *
     * @return description
     */
    String getDescription();

    /**
     * Derives candidate columns from the upstream column set.
     *
     * @param upstreamColumns columns of the upstream artifact, in store order
     * @param context graph context of the reference
     * @return candidate columns and warnings
     */
    RelationResult process(List<Column> upstreamColumns, RelationContext context);
}
