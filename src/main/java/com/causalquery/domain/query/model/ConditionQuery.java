package com.causalquery.domain.query.model;

import java.util.Set;

/**
 * Parsed form of {@code "<node> | <parent>=<value> & <parent>=<value> ..."}.
 *
 * @param source      the condition string as supplied by the caller
 * @param node        the child node the condition refers to
 * @param constraints the parent values that must all hold
 */
public record ConditionQuery(
        String source,
        String node,
        Set<ParentAssignment> constraints
) {
    public ConditionQuery {
        constraints = Set.copyOf(constraints);
    }

    /**
     * True when the interpretation belongs to this node and its assignment
     * contains every constraint (superset match).
     */
    public boolean matches(Interpretation interpretation) {
        return node.equals(interpretation.node())
                && interpretation.assignments().containsAll(constraints);
    }
}
