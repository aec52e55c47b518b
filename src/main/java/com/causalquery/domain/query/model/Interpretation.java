package com.causalquery.domain.query.model;

import java.util.List;

/**
 * Interpretation of one digit position in a node's nodal type.
 *
 * @param node           the child node
 * @param position       1-based digit position, or {@code null} for a node without parents
 * @param display        nodal-type mask such as {@code "X**[*]*"}, or {@code "X0"}/{@code "X1"} for a root node
 * @param interpretation readable form such as {@code "X | R = 0 & Z = 1"}
 * @param assignments    parent values for this position, in parent order (empty for a root node)
 */
public record Interpretation(
        String node,
        Integer position,
        String display,
        String interpretation,
        List<ParentAssignment> assignments
) {
    public Interpretation {
        assignments = List.copyOf(assignments);
    }
}
