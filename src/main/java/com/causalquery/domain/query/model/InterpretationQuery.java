package com.causalquery.domain.query.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What to interpret: every position, selected positions per node, or positions matching conditions.
 *
 * @param kind       which of the three request forms this is
 * @param positions  node to requested 1-based positions, only for {@link Kind#BY_POSITION};
 *                   a null or empty list means every position of that node
 * @param conditions condition strings, only for {@link Kind#BY_CONDITION}
 */
public record InterpretationQuery(
        Kind kind,
        Map<String, List<Integer>> positions,
        List<String> conditions
) {
    public enum Kind { ALL, BY_POSITION, BY_CONDITION }

    public InterpretationQuery {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        positions.forEach((node, requested) ->
                copy.put(node, requested == null ? List.of() : List.copyOf(requested)));
        positions = Collections.unmodifiableMap(copy);
        conditions = List.copyOf(conditions);
    }

    public static InterpretationQuery all() {
        return new InterpretationQuery(Kind.ALL, Map.of(), List.of());
    }

    public static InterpretationQuery byPosition(Map<String, List<Integer>> positions) {
        return new InterpretationQuery(Kind.BY_POSITION, positions, List.of());
    }

    public static InterpretationQuery byCondition(List<String> conditions) {
        return new InterpretationQuery(Kind.BY_CONDITION, Map.of(), conditions);
    }
}
