package com.causalquery.domain.query.service;

import com.causalquery.domain.query.model.Interpretation;
import com.causalquery.domain.query.model.InterpretationQuery;
import com.causalquery.domain.query.model.NodeParents;

import java.util.List;
import java.util.Map;

/**
 * Query-expression operations offered to the causal-model tooling.
 * Every call is independent; the model's parent mapping is only read.
 */
public interface CausalQueryService {

    /**
     * Interpret nodal-type digit positions, or find the positions matching conditions.
     *
     * @param model      node to ordered parents mapping
     * @param conditions condition strings such as {@code "X | Z=0 & R=1"} (nullable)
     * @param positions  node to 1-based digit positions (nullable)
     * @return node to interpretations; nodes without a match are omitted in condition mode
     * @throws com.causalquery.domain.query.exception.ConflictingArgumentsException if both are given
     * @throws com.causalquery.domain.query.exception.UnknownNodeException if a position names an unknown node
     */
    Map<String, List<Interpretation>> interpretType(NodeParents model,
                                                    List<String> conditions,
                                                    Map<String, List<Integer>> positions);

    Map<String, List<Interpretation>> interpretType(NodeParents model, InterpretationQuery query);

    /**
     * Expand wildcards, joining variants with the configured operator.
     */
    String expandWildcard(String expression);

    /**
     * Expand wildcards, joining variants with {@code joinOperator}.
     */
    String expandWildcard(String expression, String joinOperator);

    /**
     * Expand wildcards into one expression per combination of group variants.
     */
    List<String> expandWildcardCombinations(String expression);

    /**
     * Model nodes mentioned in a query, in model order.
     */
    List<String> nodesInQuery(NodeParents model, String query);
}
