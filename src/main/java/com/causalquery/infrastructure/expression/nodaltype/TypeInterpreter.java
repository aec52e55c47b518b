package com.causalquery.infrastructure.expression.nodaltype;

import com.causalquery.domain.query.exception.ConflictingArgumentsException;
import com.causalquery.domain.query.exception.InvalidQueryException;
import com.causalquery.domain.query.exception.UnknownNodeException;
import com.causalquery.domain.query.model.ConditionQuery;
import com.causalquery.domain.query.model.DigitGrid;
import com.causalquery.domain.query.model.Interpretation;
import com.causalquery.domain.query.model.InterpretationQuery;
import com.causalquery.domain.query.model.NodeParents;
import com.causalquery.domain.query.model.ParentAssignment;
import com.causalquery.infrastructure.expression.grid.DigitPermutationGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Interprets digit positions of nodal types, or finds the positions matching parent-value conditions.
 *
 * A node with {@code k} parents has a nodal type of {@code 2^k} digits. Digit position {@code p}
 * (1-based) corresponds to row {@code p - 1} of the binary {@link DigitGrid} over its parents,
 * first parent varying fastest. For {@code X} with parents {@code R, Z}, position 3 reads
 * {@code "X | R = 0 & Z = 1"} and displays as {@code "X**[*]*"}.
 *
 * Nodes without parents have no positions; they always report the two outcomes {@code X = 0}
 * and {@code X = 1}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TypeInterpreter {

    private final DigitPermutationGenerator permutationGenerator;
    private final ConditionParser conditionParser;

    /**
     * Interpret by condition, by position, or everything when both are null.
     *
     * @param model      node to parents mapping
     * @param conditions condition strings such as {@code "X | Z=0 & R=1"} (nullable)
     * @param positions  node to 1-based digit positions (nullable)
     * @return node to interpretations, in request order
     * @throws ConflictingArgumentsException if both conditions and positions are given
     */
    public Map<String, List<Interpretation>> interpret(NodeParents model,
                                                       List<String> conditions,
                                                       Map<String, List<Integer>> positions) {
        if (conditions != null && positions != null) {
            throw new ConflictingArgumentsException();
        }

        InterpretationQuery query;
        if (positions != null) {
            query = InterpretationQuery.byPosition(positions);
        } else if (conditions != null) {
            query = InterpretationQuery.byCondition(conditions);
        } else {
            query = InterpretationQuery.all();
        }
        return interpret(model, query);
    }

    public Map<String, List<Interpretation>> interpret(NodeParents model, InterpretationQuery query) {
        Map<String, List<Interpretation>> result = switch (query.kind()) {
            case ALL -> interpretAll(model);
            case BY_POSITION -> interpretPositions(model, query.positions());
            case BY_CONDITION -> interpretConditions(model, query.conditions());
        };
        return Collections.unmodifiableMap(result);
    }

    private Map<String, List<Interpretation>> interpretAll(NodeParents model) {
        Map<String, List<Interpretation>> result = new LinkedHashMap<>();
        for (String node : model.nodes()) {
            result.put(node, interpretNode(node, model.parentsOf(node), List.of()));
        }
        return result;
    }

    private Map<String, List<Interpretation>> interpretPositions(NodeParents model,
                                                                 Map<String, List<Integer>> positions) {
        List<String> unknown = positions.keySet().stream()
                .filter(node -> !model.contains(node))
                .toList();
        if (!unknown.isEmpty()) {
            throw new UnknownNodeException(unknown);
        }

        Map<String, List<Interpretation>> result = new LinkedHashMap<>();
        positions.forEach((node, requested) ->
                result.put(node, interpretNode(node, model.parentsOf(node), requested)));
        return result;
    }

    private Map<String, List<Interpretation>> interpretConditions(NodeParents model, List<String> conditions) {
        List<ConditionQuery> queries = conditions.stream()
                .map(conditionParser::parse)
                .toList();

        Map<String, List<Interpretation>> result = new LinkedHashMap<>();
        interpretAll(model).forEach((node, interpretations) -> {
            List<Interpretation> matching = interpretations.stream()
                    .filter(i -> queries.stream().anyMatch(q -> q.matches(i)))
                    .toList();
            if (matching.isEmpty()) {
                log.debug("No interpretation of {} matches conditions {}", node, conditions);
            } else {
                result.put(node, matching);
            }
        });
        return result;
    }

    /**
     * @param requested 1-based positions; empty means every position
     */
    private List<Interpretation> interpretNode(String node, List<String> parents, List<Integer> requested) {
        if (parents.isEmpty()) {
            return List.of(
                    new Interpretation(node, null, node + "0", node + " = 0", List.of()),
                    new Interpretation(node, null, node + "1", node + " = 1", List.of())
            );
        }

        DigitGrid types = permutationGenerator.binary(parents.size());
        int digits = types.rowCount();

        List<Integer> positions = requested;
        if (positions.isEmpty()) {
            positions = new ArrayList<>(digits);
            for (int p = 1; p <= digits; p++) {
                positions.add(p);
            }
        }

        List<Interpretation> interpretations = new ArrayList<>(positions.size());
        for (Integer position : positions) {
            if (position == null || position < 1 || position > digits) {
                throw new InvalidQueryException(String.format(
                        "Position %s is outside 1..%d for node %s", position, digits, node));
            }

            List<ParentAssignment> assignments = new ArrayList<>(parents.size());
            for (int c = 0; c < parents.size(); c++) {
                assignments.add(new ParentAssignment(parents.get(c), types.value(position - 1, c)));
            }

            String interpretation = node + " | " + assignments.stream()
                    .map(ParentAssignment::toString)
                    .collect(Collectors.joining(" & "));
            String display = node + "*".repeat(position - 1) + "[*]" + "*".repeat(digits - position);

            interpretations.add(new Interpretation(node, position, display, interpretation, assignments));
        }

        log.debug("Interpreted {} position(s) of {} ({} parents)", interpretations.size(), node, parents.size());
        return List.copyOf(interpretations);
    }
}
