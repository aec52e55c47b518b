package com.causalquery.application.query;

import com.causalquery.domain.query.model.Interpretation;
import com.causalquery.domain.query.model.InterpretationQuery;
import com.causalquery.domain.query.model.NodeParents;
import com.causalquery.domain.query.service.CausalQueryService;
import com.causalquery.infrastructure.expression.nodaltype.TypeInterpreter;
import com.causalquery.infrastructure.expression.text.QueryVariableScanner;
import com.causalquery.infrastructure.expression.wildcard.WildcardExpander;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class CausalQueryAppService implements CausalQueryService {

    private final TypeInterpreter typeInterpreter;
    private final WildcardExpander wildcardExpander;
    private final QueryVariableScanner queryVariableScanner;

    @Value("${causal-query.wildcard.join-operator:|}")
    private String defaultJoinOperator;

    @Value("${causal-query.wildcard.verbose:false}")
    private boolean verbose;

    @Override
    public Map<String, List<Interpretation>> interpretType(NodeParents model,
                                                           List<String> conditions,
                                                           Map<String, List<Integer>> positions) {
        Map<String, List<Interpretation>> result = typeInterpreter.interpret(model, conditions, positions);
        log.debug("[InterpretType] nodes={}", result.keySet());
        return result;
    }

    @Override
    public Map<String, List<Interpretation>> interpretType(NodeParents model, InterpretationQuery query) {
        Map<String, List<Interpretation>> result = typeInterpreter.interpret(model, query);
        log.debug("[InterpretType] kind={}, nodes={}", query.kind(), result.keySet());
        return result;
    }

    @Override
    public String expandWildcard(String expression) {
        return expandWildcard(expression, defaultJoinOperator);
    }

    @Override
    public String expandWildcard(String expression, String joinOperator) {
        return wildcardExpander.expandJoined(expression, joinOperator, verbose);
    }

    @Override
    public List<String> expandWildcardCombinations(String expression) {
        return wildcardExpander.expandCombinations(expression, verbose);
    }

    @Override
    public List<String> nodesInQuery(NodeParents model, String query) {
        return queryVariableScanner.variablesIn(model, query);
    }
}
