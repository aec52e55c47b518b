package com.causalquery.application.query;

import com.causalquery.domain.query.model.Interpretation;
import com.causalquery.domain.query.model.InterpretationQuery;
import com.causalquery.domain.query.model.NodeParents;
import com.causalquery.infrastructure.expression.nodaltype.TypeInterpreter;
import com.causalquery.infrastructure.expression.text.QueryVariableScanner;
import com.causalquery.infrastructure.expression.wildcard.WildcardExpander;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CausalQueryAppServiceTest {

    @Mock
    private TypeInterpreter typeInterpreter;

    @Mock
    private WildcardExpander wildcardExpander;

    @Mock
    private QueryVariableScanner queryVariableScanner;

    private CausalQueryAppService service;

    private final NodeParents model = NodeParents.of(Map.of("X", List.of(), "Y", List.of("X")));

    @BeforeEach
    void setUp() {
        service = new CausalQueryAppService(typeInterpreter, wildcardExpander, queryVariableScanner);
        ReflectionTestUtils.setField(service, "defaultJoinOperator", "|");
        ReflectionTestUtils.setField(service, "verbose", true);
    }

    @Test
    @DisplayName("default join operator comes from configuration")
    void expand_uses_configured_operator() {
        when(wildcardExpander.expandJoined("(Y[M=.])", "|", true)).thenReturn("(Y[M=0] | Y[M=1])");

        assertThat(service.expandWildcard("(Y[M=.])")).isEqualTo("(Y[M=0] | Y[M=1])");
    }

    @Test
    void expand_with_explicit_operator() {
        when(wildcardExpander.expandJoined("(Y[M=.])", "&", true)).thenReturn("(Y[M=0] & Y[M=1])");

        assertThat(service.expandWildcard("(Y[M=.])", "&")).isEqualTo("(Y[M=0] & Y[M=1])");
    }

    @Test
    void expand_combinations() {
        when(wildcardExpander.expandCombinations("(Y[M=.])", true)).thenReturn(List.of("(Y[M=0])", "(Y[M=1])"));

        assertThat(service.expandWildcardCombinations("(Y[M=.])")).containsExactly("(Y[M=0])", "(Y[M=1])");
    }

    @Test
    void interpret_delegates() {
        Interpretation y1 = new Interpretation("Y", 1, "Y[*]*", "Y | X = 0", List.of());
        when(typeInterpreter.interpret(model, null, Map.of("Y", List.of(1)))).thenReturn(Map.of("Y", List.of(y1)));

        Map<String, List<Interpretation>> result = service.interpretType(model, null, Map.of("Y", List.of(1)));

        assertThat(result.get("Y")).containsExactly(y1);
    }

    @Test
    void interpret_tagged_query_delegates() {
        InterpretationQuery query = InterpretationQuery.all();
        when(typeInterpreter.interpret(model, query)).thenReturn(Map.of());

        assertThat(service.interpretType(model, query)).isEmpty();
        verify(typeInterpreter).interpret(model, query);
    }

    @Test
    void nodes_in_query() {
        when(queryVariableScanner.variablesIn(model, "Y[X=1]")).thenReturn(List.of("X", "Y"));

        assertThat(service.nodesInQuery(model, "Y[X=1]")).containsExactly("X", "Y");
    }
}
