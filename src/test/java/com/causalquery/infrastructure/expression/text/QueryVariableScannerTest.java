package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.model.NodeParents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryVariableScannerTest {

    private QueryVariableScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new QueryVariableScanner();
    }

    @Test
    void whole_word_match_only() {
        assertThat(scanner.includesVariable("X", "Y[X=1] == 1")).isTrue();
        assertThat(scanner.includesVariable("X", "XY[Z=1] == 1")).isFalse();
        assertThat(scanner.includesVariable("X", "Y == 1")).isFalse();
    }

    @Test
    void nodes_in_model_order() {
        Map<String, List<String>> parents = new LinkedHashMap<>();
        parents.put("R", List.of());
        parents.put("X", List.of("R"));
        parents.put("Y", List.of("X"));

        List<String> nodes = scanner.variablesIn(NodeParents.of(parents), "Y[X=1] > Y[X=0]");

        assertThat(nodes).containsExactly("X", "Y");
    }
}
