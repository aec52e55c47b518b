package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.exception.ArityMismatchException;
import com.causalquery.domain.query.model.MatchMode;
import com.causalquery.domain.query.model.SubstitutionPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubstitutionEngineTest {

    private SubstitutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SubstitutionEngine();
    }

    @Test
    @DisplayName("later pairs see the output of earlier pairs")
    void pairs_apply_sequentially() {
        String result = engine.substitute("aXbXc", List.of("X", "1"), List.of("1", "2"), MatchMode.LITERAL);
        // simultaneous replacement would give "a1b1c"
        assertThat(result).isEqualTo("a2b2c");
    }

    @Test
    void every_occurrence_replaced() {
        String result = engine.substitute("aXbXc", List.of("X", "b"), List.of("1", "2"), MatchMode.LITERAL);
        assertThat(result).isEqualTo("a121c");
    }

    @Test
    void arity_mismatch() {
        assertThatThrownBy(() -> engine.substitute("abc", List.of("a", "b"), List.of("1"), MatchMode.LITERAL))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("patterns=2")
                .hasMessageContaining("replacements=1");
    }

    @Test
    void applies_to_every_string_without_mutating_input() {
        List<String> input = new ArrayList<>(List.of("aX", "Xb", "c"));

        List<String> result = engine.substitute(input, List.of("X"), List.of("Y"), MatchMode.LITERAL);

        assertThat(result).containsExactly("aY", "Yb", "c");
        assertThat(input).containsExactly("aX", "Xb", "c");
    }

    @Test
    @DisplayName("literal mode does not treat metacharacters as regex")
    void literal_vs_regex() {
        assertThat(engine.substitute("a.b", List.of("."), List.of("-"), MatchMode.LITERAL)).isEqualTo("a-b");
        assertThat(engine.substitute("a.b", List.of("."), List.of("-"), MatchMode.REGEX)).isEqualTo("---");
    }

    @Test
    void regex_anchor() {
        SubstitutionPlan plan = SubstitutionPlan.regex(List.of("M\\s*=\\s*$"), List.of("M=1"));
        assertThat(engine.apply(List.of("Y[M = ", "M = ]"), plan)).containsExactly("Y[M=1", "M = ]");
    }

    @Test
    void empty_plan_is_identity() {
        assertThat(engine.apply("Y[X=1]", SubstitutionPlan.literal(List.of(), List.of()))).isEqualTo("Y[X=1]");
    }
}
