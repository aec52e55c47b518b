package com.causalquery.infrastructure.expression.grid;

import com.causalquery.domain.query.model.DigitGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigitPermutationGeneratorTest {

    private DigitPermutationGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DigitPermutationGenerator(1 << 20);
    }

    @Test
    @DisplayName("first column cycles fastest")
    void binary_two_columns() {
        DigitGrid grid = generator.binary(2);

        assertThat(grid.rowCount()).isEqualTo(4);
        assertThat(grid.columnCount()).isEqualTo(2);
        assertThat(grid.rows()).containsExactly(
                List.of(0, 0),
                List.of(1, 0),
                List.of(0, 1),
                List.of(1, 1)
        );
    }

    @Test
    void mixed_radix() {
        DigitGrid grid = generator.generate(2, 1);

        assertThat(grid.rows()).containsExactly(
                List.of(0, 0),
                List.of(1, 0),
                List.of(2, 0),
                List.of(0, 1),
                List.of(1, 1),
                List.of(2, 1)
        );
    }

    @Test
    void row_values_follow_stride_formula() {
        int[] maxima = {1, 2, 1};
        DigitGrid grid = generator.generate(maxima);

        assertThat(grid.rowCount()).isEqualTo(12);
        for (int r = 0; r < grid.rowCount(); r++) {
            int stride = 1;
            for (int c = 0; c < maxima.length; c++) {
                assertThat(grid.value(r, c)).isEqualTo((r / stride) % (maxima[c] + 1));
                stride *= maxima[c] + 1;
            }
        }
    }

    @Test
    void rows_are_unique() {
        DigitGrid grid = generator.binary(4);
        assertThat(grid.rows()).hasSize(16).doesNotHaveDuplicates();
    }

    @Test
    void zero_maximum_is_constant_column() {
        DigitGrid grid = generator.generate(List.of(0, 1));
        assertThat(grid.rows()).containsExactly(List.of(0, 0), List.of(0, 1));
    }

    @Test
    void no_columns_gives_single_empty_row() {
        DigitGrid grid = generator.generate();
        assertThat(grid.rowCount()).isEqualTo(1);
        assertThat(grid.columnCount()).isZero();
        assertThat(grid.row(0)).isEmpty();
    }

    @Test
    void negative_maximum_rejected() {
        assertThatThrownBy(() -> generator.generate(1, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void row_limit_enforced() {
        DigitPermutationGenerator small = new DigitPermutationGenerator(8);

        assertThat(small.binary(3).rowCount()).isEqualTo(8);
        assertThatThrownBy(() -> small.binary(4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds 8 rows");
    }

    @Test
    void grids_compare_by_content() {
        assertThat(generator.binary(2)).isEqualTo(generator.generate(1, 1));
        assertThat(generator.binary(2)).isNotEqualTo(generator.generate(1, 2));
    }
}
