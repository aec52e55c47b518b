package com.causalquery.infrastructure.expression.grid;

import com.causalquery.domain.query.model.DigitGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Enumerates every combination of digits {@code 0..max_i} for a vector of maxima.
 *
 * Rows come out in expand-grid order: the first column cycles fastest and the last
 * column slowest, so row {@code r} (0-based) holds
 * {@code (r / prod_{j<i}(max_j + 1)) % (max_i + 1)} in column {@code i}.
 * Digit positions in nodal types are indexes into this order.
 */
@Slf4j
@Component
public class DigitPermutationGenerator {

    private final int maxRows;

    public DigitPermutationGenerator(@Value("${causal-query.grid.max-rows:1048576}") int maxRows) {
        this.maxRows = maxRows;
    }

    /**
     * Grid of {@code k} binary columns, {@code 2^k} rows.
     */
    public DigitGrid binary(int columns) {
        int[] maxima = new int[columns];
        Arrays.fill(maxima, 1);
        return generate(maxima);
    }

    public DigitGrid generate(List<Integer> maxima) {
        return generate(maxima.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * @param maxima inclusive upper bound of each column, all {@code >= 0}
     * @return grid with {@code prod(max_i + 1)} rows; no maxima yields one empty row
     */
    public DigitGrid generate(int... maxima) {
        long rowCount = 1;
        for (int max : maxima) {
            if (max < 0) {
                throw new IllegalArgumentException("Digit maxima must be >= 0, got " + max);
            }
            rowCount *= (max + 1L);
            if (rowCount > maxRows) {
                throw new IllegalArgumentException(String.format(
                        "Digit grid for maxima %s exceeds %d rows", Arrays.toString(maxima), maxRows));
            }
        }

        int[][] cells = new int[(int) rowCount][maxima.length];
        for (int r = 0; r < rowCount; r++) {
            int stride = 1;
            for (int c = 0; c < maxima.length; c++) {
                int radix = maxima[c] + 1;
                cells[r][c] = (r / stride) % radix;
                stride *= radix;
            }
        }

        log.debug("Generated digit grid: maxima={}, rows={}", Arrays.toString(maxima), rowCount);
        return new DigitGrid(cells, maxima.length);
    }
}
