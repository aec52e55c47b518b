package com.causalquery.domain.query.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable table of digit combinations, one row per combination and one column per dimension.
 * Row order is expand-grid order: column 0 cycles fastest, the last column slowest.
 */
public final class DigitGrid {

    private final int[][] cells;
    private final int columnCount;

    public DigitGrid(int[][] cells, int columnCount) {
        this.columnCount = columnCount;
        this.cells = new int[cells.length][];
        for (int r = 0; r < cells.length; r++) {
            if (cells[r].length != columnCount) {
                throw new IllegalArgumentException(
                        String.format("Row %d has %d columns, expected %d", r, cells[r].length, columnCount));
            }
            this.cells[r] = cells[r].clone();
        }
    }

    public int rowCount() {
        return cells.length;
    }

    public int columnCount() {
        return columnCount;
    }

    /**
     * @param row    0-based row index
     * @param column 0-based column index
     */
    public int value(int row, int column) {
        return cells[row][column];
    }

    /**
     * @param row 0-based row index
     * @return the row's digits, leftmost column first
     */
    public List<Integer> row(int row) {
        List<Integer> values = new ArrayList<>(columnCount);
        for (int digit : cells[row]) {
            values.add(digit);
        }
        return List.copyOf(values);
    }

    public List<List<Integer>> rows() {
        List<List<Integer>> rows = new ArrayList<>(cells.length);
        for (int r = 0; r < cells.length; r++) {
            rows.add(row(r));
        }
        return List.copyOf(rows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DigitGrid other)) return false;
        return columnCount == other.columnCount && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(cells) + columnCount;
    }

    @Override
    public String toString() {
        return "DigitGrid" + rows();
    }
}
