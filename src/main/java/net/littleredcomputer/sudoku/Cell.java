// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One of the 81 positions of the board. Instances are interned, so they may be
 * compared with ==. The natural order is row-major (A1, A2, ... A9, B1, ... I9).
 */
public final class Cell implements Comparable<Cell> {
    static final int SIZE = 9;
    static final int COUNT = SIZE * SIZE;
    private static final String ROW_LABELS = "ABCDEFGHI";
    private static final ImmutableList<Cell> ALL = IntStream.range(0, COUNT)
            .mapToObj(Cell::new)
            .collect(ImmutableList.toImmutableList());

    private final int index;

    private Cell(int index) {
        this.index = index;
    }

    /**
     * @param row row index [0..9)
     * @param column column index [0..9)
     * @return the cell at that position
     */
    public static Cell of(int row, int column) {
        checkArgument(row >= 0 && row < SIZE, "row out of range: %s", row);
        checkArgument(column >= 0 && column < SIZE, "column out of range: %s", column);
        return ALL.get(row * SIZE + column);
    }

    public static Cell at(int index) {
        checkArgument(index >= 0 && index < COUNT, "cell index out of range: %s", index);
        return ALL.get(index);
    }

    /**
     * Looks up a cell by its label: a row letter A-I followed by a column digit 1-9.
     */
    public static Cell parse(String label) {
        if (label.length() != 2) throw new IllegalArgumentException("malformed cell label: " + label);
        int r = ROW_LABELS.indexOf(Character.toUpperCase(label.charAt(0)));
        int c = label.charAt(1) - '1';
        if (r < 0 || c < 0 || c >= SIZE) throw new IllegalArgumentException("malformed cell label: " + label);
        return of(r, c);
    }

    /** All cells in row-major order. */
    public static ImmutableList<Cell> all() {
        return ALL;
    }

    public int index() { return index; }
    public int row() { return index / SIZE; }
    public int column() { return index % SIZE; }
    public int box() { return 3 * (row() / 3) + column() / 3; }

    public String label() {
        return String.valueOf(ROW_LABELS.charAt(row())) + (column() + 1);
    }

    @Override
    public int compareTo(Cell o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return label();
    }
}
