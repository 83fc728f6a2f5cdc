// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.util.Arrays;

/**
 * The candidate digits still possible for each cell, recorded as 9-bit vectors
 * (bit d-1 set iff digit d is still possible). A board is owned by one caller at
 * a time and mutated in place by the {@link Propagator}; search makes a
 * {@link #copy()} before each trial assignment.
 */
public final class Board {
    static final int ALL_DIGITS = (1 << 9) - 1;
    private final int[] candidates;

    /** A board on which every digit is still possible in every cell. */
    public Board() {
        candidates = new int[Cell.COUNT];
        Arrays.fill(candidates, ALL_DIGITS);
    }

    private Board(int[] candidates) {
        this.candidates = candidates;
    }

    public Board copy() {
        return new Board(candidates.clone());
    }

    static int bit(int digit) {
        return 1 << (digit - 1);
    }

    /** @return the candidates of {@code c} as a bit vector */
    public int candidates(Cell c) {
        return candidates[c.index()];
    }

    public int count(Cell c) {
        return Integer.bitCount(candidates[c.index()]);
    }

    public boolean admits(Cell c, int digit) {
        return (candidates[c.index()] & bit(digit)) != 0;
    }

    public boolean isSolved(Cell c) {
        return count(c) == 1;
    }

    /** @return the digit of a solved cell, or 0 if the cell still has several candidates (or none) */
    public int value(Cell c) {
        int bits = candidates[c.index()];
        return Integer.bitCount(bits) == 1 ? Integer.numberOfTrailingZeros(bits) + 1 : 0;
    }

    public boolean isSolution() {
        for (int bits : candidates) {
            if (Integer.bitCount(bits) != 1) return false;
        }
        return true;
    }

    /**
     * Removes {@code digit} from the candidates of {@code c}.
     * @return the number of candidates remaining
     */
    int eliminate(Cell c, int digit) {
        return Integer.bitCount(candidates[c.index()] &= ~bit(digit));
    }

    /** @return the solved digits row by row, with 0 for every cell not yet solved */
    public int[][] toGrid() {
        int[][] grid = new int[Cell.SIZE][Cell.SIZE];
        for (Cell c : Cell.all()) grid[c.row()][c.column()] = value(c);
        return grid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board)) return false;
        return Arrays.equals(candidates, ((Board) o).candidates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(candidates);
    }

    /** Renders each cell as its candidate digits, one row per line. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Cell c : Cell.all()) {
            int bits = candidates[c.index()];
            for (int d = 1; d <= 9; ++d) {
                if ((bits & bit(d)) != 0) sb.append(d);
            }
            if (bits == 0) sb.append('-');
            sb.append(c.column() == Cell.SIZE - 1 ? '\n' : ' ');
        }
        return sb.toString();
    }
}
