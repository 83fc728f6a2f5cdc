// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The clues of a puzzle: a digit 1-9 for each given cell, 0 for each blank one.
 * Immutable.
 */
public final class Puzzle {
    private final int[] clues;

    private Puzzle(int[] clues) {
        this.clues = clues;
    }

    /**
     * Builds a puzzle from a 9x9 grid of integers in [0, 9], 0 meaning blank.
     * The grid is copied.
     */
    public static Puzzle fromGrid(int[][] grid) {
        checkArgument(grid.length == Cell.SIZE, "grid must have 9 rows, has %s", grid.length);
        int[] clues = new int[Cell.COUNT];
        for (int r = 0; r < Cell.SIZE; ++r) {
            checkArgument(grid[r] != null && grid[r].length == Cell.SIZE, "row %s must have 9 columns", r);
            for (int c = 0; c < Cell.SIZE; ++c) {
                int v = grid[r][c];
                checkArgument(v >= 0 && v <= 9, "digit out of range at %s: %s", Cell.of(r, c), v);
                clues[r * Cell.SIZE + c] = v;
            }
        }
        return new Puzzle(clues);
    }

    /**
     * Parses a puzzle from a board string. The string holds the 81 cells in row
     * by row, left to right order: the digits 1-9 are clues, and '.' or '0' marks
     * an empty cell. Other characters are ignored, so the classic example might be
     * written "530 070 000 600 195 000 ..." or "53..7....6..195...".
     *
     * @param boardString board representation
     * @return the puzzle
     * @throws IllegalArgumentException if the string does not describe exactly 81 cells
     */
    public static Puzzle fromBoardString(String boardString) {
        int[] clues = new int[Cell.COUNT];
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if (ch >= '0' && ch <= '9' || ch == '.') {
                if (p == Cell.COUNT) throw new IllegalArgumentException("board has more than 81 cells");
                clues[p++] = ch == '.' ? 0 : ch - '0';
            }
        }
        if (p != Cell.COUNT) throw new IllegalArgumentException("board has " + p + " cells, expected 81");
        return new Puzzle(clues);
    }

    /** @return the clue at {@code c}, or 0 if the cell is blank */
    public int clue(Cell c) {
        return clues[c.index()];
    }

    public int clueCount() {
        int n = 0;
        for (int v : clues) if (v != 0) ++n;
        return n;
    }

    public int[][] toGrid() {
        int[][] grid = new int[Cell.SIZE][Cell.SIZE];
        for (int i = 0; i < Cell.COUNT; ++i) grid[i / Cell.SIZE][i % Cell.SIZE] = clues[i];
        return grid;
    }

    /**
     * Renders a grid in groups of three cells: "534 678 912 672 195 348 ...", with
     * '.' for blanks.
     */
    public static String format(int[][] grid) {
        StringBuilder sb = new StringBuilder();
        for (int[] row : grid) {
            for (int j = 0; j < row.length; ++j) {
                sb.append(row[j] == 0 ? '.' : (char) ('0' + row[j]));
                if (j % 3 == 2) sb.append(' ');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format(toGrid());
    }
}
