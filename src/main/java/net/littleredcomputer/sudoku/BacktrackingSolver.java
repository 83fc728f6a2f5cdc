// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.Optional;

/**
 * Plain chronological backtracking, for comparison with {@link ConstraintSolver}.
 * Blank cells are filled in row-major order with the smallest digit not already
 * present in the cell's row, column or box; when a cell has no such digit the
 * previous placement is undone and its next digit tried. Every placement counts
 * as an assignment, every undone placement as a backtrack.
 */
public class BacktrackingSolver extends AbstractSudokuSolver {
    private final int[] rows = new int[Cell.SIZE];     // digits used in row i
    private final int[] columns = new int[Cell.SIZE];  // digits used in column j
    private final int[] boxes = new int[Cell.SIZE];    // digits used in box k
    private final int[] board = new int[Cell.COUNT];
    private final TIntArrayList blanks = new TIntArrayList();

    public BacktrackingSolver() {
        super("backtracking");
    }

    @Override
    Optional<int[][]> doSolve(Puzzle puzzle) {
        Arrays.fill(rows, 0);
        Arrays.fill(columns, 0);
        Arrays.fill(boxes, 0);
        blanks.resetQuick();
        for (Cell c : Cell.all()) {
            int d = puzzle.clue(c);
            board[c.index()] = d;
            if (d == 0) {
                blanks.add(c.index());
            } else if (!canPlace(c, d)) {
                // The clues already repeat a digit in some unit.
                return Optional.empty();
            } else {
                place(c, d);
            }
        }
        if (!fill(0)) return Optional.empty();
        int[][] grid = new int[Cell.SIZE][Cell.SIZE];
        for (Cell c : Cell.all()) grid[c.row()][c.column()] = board[c.index()];
        return Optional.of(grid);
    }

    private boolean fill(int k) {
        step(() -> "depth " + k + "/" + blanks.size());
        if (k == blanks.size()) return true;
        Cell c = Cell.at(blanks.get(k));
        for (int d = 1; d <= 9; ++d) {
            if (!canPlace(c, d)) continue;
            place(c, d);
            metrics.assigned();
            if (fill(k + 1)) return true;
            unplace(c, d);
            metrics.backtracked();
        }
        return false;
    }

    private boolean canPlace(Cell c, int d) {
        int mask = Board.bit(d);
        return ((rows[c.row()] | columns[c.column()] | boxes[c.box()]) & mask) == 0;
    }

    private void place(Cell c, int d) {
        int mask = Board.bit(d);
        rows[c.row()] |= mask;
        columns[c.column()] |= mask;
        boxes[c.box()] |= mask;
        board[c.index()] = d;
    }

    private void unplace(Cell c, int d) {
        int mask = ~Board.bit(d);
        rows[c.row()] &= mask;
        columns[c.column()] &= mask;
        boxes[c.box()] &= mask;
        board[c.index()] = 0;
    }
}
