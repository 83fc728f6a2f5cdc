// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.util.Optional;

/**
 * Constraint propagation followed, when the clues alone don't settle every
 * cell, by depth-first search. The search branches on the unsolved cell with the
 * fewest candidates (the first such cell in row-major order), tries its digits in
 * increasing order on a copy of the board, and lets the {@link Propagator} work
 * out the consequences of each guess. The first solution found is returned.
 *
 * <p>{@link SolveMetrics#backtracks()} counts guessed digits that failed, whether
 * the assignment itself contradicted or the search below it was exhausted.
 */
public class ConstraintSolver extends AbstractSudokuSolver {
    private final Propagator propagator = new Propagator(metrics);

    public ConstraintSolver() {
        super("cp");
    }

    @Override
    Optional<int[][]> doSolve(Puzzle puzzle) {
        Board board = new Board();
        if (!propagator.propagateInitial(puzzle, board)) return Optional.empty();
        return search(board).map(Board::toGrid);
    }

    private Optional<Board> search(Board board) {
        step(board::toString);
        Cell branch = mostConstrained(board);
        if (branch == null) return Optional.of(board);
        int bits = board.candidates(branch);
        for (int d = 1; d <= 9; ++d) {
            if ((bits & Board.bit(d)) == 0) continue;
            Board trial = board.copy();
            if (propagator.assign(trial, branch, d)) {
                Optional<Board> result = search(trial);
                if (result.isPresent()) return result;
            }
            metrics.backtracked();
        }
        return Optional.empty();
    }

    /** @return the first unsolved cell having the fewest candidates, or null if every cell is solved */
    static Cell mostConstrained(Board board) {
        Cell best = null;
        int min = Integer.MAX_VALUE;
        for (Cell c : Cell.all()) {
            int n = board.count(c);
            if (n > 1 && n < min) {
                min = n;
                best = c;
                if (n == 2) break;
            }
        }
        return best;
    }
}
