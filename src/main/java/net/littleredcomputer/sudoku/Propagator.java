// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

/**
 * Enforces local consistency on a {@link Board}. Committing a digit to a cell is
 * expressed as eliminating every other digit; each elimination then cascades
 * through two rules:
 * <ol>
 *   <li>a cell left with one candidate removes that digit from all its peers (naked single);</li>
 *   <li>a unit left with one place for a digit puts the digit there (hidden single).</li>
 * </ol>
 * A method returning false has met a contradiction, and the board it was given
 * must be discarded.
 */
public class Propagator {
    private final SolveMetrics metrics;

    public Propagator(SolveMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Commits {@code digit} to {@code c} by eliminating all its other candidates.
     * Fails if {@code digit} is not among the candidates of {@code c}.
     */
    public boolean assign(Board board, Cell c, int digit) {
        metrics.assigned();
        int others = board.candidates(c) & ~Board.bit(digit);
        for (int d = 1; d <= 9; ++d) {
            if ((others & Board.bit(d)) != 0 && !remove(board, c, d)) return false;
        }
        return true;
    }

    /**
     * Removes {@code digit} from the candidates of {@code c} and propagates the consequences.
     */
    public boolean remove(Board board, Cell c, int digit) {
        if (!board.admits(c, digit)) return true;
        int remaining = board.eliminate(c, digit);
        if (remaining == 0) {
            metrics.contradicted();
            return false;
        }
        if (remaining == 1) {
            final int last = board.value(c);
            for (Cell p : Topology.peers(c)) {
                if (!remove(board, p, last)) return false;
            }
        }
        for (ImmutableList<Cell> unit : Topology.units(c)) {
            Cell place = null;
            int places = 0;
            for (Cell u : unit) {
                if (board.admits(u, digit)) {
                    place = u;
                    ++places;
                }
            }
            if (places == 0) {
                metrics.contradicted();
                return false;
            }
            if (places == 1 && !board.isSolved(place) && !assign(board, place, digit)) return false;
        }
        return true;
    }

    /**
     * Assigns each clue of the puzzle, in row-major order.
     * @return false if the clues contradict one another
     */
    public boolean propagateInitial(Puzzle puzzle, Board board) {
        for (Cell c : Cell.all()) {
            int clue = puzzle.clue(c);
            if (clue != 0 && !assign(board, c, clue)) return false;
        }
        return true;
    }
}
