// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

/**
 * Counters for a single solve. Owned by one solver instance and reset when a
 * solve begins.
 */
public final class SolveMetrics {
    private long assignments;
    private long backtracks;
    private long contradictions;

    void reset() {
        assignments = 0;
        backtracks = 0;
        contradictions = 0;
    }

    void assigned() { ++assignments; }
    void backtracked() { ++backtracks; }
    void contradicted() { ++contradictions; }

    /** Digits committed to cells: clues, forced deductions and guesses alike. */
    public long assignments() { return assignments; }

    /** Guesses abandoned by the search. */
    public long backtracks() { return backtracks; }

    /** Emptied candidate sets and unplaceable digits met during propagation. */
    public long contradictions() { return contradictions; }

    @Override
    public String toString() {
        return String.format("assignments=%d backtracks=%d contradictions=%d", assignments, backtracks, contradictions);
    }
}
