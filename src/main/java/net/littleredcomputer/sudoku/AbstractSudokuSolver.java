// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common machinery for the solvers: per-solve counters and throttled progress
 * logging. Instances keep state between calls and must not be shared between
 * threads.
 */
public abstract class AbstractSudokuSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSudokuSolver.class);
    final int logCheckSteps = 1000;
    protected final SolveMetrics metrics = new SolveMetrics();
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    AbstractSudokuSolver(String name) {
        this.name = name;
    }

    public AbstractSudokuSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public String name() {
        return name;
    }

    /** Counters of the most recent call to {@link #solve(int[][])}. */
    public SolveMetrics metrics() {
        return metrics;
    }

    /**
     * Solves a puzzle.
     *
     * @param grid 9 rows of 9 digits in [0, 9], 0 meaning blank
     * @return a completed grid agreeing with every clue, or empty if there is none
     * @throws IllegalArgumentException if the grid is not 9x9 or holds a value outside [0, 9]
     */
    public Optional<int[][]> solve(int[][] grid) {
        return solve(Puzzle.fromGrid(grid));
    }

    public Optional<int[][]> solve(Puzzle puzzle) {
        metrics.reset();
        stepCount = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = 0;
        Optional<int[][]> outcome = doSolve(puzzle);
        stopwatch.stop();
        log.debug("%s %s in %s, %d steps, %s", name, outcome.isPresent() ? "solved" : "failed", stopwatch, stepCount, metrics);
        return outcome;
    }

    abstract Optional<int[][]> doSolve(Puzzle puzzle);

    /** Counts a search step, and every {@link #logCheckSteps} steps considers logging progress. */
    void step(Supplier<String> state) {
        if (++stepCount % logCheckSteps == 0) maybeReportProgress(state);
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s %s", name, stepCount, stopwatch, perSec, metrics, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
