// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PropagatorTest {
    private SolveMetrics metrics;
    private Propagator p;
    private Board b;

    private static Cell cell(String label) { return Cell.parse(label); }

    @Before
    public void setUp() {
        metrics = new SolveMetrics();
        p = new Propagator(metrics);
        b = new Board();
    }

    @Test
    public void assignEliminatesFromPeers() {
        assertThat(p.assign(b, cell("E5"), 7), is(true));
        assertThat(b.value(cell("E5")), is(7));
        for (Cell peer : Topology.peers(cell("E5"))) {
            assertThat(peer.label(), b.admits(peer, 7), is(false));
            assertThat(peer.label(), b.count(peer), is(8));
        }
        assertThat(b.admits(cell("A1"), 7), is(true));
        assertThat(metrics.assignments(), is(1L));
        assertThat(metrics.contradictions(), is(0L));
    }

    @Test
    public void removeOfAbsentDigitIsNoOp() {
        p.assign(b, cell("A1"), 1);
        Board before = b.copy();
        assertThat(p.remove(b, cell("A1"), 2), is(true));
        assertThat(b, is(before));
    }

    @Test
    public void nakedSingle() {
        for (int d = 2; d <= 9; ++d) assertThat(p.remove(b, cell("A1"), d), is(true));
        assertThat(b.value(cell("A1")), is(1));
        for (Cell peer : Topology.peers(cell("A1"))) assertThat(b.admits(peer, 1), is(false));
        // Nothing was assigned: the single emerged from eliminations alone.
        assertThat(metrics.assignments(), is(0L));
    }

    @Test
    public void hiddenSingle() {
        // Once 3 can go nowhere else in row A, it must go in A9.
        for (int c = 1; c <= 8; ++c) assertThat(p.remove(b, cell("A" + c), 3), is(true));
        assertThat(b.value(cell("A9")), is(3));
        assertThat(metrics.assignments(), is(1L));
        for (Cell peer : Topology.peers(cell("A9"))) assertThat(b.admits(peer, 3), is(false));
    }

    @Test
    public void removingLastCandidateFails() {
        p.assign(b, cell("C3"), 4);
        assertThat(p.remove(b, cell("C3"), 4), is(false));
        assertThat(metrics.contradictions(), is(1L));
    }

    @Test
    public void digitWithNowhereToGoFails() {
        // Settle A1..A8 on 1..8 so that 9 must go in A9, then take 9 away from A9.
        for (int c = 1; c <= 8; ++c) assertThat(p.assign(b, cell("A" + c), c), is(true));
        assertThat(b.value(cell("A9")), is(9));
        assertThat(p.remove(b, cell("A9"), 9), is(false));
    }

    @Test
    public void conflictingAssignmentFails() {
        assertThat(p.assign(b, cell("A1"), 5), is(true));
        assertThat(p.assign(b, cell("A2"), 5), is(false));
        assertThat(metrics.assignments(), is(2L));
    }

    @Test
    public void propagateInitialIsIdempotent() {
        Puzzle puzzle = Puzzle.fromBoardString(SolverTestBase.classic);
        assertThat(p.propagateInitial(puzzle, b), is(true));
        Board fixedPoint = b.copy();
        assertThat(p.propagateInitial(puzzle, b), is(true));
        assertThat(b, is(fixedPoint));
    }

    @Test
    public void propagateInitialKeepsClues() {
        Puzzle puzzle = Puzzle.fromBoardString(SolverTestBase.classic);
        assertThat(p.propagateInitial(puzzle, b), is(true));
        for (Cell c : Cell.all()) {
            if (puzzle.clue(c) != 0) assertThat(c.label(), b.value(c), is(puzzle.clue(c)));
        }
    }

    @Test
    public void propagationAloneFillsSingleBlank() {
        int[][] g = Puzzle.fromBoardString(SolverTestBase.classicSolution).toGrid();
        g[2][6] = 0;
        assertThat(p.propagateInitial(Puzzle.fromGrid(g), b), is(true));
        assertThat(b.isSolution(), is(true));
        assertThat(Puzzle.format(b.toGrid()), is(SolverTestBase.classicSolution));
    }

    @Test
    public void propagateInitialRejectsDuplicateClues() {
        assertThat(p.propagateInitial(Puzzle.fromBoardString(SolverTestBase.duplicateInRow), b), is(false));
    }
}
