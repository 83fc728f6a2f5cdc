// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PuzzleTest {
    @Test
    public void fromBoardString() {
        Puzzle p = Puzzle.fromBoardString(SolverTestBase.classic);
        assertThat(p.clue(Cell.parse("A1")), is(5));
        assertThat(p.clue(Cell.parse("A3")), is(0));
        assertThat(p.clue(Cell.parse("I9")), is(9));
        assertThat(p.clueCount(), is(30));
        assertThat(p.toString(), is(
                "53. .7. ... 6.. 195 ... .98 ... .6. 8.. .6. ..3 4.. 8.3 ..1 7.. .2. ..6 .6. ... 28. ... 419 ..5 ... .8. .79 "));
    }

    @Test
    public void dotsAndSeparatorsAreAccepted() {
        Puzzle dotted = Puzzle.fromBoardString(SolverTestBase.ex28a);
        assertThat(dotted.clue(Cell.parse("A3")), is(3));
        assertThat(dotted.clue(Cell.parse("A1")), is(0));
        assertThat(Puzzle.fromBoardString("53..7....|6..195...\n" + SolverTestBase.classic.substring(18)).toString(),
                is(Puzzle.fromBoardString(SolverTestBase.classic).toString()));
    }

    @Test
    public void gridIsCopied() {
        int[][] g = SolverTestBase.grid(SolverTestBase.classic);
        Puzzle p = Puzzle.fromGrid(g);
        g[0][0] = 0;
        assertThat(p.clue(Cell.parse("A1")), is(5));
        assertThat(p.toGrid()[0][0], is(5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooFewCells() {
        Puzzle.fromBoardString("123");
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyCells() {
        Puzzle.fromBoardString(SolverTestBase.classic + "0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedGrid() {
        int[][] g = new int[9][];
        for (int i = 0; i < 9; ++i) g[i] = new int[i == 4 ? 8 : 9];
        Puzzle.fromGrid(g);
    }
}
