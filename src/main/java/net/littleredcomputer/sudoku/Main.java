// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("board", true, "sudoku board [0-9.]{81}")
                .addOption("problem", true, "file of boards, one per line (- for stdin)")
                .addOption("algorithm", true, "cp (default) or backtracking")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static BufferedReader problem(CommandLine cmd) throws FileNotFoundException {
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static Supplier<AbstractSudokuSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "cp");
        switch (a) {
            case "cp": return ConstraintSolver::new;
            case "backtracking": return BacktrackingSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static void solveAndPrint(AbstractSudokuSolver s, String board, PrintStream out) {
        Optional<int[][]> outcome = s.solve(Puzzle.fromBoardString(board));
        out.println(outcome.map(Puzzle::format).orElse("no solution"));
        out.printf("c assignments=%d backtracks=%d%n", s.metrics().assignments(), s.metrics().backtracks());
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        AbstractSudokuSolver s = solver(cmd).get().setLogInterval(logInterval(cmd));
        if (cmd.hasOption("board")) {
            solveAndPrint(s, cmd.getOptionValue("board"), System.out);
        } else if (cmd.hasOption("problem")) {
            try (BufferedReader r = problem(cmd)) {
                String line;
                while ((line = r.readLine()) != null) {
                    if (line.trim().isEmpty()) continue;
                    solveAndPrint(s, line, System.out);
                }
            }
        } else {
            throw new IllegalArgumentException("Must specify -board or -problem");
        }
    }
}
