/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.propagate.cli;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Charsets;
import com.google.common.base.Verify;
import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;

import us.blanshard.propagate.solve.Candidates;
import us.blanshard.propagate.solve.Solver;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Solves Sudokus given on the command line, or one per line on standard input,
 * and prints their solutions.
 *
 * <pre>
 * SolveMain [--diagonal] [--naked-twins] [--max-nodes N] [--history DIR] [GRID...]
 * </pre>
 *
 * <p> Exits with 0 if every puzzle was solved, 1 if some puzzle had no
 * solution or ran out of nodes, and 2 for bad arguments.
 *
 * @author Luke Blanshard
 */
public class SolveMain {
  private static final Logger logger = Logger.getLogger(SolveMain.class.getName());

  static final int EXIT_SOLVED = 0;
  static final int EXIT_UNSOLVED = 1;
  static final int EXIT_USAGE = 2;

  static final String USAGE =
      "Usage: SolveMain [--diagonal] [--naked-twins] [--max-nodes N] [--history DIR] [GRID...]\n"
      + "  Each GRID is 81 characters, row by row: digits for givens, anything else for blanks.\n"
      + "  With no GRID arguments, reads one grid per line from standard input.";

  private final PrintStream out;
  @Nullable private final AssignmentVisualizer visualizer;

  SolveMain(PrintStream out, @Nullable AssignmentVisualizer visualizer) {
    this.out = checkNotNull(out);
    this.visualizer = visualizer;
  }

  public static void main(String[] args) throws IOException {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /**
   * Parses the arguments, solves every puzzle, and returns the exit status.
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err)
      throws IOException {
    Solver.Options.Builder options = Solver.Options.builder();
    File historyDir = null;
    List<String> grids = Lists.newArrayList();
    for (int i = 0; i < args.length; ++i) {
      String arg = args[i];
      if (arg.equals("--diagonal")) {
        options.setDiagonal(true);
      } else if (arg.equals("--naked-twins")) {
        options.setNakedTwins(true);
      } else if (arg.equals("--max-nodes") && i + 1 < args.length) {
        Integer max = Ints.tryParse(args[++i]);
        if (max == null || max < 0) return usage(err, "Bad node budget: " + args[i]);
        options.setMaxNodes(max);
      } else if (arg.equals("--history") && i + 1 < args.length) {
        historyDir = new File(args[++i]);
        options.setRecordHistory(true);
      } else if (arg.equals("--help")) {
        out.println(USAGE);
        return EXIT_SOLVED;
      } else if (arg.startsWith("--")) {
        return usage(err, "Unknown or incomplete option: " + arg);
      } else {
        grids.add(arg);
      }
    }
    if (grids.isEmpty()) {
      grids = readGrids(in);
    }

    SolveMain main = new SolveMain(
        out, historyDir == null ? null : new JsonHistoryWriter(historyDir));
    Solver.Options built = options.build();
    boolean allSolved = true;
    for (int n = 0; n < grids.size(); ++n) {
      Candidates start;
      try {
        start = Candidates.fromString(grids.get(n));
      } catch (IllegalArgumentException e) {
        return usage(err, e.getMessage());
      }
      allSolved &= main.solveOne(n + 1, start, built);
    }
    return allSolved ? EXIT_SOLVED : EXIT_UNSOLVED;
  }

  /**
   * Solves one puzzle and prints the outcome, returns whether it was solved.
   */
  boolean solveOne(int puzzleNumber, Candidates start, Solver.Options options) {
    out.println("Puzzle " + puzzleNumber + ": " + start.toFlatString());
    Solver.Result result = Solver.solve(start, options);
    switch (result.outcome) {
      case SOLVED: {
        Candidates solution = result.getSolution();
        Verify.verify(options.getTopology().isSolution(solution),
            "Solver returned an invalid grid: %s", solution.toFlatString());
        out.print(solution);
        out.println("Solved in " + result.numNodes + " nodes");
        if (visualizer != null) {
          visualize(puzzleNumber, result.getHistory());
        }
        return true;
      }
      case ABANDONED:
        out.println("Gave up after " + result.numNodes + " nodes");
        return false;
      default:
        out.println("No solution");
        return false;
    }
  }

  private void visualize(int puzzleNumber, List<Candidates> history) {
    try {
      visualizer.visualize(puzzleNumber, history);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.INFO, "Could not visualize puzzle " + puzzleNumber, e);
      out.println("Could not visualize the assignments (" + e.getMessage()
          + "); the solution is unaffected.");
    }
  }

  private static List<String> readGrids(InputStream in) throws IOException {
    List<String> grids = Lists.newArrayList();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, Charsets.UTF_8));
    for (String line; (line = reader.readLine()) != null; ) {
      line = line.trim();
      if (line.isEmpty() || line.startsWith("#")) continue;
      grids.add(line);
    }
    return grids;
  }

  private static int usage(PrintStream err, String message) {
    err.println(message);
    err.println(USAGE);
    return EXIT_USAGE;
  }
}
