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
package us.blanshard.propagate.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.CandidateView;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.core.Numeral;
import us.blanshard.propagate.core.Topology;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first Sudoku solver that reduces each node of the search tree to a
 * fixed point before branching.  It branches on the unsolved box with the
 * fewest candidates, the first such box in row-major order, trying its
 * candidates in ascending order on separate copies of the map.  The first
 * solution found is the answer.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given 81-character grid as a standard Sudoku.
   */
  public static Result solve(String grid) {
    return solve(grid, Options.DEFAULTS);
  }

  /**
   * Solves the given 81-character grid with the given options.
   */
  public static Result solve(String grid, Options options) {
    return solve(Candidates.fromString(grid), options);
  }

  /**
   * Solves the given starting candidates with the given options.
   */
  public static Result solve(Candidates start, Options options) {
    return new Solver(options).run(start);
  }

  /** How a search ended. */
  public enum Outcome {
    SOLVED,      // Found a solution.
    UNSOLVABLE,  // Every branch ran into a contradiction.
    ABANDONED;   // Hit the node budget before finishing.
  }

  /**
   * The choices that control a search.
   */
  @Immutable
  public static final class Options {
    public static final Options DEFAULTS = builder().build();

    /** Whether the two main diagonals are units too. */
    public final boolean diagonal;

    /** Whether each reduction pass includes the naked twins strategy. */
    public final boolean nakedTwins;

    /** Whether to keep the history of assignments leading to the solution. */
    public final boolean recordHistory;

    /** The most search nodes to visit before giving up, or 0 for no limit. */
    public final int maxNodes;

    private Options(Builder builder) {
      this.diagonal = builder.diagonal;
      this.nakedTwins = builder.nakedTwins;
      this.recordHistory = builder.recordHistory;
      this.maxNodes = builder.maxNodes;
    }

    public static Builder builder() {
      return new Builder();
    }

    public Builder toBuilder() {
      return new Builder()
          .setDiagonal(diagonal)
          .setNakedTwins(nakedTwins)
          .setRecordHistory(recordHistory)
          .setMaxNodes(maxNodes);
    }

    public Topology getTopology() {
      return Topology.of(diagonal);
    }

    public Reducer makeReducer() {
      return nakedTwins ? Reducer.withNakedTwins(getTopology()) : Reducer.standard(getTopology());
    }

    @Override public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("diagonal", diagonal)
          .add("nakedTwins", nakedTwins)
          .add("recordHistory", recordHistory)
          .add("maxNodes", maxNodes)
          .toString();
    }

    @NotThreadSafe
    public static final class Builder {
      private boolean diagonal;
      private boolean nakedTwins;
      private boolean recordHistory;
      private int maxNodes;

      private Builder() {}

      public Builder setDiagonal(boolean diagonal) {
        this.diagonal = diagonal;
        return this;
      }

      public Builder setNakedTwins(boolean nakedTwins) {
        this.nakedTwins = nakedTwins;
        return this;
      }

      public Builder setRecordHistory(boolean recordHistory) {
        this.recordHistory = recordHistory;
        return this;
      }

      public Builder setMaxNodes(int maxNodes) {
        checkArgument(maxNodes >= 0, "Negative node budget: %s", maxNodes);
        this.maxNodes = maxNodes;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Outcome outcome;
    public final Candidates start;
    @Nullable public final Candidates solution;  // Not null when outcome is SOLVED
    public final ImmutableList<Candidates> history;  // Empty unless recording and solved
    public final int numNodes;  // Search nodes visited, including the root
    public final int maxDepth;  // Deepest node visited, the root being 0

    private Result(Outcome outcome, Candidates start, @Nullable Candidates solution,
                   ImmutableList<Candidates> history, int numNodes, int maxDepth) {
      this.outcome = outcome;
      this.start = start;
      this.solution = solution;
      this.history = history;
      this.numNodes = numNodes;
      this.maxDepth = maxDepth;
    }

    public boolean isSolved() {
      return outcome == Outcome.SOLVED;
    }

    /** Returns the solution, which must exist. */
    public Candidates getSolution() {
      checkState(solution != null, "No solution: %s", outcome);
      return solution;
    }

    public List<Candidates> getHistory() {
      return history;
    }

    @Override public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("outcome", outcome)
          .add("numNodes", numNodes)
          .add("maxDepth", maxDepth)
          .add("historySize", history.size())
          .toString();
    }
  }

  private final Options options;
  private final Reducer reducer;
  private int numNodes;
  private int maxDepth;
  private boolean abandoned;

  private Solver(Options options) {
    this.options = checkNotNull(options);
    this.reducer = options.makeReducer();
  }

  private Result run(Candidates start) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    CandidateMap found = search(CandidateMap.of(start, options.recordHistory), 0);
    Outcome outcome = found != null ? Outcome.SOLVED
        : abandoned ? Outcome.ABANDONED : Outcome.UNSOLVABLE;
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(outcome + " after " + numNodes + " nodes, depth " + maxDepth
          + ", in " + stopwatch + " with " + options);
    }
    return found == null
        ? new Result(outcome, start, null, ImmutableList.<Candidates>of(), numNodes, maxDepth)
        : new Result(outcome, start, found.snapshot(), found.history(), numNodes, maxDepth);
  }

  /**
   * Reduces the given map, then tries each candidate of its most constrained
   * box on a copy of it.  Returns the first solved map found below this node,
   * or null if there is none or the node budget ran out.
   */
  @Nullable private CandidateMap search(CandidateMap map, int depth) {
    if (options.maxNodes > 0 && numNodes >= options.maxNodes) {
      abandoned = true;
      return null;
    }
    ++numNodes;
    maxDepth = Math.max(maxDepth, depth);

    if (!reducer.reduce(map))
      return null;  // Contradiction: this branch is dead.

    Box box = chooseBox(map);
    if (box == null)
      return map;  // Every box is solved.

    for (Numeral num : map.get(box)) {
      CandidateMap branch = map.copy();
      branch.assign(box, num);
      CandidateMap found = search(branch, depth + 1);
      if (found != null)
        return found;
      if (abandoned)
        return null;
    }
    return null;
  }

  /**
   * Returns the first box in row-major order among those with the fewest
   * candidates, not counting solved boxes, or null if every box is solved.
   */
  @Nullable static Box chooseBox(CandidateView candidates) {
    Box answer = null;
    int size = Numeral.COUNT + 1;
    for (Box box : Box.ALL) {
      NumSet possible = candidates.get(box);
      if (possible.size() > 1 && possible.size() < size) {
        answer = box;
        size = possible.size();
        if (size == 2) break;  // Can't do better.
      }
    }
    return answer;
  }
}
