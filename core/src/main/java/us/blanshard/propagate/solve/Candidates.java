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

import com.google.common.base.Strings;

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.CandidateView;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.core.Numeral;
import us.blanshard.propagate.core.Row;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable snapshot of the candidate numerals for every box of a grid.
 * This is what the solver hands back as a solution, and what the assignment
 * history is made of.  {@link CandidateMap} is the mutable counterpart.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Candidates implements CandidateView {

  private final short[] bits;

  /** Takes ownership of the given array. */
  Candidates(short[] bits) {
    this.bits = bits;
  }

  /** Every box with all nine candidates. */
  public static final Candidates BLANK = blank();

  private static Candidates blank() {
    short[] bits = new short[Box.COUNT];
    Arrays.fill(bits, NumSet.ALL_BITS);
    return new Candidates(bits);
  }

  /**
   * Parses an 81-character grid string, row by row.  The digits 1 through 9
   * are givens; any other character marks an unknown box, which starts with
   * all nine candidates.
   */
  public static Candidates fromString(String grid) {
    checkArgument(grid.length() == Box.COUNT,
        "A grid needs %s characters, got %s in %s", Box.COUNT, grid.length(), grid);
    short[] bits = new short[Box.COUNT];
    for (int i = 0; i < Box.COUNT; ++i) {
      Numeral num = Numeral.fromChar(grid.charAt(i));
      bits[i] = num == null ? NumSet.ALL_BITS : num.bit;
    }
    return new Candidates(bits);
  }

  /** Returns a mutable copy of these candidates, not recording history. */
  public CandidateMap toMap() {
    return CandidateMap.of(this, false);
  }

  @Override public NumSet get(Box box) {
    return NumSet.ofBits(bits[box.index]);
  }

  /** The number of boxes with exactly one candidate. */
  public int solvedCount() {
    return solvedCount(bits);
  }

  /** Tells whether every box has exactly one candidate. */
  public boolean isSolved() {
    return solvedCount() == Box.COUNT;
  }

  short[] copyBits() {
    return bits.clone();
  }

  /**
   * Generates a string of 81 characters with the digit for each solved box
   * and a dot for the others.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder(Box.COUNT);
    for (Box box : Box.ALL) {
      NumSet set = get(box);
      sb.append(set.isSingleton() ? set.only().toChar() : '.');
    }
    return sb.toString();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Candidates)) return false;
    Candidates that = (Candidates) object;
    return Arrays.equals(this.bits, that.bits);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(bits);
  }

  /**
   * Renders the grid with every box's candidates centered in a column wide
   * enough for the longest of them, and lines between the blocks.
   */
  @Override public String toString() {
    int width = 1;
    for (Box box : Box.ALL)
      width = Math.max(width, get(box).size() + 1);
    String line = Strings.repeat("-", width * 3);
    line = line + '+' + line + '+' + line;

    StringBuilder sb = new StringBuilder();
    for (Row row : Row.all()) {
      for (Box box : row) {
        sb.append(center(get(box).toString(), width));
        if (box.column.number == 3 || box.column.number == 6)
          sb.append('|');
      }
      sb.append('\n');
      if (row.index == 2 || row.index == 5)
        sb.append(line).append('\n');
    }
    return sb.toString();
  }

  private static String center(String s, int width) {
    int left = (width - s.length()) / 2;
    int right = width - s.length() - left;
    return Strings.repeat(" ", left) + s + Strings.repeat(" ", right);
  }

  static int solvedCount(short[] bits) {
    int count = 0;
    for (short b : bits)
      if (Integer.bitCount(b) == 1) ++count;
    return count;
  }
}
