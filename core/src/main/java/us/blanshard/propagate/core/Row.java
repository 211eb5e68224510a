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
package us.blanshard.propagate.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One row of a Sudoku grid, lettered from A to I top to bottom.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Row extends Unit {

  /** The row index, in the range 0..8. */
  public final int index;

  public static Row ofIndex(int index) {
    return instances[index];
  }

  /** Returns the row with the given letter, 'A' through 'I'. */
  public static Row ofLetter(char letter) {
    return instances[letter - 'A'];
  }

  /** The row's letter. */
  public char letter() {
    return Box.ROW_LETTERS.charAt(index);
  }

  /** All the rows. */
  public static List<Row> all() {
    return ALL;
  }

  @Override public boolean contains(Box box) {
    return box.index / 9 == index;
  }

  @Override public String toString() {
    return "Row " + letter();
  }

  private Row(int index) {
    super(Type.ROW, index);
    this.index = index;
    for (int i = 0; i < 9; ++i) {
      this.boxes[i] = (byte) (index * 9 + i);
    }
  }

  private static final Row[] instances;
  private static final List<Row> ALL;
  static {
    instances = new Row[9];
    for (int i = 0; i < 9; ++i) {
      instances[i] = new Row(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
