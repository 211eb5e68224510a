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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One of the 81 boxes of a Sudoku grid, named by its row letter and column
 * digit: "A1" is the top left box, "I9" the bottom right.  Boxes are interned,
 * and {@link #ALL} lists them in row-major order, which is the canonical
 * iteration order throughout the solver.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Box implements Comparable<Box> {

  /** The number of distinct boxes. */
  public static final int COUNT = 81;

  /** The row letters, top to bottom. */
  public static final String ROW_LETTERS = "ABCDEFGHI";

  /** The column digits, left to right. */
  public static final String COLUMN_DIGITS = "123456789";

  public final Row row;
  public final Column column;
  public final Block block;

  /** A number in the range [0, COUNT), row-major. */
  public final int index;

  private final String name;

  public static Box of(Row row, Column column) {
    return of(row.index * 9 + column.index);
  }

  public static Box ofIndices(int rowIndex, int columnIndex) {
    return of(rowIndex * 9 + columnIndex);
  }

  public static Box of(int index) {
    return instances[index];
  }

  /** Returns the box with the given name, such as "E5". */
  public static Box named(String name) {
    checkArgument(name.length() == 2, "Not a box name: %s", name);
    int rowIndex = ROW_LETTERS.indexOf(name.charAt(0));
    int columnIndex = COLUMN_DIGITS.indexOf(name.charAt(1));
    checkArgument(rowIndex >= 0 && columnIndex >= 0, "Not a box name: %s", name);
    return ofIndices(rowIndex, columnIndex);
  }

  /** All boxes, in row-major order. */
  public static final List<Box> ALL;

  /** The box's name: its row letter followed by its column digit. */
  public String name() {
    return name;
  }

  /** Tells whether this box lies on the diagonal from A1 to I9. */
  public boolean isOnMainDiagonal() {
    return row.index == column.index;
  }

  /** Tells whether this box lies on the diagonal from A9 to I1. */
  public boolean isOnAntiDiagonal() {
    return row.index + column.index == 8;
  }

  @Override public int compareTo(Box that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return name;
  }

  static Iterator<Box> iterator(byte[] indices) {
    return new Iter(indices);
  }

  private static class Iter implements Iterator<Box> {
    private final byte[] indices;
    private int next;
    private Iter(byte[] indices) {
      this.indices = indices;
    }
    @Override public boolean hasNext() {
      return next < indices.length;
    }
    @Override public Box next() {
      return of(indices[next++]);
    }
    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private Box(int index) {
    this.index = index;
    this.row = Row.ofIndex(index / 9);
    this.column = Column.ofIndex(index % 9);
    this.block = Block.ofIndex(index / 27 * 3 + index % 9 / 3);
    this.name = "" + ROW_LETTERS.charAt(row.index) + COLUMN_DIGITS.charAt(column.index);
  }

  private static final Box[] instances;
  static {
    instances = new Box[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Box(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
