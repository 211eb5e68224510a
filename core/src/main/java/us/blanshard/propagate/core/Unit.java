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

import com.google.common.collect.ImmutableList;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, block, or diagonal of a Sudoku grid: a set of 9 boxes that
 * must all contain different numerals in a valid Sudoku.
 *
 * @author Luke Blanshard
 */
@Immutable
public abstract class Unit extends AbstractCollection<Box>
    implements Collection<Box>, Comparable<Unit> {

  public static final int UNIT_SIZE = 9;  // Every unit has this many boxes.

  public enum Type {
    ROW, COLUMN, BLOCK, DIAGONAL
  }

  /** This unit's type. */
  public final Type type;

  /** The index of this unit within {@link #allUnits()}. */
  public final int index;

  /**
   * Returns a list of all the units: rows, then columns, then blocks, then
   * the two diagonals.  {@link #index} holds the index for this unit within
   * this list.
   */
  public static List<Unit> allUnits() {
    return AllUnits.INSTANCE.list;
  }

  /** Returns the box at the given index within this unit. */
  public final Box get(int index) {
    return Box.of(boxes[index]);
  }

  public abstract boolean contains(Box box);

  @Override public final int size() {
    return UNIT_SIZE;
  }

  @Override public final boolean contains(Object o) {
    if (o instanceof Box) {
      return contains((Box) o);
    }
    return false;
  }

  @Override public final Iterator<Box> iterator() {
    return Box.iterator(boxes);
  }

  @Override public int compareTo(Unit that) {
    return this.index - that.index;
  }

  protected final byte[] boxes = new byte[UNIT_SIZE];

  protected Unit(Type type, int index) {
    this.type = type;
    this.index = index;
  }

  private static enum AllUnits {
    INSTANCE;
    private final List<Unit> list;
    private AllUnits() {
      this.list = ImmutableList.<Unit>builder()
          .addAll(Row.all())  // This order is relied on by the unit indices.
          .addAll(Column.all())
          .addAll(Block.all())
          .addAll(Diagonal.all())
          .build();
    }
  }
}
