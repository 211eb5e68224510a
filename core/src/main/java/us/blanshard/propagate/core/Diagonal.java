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

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One of the two main diagonals of a Sudoku grid.  These are units only in
 * the diagonal variant of the game; see {@link Topology#DIAGONAL}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Diagonal extends Unit {

  /** The diagonal from A1 down to I9. */
  public static final Diagonal MAIN = new Diagonal(0);

  /** The diagonal from A9 down to I1. */
  public static final Diagonal ANTI = new Diagonal(1);

  private static final List<Diagonal> ALL = ImmutableList.of(MAIN, ANTI);

  /** Both diagonals. */
  public static List<Diagonal> all() {
    return ALL;
  }

  @Override public boolean contains(Box box) {
    return this == MAIN ? box.isOnMainDiagonal() : box.isOnAntiDiagonal();
  }

  @Override public String toString() {
    return this == MAIN ? "Diagonal A1-I9" : "Diagonal A9-I1";
  }

  private Diagonal(int which) {
    super(Type.DIAGONAL, 27 + which);
    for (int i = 0; i < 9; ++i) {
      int column = which == 0 ? i : 8 - i;
      this.boxes[i] = (byte) (i * 9 + column);
    }
  }
}
