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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * The constraint structure of a Sudoku variant: which units exist, which units
 * each box belongs to, and each box's peers, the boxes sharing at least one
 * unit with it.  There are exactly two instances, both built on first use and
 * never changed afterwards.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Topology {

  /** Standard Sudoku: 9 rows, 9 columns, and 9 blocks. */
  public static final Topology STANDARD = new Topology(false);

  /** Diagonal Sudoku: the standard units plus the two main diagonals. */
  public static final Topology DIAGONAL = new Topology(true);

  public static Topology of(boolean diagonal) {
    return diagonal ? DIAGONAL : STANDARD;
  }

  private final boolean diagonal;
  private final ImmutableList<Unit> units;
  private final ImmutableList<ImmutableList<Unit>> unitsByBox;
  private final ImmutableList<ImmutableSet<Box>> peersByBox;

  private Topology(boolean diagonal) {
    this.diagonal = diagonal;

    ImmutableList.Builder<Unit> units = ImmutableList.builder();
    for (Unit unit : Unit.allUnits()) {
      if (diagonal || unit.type != Unit.Type.DIAGONAL)
        units.add(unit);
    }
    this.units = units.build();

    ImmutableList.Builder<ImmutableList<Unit>> unitsByBox = ImmutableList.builder();
    ImmutableList.Builder<ImmutableSet<Box>> peersByBox = ImmutableList.builder();
    for (Box box : Box.ALL) {
      ImmutableList.Builder<Unit> owners = ImmutableList.builder();
      Set<Box> peers = Sets.newLinkedHashSet();
      for (Unit unit : this.units) {
        if (unit.contains(box)) {
          owners.add(unit);
          peers.addAll(unit);
        }
      }
      peers.remove(box);
      unitsByBox.add(owners.build());
      peersByBox.add(ImmutableSet.copyOf(Sets.newTreeSet(peers)));
    }
    this.unitsByBox = unitsByBox.build();
    this.peersByBox = peersByBox.build();
  }

  /** Tells whether the two main diagonals are units. */
  public boolean hasDiagonals() {
    return diagonal;
  }

  /** All the units: rows, then columns, then blocks, then any diagonals. */
  public List<Unit> units() {
    return units;
  }

  /** The units containing the given box, in the order of {@link #units}. */
  public List<Unit> unitsOf(Box box) {
    return unitsByBox.get(box.index);
  }

  /** The boxes sharing a unit with the given box, not including it, in box order. */
  public Set<Box> peersOf(Box box) {
    return peersByBox.get(box.index);
  }

  /**
   * Tells whether the given candidates amount to a solution under this
   * topology: every box has exactly one candidate, and every unit holds each
   * numeral exactly once.
   */
  public boolean isSolution(CandidateView candidates) {
    for (Unit unit : units) {
      int seen = 0;
      for (Box box : unit) {
        NumSet set = candidates.get(box);
        if (set.size() != 1 || (seen & set.bits) != 0)
          return false;
        seen |= set.bits;
      }
      if (seen != NumSet.ALL_BITS)
        return false;
    }
    return true;
  }

  @Override public String toString() {
    return diagonal ? "diagonal" : "standard";
  }
}
