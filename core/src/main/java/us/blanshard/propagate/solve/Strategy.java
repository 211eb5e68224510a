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

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.core.Numeral;
import us.blanshard.propagate.core.Topology;
import us.blanshard.propagate.core.Unit;

/**
 * The ways of narrowing down a candidate map.  Each strategy updates the map
 * in place and returns false if it ran into a contradiction: a box that would
 * be left with no candidates.  On a false return the map is only partly
 * updated and should be thrown away.
 *
 * @author Luke Blanshard
 */
public enum Strategy {

  /**
   * Removes the numeral of every solved box from the candidates of all its
   * peers.  Works against the map as it changes, so a peer solved along the
   * way is itself eliminated from its own peers if it comes later in box
   * order.  Stops at the first box that would run out of candidates.
   */
  ELIMINATION {
    @Override public boolean apply(CandidateMap map, Topology topology) {
      for (Box box : Box.ALL) {
        NumSet value = map.get(box);
        if (!value.isSingleton()) continue;
        Numeral num = value.only();
        for (Box peer : topology.peersOf(box)) {
          NumSet remaining = map.get(peer).minus(num);
          if (remaining.isEmpty())
            return false;  // The peer's only candidate is this box's numeral.
          map.set(peer, remaining);
        }
      }
      return true;
    }
  },

  /**
   * Within each unit, a numeral that only one box can still hold is assigned
   * to that box.  Never fails by itself: a numeral with no possible box is
   * left for elimination or the search to trip over.
   */
  ONLY_CHOICE {
    @Override public boolean apply(CandidateMap map, Topology topology) {
      for (Unit unit : topology.units()) {
        for (Numeral num : Numeral.ALL) {
          Box only = null;
          int count = 0;
          for (Box box : unit) {
            if (map.get(box).contains(num)) {
              only = box;
              if (++count > 1) break;
            }
          }
          if (count == 1)
            map.assign(only, num);
        }
      }
      return true;
    }
  },

  /**
   * Within each unit, two boxes with the same pair of candidates must hold
   * those two numerals between them, so no other box of the unit can hold
   * either.  Repeats over all units until nothing changes, so applying it a
   * second time is a no-op.  Fails if some third box is left with nothing.
   */
  NAKED_TWINS {
    @Override public boolean apply(CandidateMap map, Topology topology) {
      boolean changed;
      do {
        changed = false;
        for (Unit unit : topology.units()) {
          for (int i = 0; i < Unit.UNIT_SIZE; ++i) {
            NumSet twins = map.get(unit.get(i));
            if (twins.size() != 2) continue;
            for (int j = i + 1; j < Unit.UNIT_SIZE; ++j) {
              if (!map.get(unit.get(j)).equals(twins)) continue;
              for (int k = 0; k < Unit.UNIT_SIZE; ++k) {
                if (k == i || k == j) continue;
                Box other = unit.get(k);
                NumSet remaining = map.get(other).minus(twins);
                if (remaining.isEmpty())
                  return false;
                changed |= map.set(other, remaining);
              }
            }
          }
        }
      } while (changed);
      return true;
    }
  };

  /**
   * Applies this strategy to the given map using the units and peers of the
   * given topology.  Returns false if a contradiction turned up.
   */
  public abstract boolean apply(CandidateMap map, Topology topology);
}
