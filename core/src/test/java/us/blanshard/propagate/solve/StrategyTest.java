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

import static com.google.common.truth.Truth.assertThat;
import static us.blanshard.propagate.core.NumSetTest.set;

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.core.Numeral;
import us.blanshard.propagate.core.Topology;

import org.junit.Test;

public class StrategyTest {

  private static Box b(String name) {
    return Box.named(name);
  }

  private static CandidateMap m(String grid) {
    return Candidates.fromString(grid).toMap();
  }

  @Test public void eliminationRemovesFromPeers() {
    CandidateMap map = m("5" + Grids.dots(80));
    assertThat(Strategy.ELIMINATION.apply(map, Topology.STANDARD)).isTrue();
    NumSet noFive = NumSet.all().minus(Numeral.of(5));
    for (Box peer : Topology.STANDARD.peersOf(b("A1")))
      assertThat(map.get(peer)).isEqualTo(noFive);
    assertThat(map.get(b("A1"))).isEqualTo(set(5));
    assertThat(map.get(b("I9"))).isEqualTo(NumSet.all());
    assertThat(map.get(b("E5"))).isEqualTo(NumSet.all());
  }

  @Test public void eliminationUsesDiagonals() {
    CandidateMap map = m("5" + Grids.dots(80));
    assertThat(Strategy.ELIMINATION.apply(map, Topology.DIAGONAL)).isTrue();
    NumSet noFive = NumSet.all().minus(Numeral.of(5));
    assertThat(map.get(b("I9"))).isEqualTo(noFive);
    assertThat(map.get(b("E5"))).isEqualTo(noFive);
    assertThat(map.get(b("A2"))).isEqualTo(noFive);
    // H8 shares only the main diagonal with A1; H2 is on the other diagonal.
    assertThat(map.get(b("H8"))).isEqualTo(noFive);
    assertThat(map.get(b("H2"))).isEqualTo(NumSet.all());
    assertThat(map.get(b("G3"))).isEqualTo(NumSet.all());
  }

  @Test public void eliminationContracts() {
    CandidateMap map = m(Grids.DIAGONAL);
    Candidates before = map.snapshot();
    assertThat(Strategy.ELIMINATION.apply(map, Topology.DIAGONAL)).isTrue();
    for (Box box : Box.ALL) {
      assertThat(before.get(box)).containsAtLeastElementsIn(map.get(box));
      assertThat(map.get(box)).isNotEmpty();
    }
    assertThat(map.snapshot()).isNotEqualTo(before);
  }

  @Test public void eliminationFindsContradiction() {
    assertThat(Strategy.ELIMINATION.apply(m(Grids.DUPLICATE), Topology.STANDARD)).isFalse();
  }

  @Test public void eliminationLeavesSolvedGridAlone() {
    CandidateMap map = m(Grids.SOLVED);
    assertThat(Strategy.ELIMINATION.apply(map, Topology.STANDARD)).isTrue();
    assertThat(map.snapshot()).isEqualTo(Candidates.fromString(Grids.SOLVED));
  }

  @Test public void onlyChoice() {
    CandidateMap map = Candidates.BLANK.toMap();
    NumSet noFive = NumSet.all().minus(Numeral.of(5));
    for (int col = 1; col <= 8; ++col)
      map.set(b("A" + col), noFive);
    assertThat(Strategy.ONLY_CHOICE.apply(map, Topology.STANDARD)).isTrue();
    assertThat(map.get(b("A9"))).isEqualTo(set(5));
    assertThat(map.solvedCount()).isEqualTo(1);
  }

  @Test public void onlyChoiceOnBlankDoesNothing() {
    CandidateMap map = Candidates.BLANK.toMap();
    assertThat(Strategy.ONLY_CHOICE.apply(map, Topology.DIAGONAL)).isTrue();
    assertThat(map.snapshot()).isEqualTo(Candidates.BLANK);
  }

  @Test public void nakedTwins() {
    CandidateMap map = Candidates.BLANK.toMap();
    map.set(b("A1"), set(1, 2));
    map.set(b("A2"), set(1, 2));
    map.set(b("A3"), set(1, 2, 3));
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.STANDARD)).isTrue();

    NumSet rest = set(3, 4, 5, 6, 7, 8, 9);
    assertThat(map.get(b("A1"))).isEqualTo(set(1, 2));
    assertThat(map.get(b("A2"))).isEqualTo(set(1, 2));
    assertThat(map.get(b("A3"))).isEqualTo(set(3));
    assertThat(map.get(b("A9"))).isEqualTo(rest);  // Same row
    assertThat(map.get(b("C3"))).isEqualTo(rest);  // Same block
    assertThat(map.get(b("D1"))).isEqualTo(NumSet.all());  // Only one twin in this column
    assertThat(map.get(b("B4"))).isEqualTo(NumSet.all());
  }

  @Test public void nakedTwinsIsIdempotent() {
    CandidateMap map = Candidates.BLANK.toMap();
    map.set(b("A1"), set(1, 2));
    map.set(b("A2"), set(1, 2));
    map.set(b("A3"), set(1, 2, 3));
    map.set(b("E5"), set(4, 7));
    map.set(b("E9"), set(4, 7));
    map.set(b("E1"), set(4, 6, 7));
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.DIAGONAL)).isTrue();
    Candidates once = map.snapshot();
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.DIAGONAL)).isTrue();
    assertThat(map.snapshot()).isEqualTo(once);
  }

  @Test public void nakedTwinsOnReducedPuzzleIsIdempotent() {
    CandidateMap map = m(Grids.BRANCHING);
    assertThat(Reducer.standard(Topology.STANDARD).reduce(map)).isTrue();
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.STANDARD)).isTrue();
    Candidates once = map.snapshot();
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.STANDARD)).isTrue();
    assertThat(map.snapshot()).isEqualTo(once);
  }

  @Test public void nakedTwinsFindsContradiction() {
    CandidateMap map = Candidates.BLANK.toMap();
    map.set(b("A1"), set(1, 2));
    map.set(b("A2"), set(1, 2));
    map.set(b("A3"), set(1, 2));
    assertThat(Strategy.NAKED_TWINS.apply(map, Topology.STANDARD)).isFalse();
  }
}
