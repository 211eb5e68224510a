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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import java.util.Set;

public class TopologyTest {

  private static Box b(String name) {
    return Box.named(name);
  }

  @Test public void instances() {
    assertSame(Topology.STANDARD, Topology.of(false));
    assertSame(Topology.DIAGONAL, Topology.of(true));
    assertEquals(false, Topology.STANDARD.hasDiagonals());
    assertEquals(true, Topology.DIAGONAL.hasDiagonals());
    assertEquals(27, Topology.STANDARD.units().size());
    assertEquals(29, Topology.DIAGONAL.units().size());
    assertThat(Topology.DIAGONAL.units()).containsAtLeastElementsIn(Topology.STANDARD.units());
  }

  @Test public void unitOrder() {
    assertThat(Topology.DIAGONAL.units()).containsExactlyElementsIn(Unit.allUnits()).inOrder();
    assertThat(Topology.STANDARD.units())
        .containsExactlyElementsIn(Unit.allUnits().subList(0, 27)).inOrder();
    for (Unit unit : Topology.STANDARD.units())
      assertThat(unit.type).isNotEqualTo(Unit.Type.DIAGONAL);
  }

  @Test public void unitsOf() {
    for (Box box : Box.ALL) {
      assertThat(Topology.STANDARD.unitsOf(box))
          .containsExactly(box.row, box.column, box.block).inOrder();
      int diagonals = (box.isOnMainDiagonal() ? 1 : 0) + (box.isOnAntiDiagonal() ? 1 : 0);
      assertEquals(3 + diagonals, Topology.DIAGONAL.unitsOf(box).size());
    }
    assertThat(Topology.DIAGONAL.unitsOf(b("A1"))).contains(Diagonal.MAIN);
    assertThat(Topology.DIAGONAL.unitsOf(b("E5"))).containsAtLeast(Diagonal.MAIN, Diagonal.ANTI);
    assertEquals(5, Topology.DIAGONAL.unitsOf(b("E5")).size());
  }

  @Test public void standardPeers() {
    for (Box box : Box.ALL) {
      Set<Box> peers = Topology.STANDARD.peersOf(box);
      assertEquals(20, peers.size());
      for (Box peer : peers) {
        assertEquals(true, box.row == peer.row || box.column == peer.column
                           || box.block == peer.block);
      }
    }
  }

  @Test public void diagonalPeers() {
    assertEquals(26, Topology.DIAGONAL.peersOf(b("A1")).size());
    assertEquals(26, Topology.DIAGONAL.peersOf(b("D4")).size());
    assertEquals(26, Topology.DIAGONAL.peersOf(b("I1")).size());
    assertEquals(32, Topology.DIAGONAL.peersOf(b("E5")).size());
    assertEquals(20, Topology.DIAGONAL.peersOf(b("A2")).size());
    assertThat(Topology.DIAGONAL.peersOf(b("A1"))).contains(b("I9"));
    assertThat(Topology.STANDARD.peersOf(b("A1"))).doesNotContain(b("I9"));
  }

  @Test public void peersAreSymmetricAndExcludeSelf() {
    for (Topology topology : new Topology[] {Topology.STANDARD, Topology.DIAGONAL}) {
      for (Box box : Box.ALL) {
        assertThat(topology.peersOf(box)).doesNotContain(box);
        for (Box peer : topology.peersOf(box))
          assertThat(topology.peersOf(peer)).contains(box);
      }
    }
  }

  @Test public void peersInBoxOrder() {
    assertThat(Topology.STANDARD.peersOf(b("E5"))).isInOrder();
  }

  @Test public void isSolution() {
    final String solved = "534678912672195348198342567859761423426853791713924856961537284287419635345286179";
    CandidateView view = new CandidateView() {
      @Override public NumSet get(Box box) {
        return Numeral.fromChar(solved.charAt(box.index)).asSet();
      }
    };
    assertEquals(true, Topology.STANDARD.isSolution(view));
    assertEquals(false, Topology.DIAGONAL.isSolution(view));  // The diagonals repeat digits.

    CandidateView blank = new CandidateView() {
      @Override public NumSet get(Box box) {
        return NumSet.all();
      }
    };
    assertEquals(false, Topology.STANDARD.isSolution(blank));
  }
}
