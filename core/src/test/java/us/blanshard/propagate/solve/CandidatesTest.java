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

import org.junit.Test;

public class CandidatesTest {

  @Test public void fromString() {
    Candidates c = Candidates.fromString(Grids.DIAGONAL);
    assertThat(c.get(Box.named("A1"))).isEqualTo(set(2));
    assertThat(c.get(Box.named("A2"))).isEqualTo(NumSet.all());
    assertThat(c.get(Box.named("I9"))).isEqualTo(set(3));
    assertThat(c.solvedCount()).isEqualTo(17);
    assertThat(c.isSolved()).isFalse();
    assertThat(c.toFlatString()).isEqualTo(Grids.DIAGONAL);
  }

  @Test public void unknownCharacters() {
    String grid = "0x" + Grids.SOLVED.substring(2);
    Candidates c = Candidates.fromString(grid);
    assertThat(c.get(Box.named("A1"))).isEqualTo(NumSet.all());
    assertThat(c.get(Box.named("A2"))).isEqualTo(NumSet.all());
    assertThat(c.toFlatString()).isEqualTo(".." + Grids.SOLVED.substring(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooShort() {
    Candidates.fromString(Grids.SOLVED.substring(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooLong() {
    Candidates.fromString(Grids.SOLVED + ".");
  }

  @Test public void blank() {
    assertThat(Candidates.BLANK).isEqualTo(Candidates.fromString(Grids.BLANK));
    assertThat(Candidates.BLANK.solvedCount()).isEqualTo(0);
  }

  @Test public void equality() {
    assertThat(Candidates.fromString(Grids.SOLVED)).isEqualTo(Candidates.fromString(Grids.SOLVED));
    assertThat(Candidates.fromString(Grids.SOLVED).hashCode())
        .isEqualTo(Candidates.fromString(Grids.SOLVED).hashCode());
    assertThat(Candidates.fromString(Grids.SOLVED)).isNotEqualTo(Candidates.BLANK);
  }

  @Test public void renderSolved() {
    String expected =
        "5 3 4 |6 7 8 |9 1 2 \n"
        + "6 7 2 |1 9 5 |3 4 8 \n"
        + "1 9 8 |3 4 2 |5 6 7 \n"
        + "------+------+------\n"
        + "8 5 9 |7 6 1 |4 2 3 \n"
        + "4 2 6 |8 5 3 |7 9 1 \n"
        + "7 1 3 |9 2 4 |8 5 6 \n"
        + "------+------+------\n"
        + "9 6 1 |5 3 7 |2 8 4 \n"
        + "2 8 7 |4 1 9 |6 3 5 \n"
        + "3 4 5 |2 8 6 |1 7 9 \n";
    assertThat(Candidates.fromString(Grids.SOLVED).toString()).isEqualTo(expected);
  }

  @Test public void renderCentersToWidestBox() {
    CandidateMap map = Candidates.fromString(Grids.SOLVED).toMap();
    map.set(Box.named("A1"), set(1, 5));
    String first = map.snapshot().toString().split("\n")[0];
    assertThat(first).isEqualTo("15  3  4 | 6  7  8 | 9  1  2 ");
  }
}
