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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A digit from one to nine: a possible value of a Sudoku box.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Numeral implements Comparable<Numeral> {
  /** The number of Numerals. */
  public static final int COUNT = 9;

  /** The number, in the range 1..9. */
  public final int number;

  /** The index, one less than the number. */
  public final int index;

  /** The bit corresponding to the number, 1 &lt;&lt; index. */
  public final short bit;

  public static Numeral of(int number) {
    return instances[number - 1];
  }

  /** Converts '1' through '9' to the corresponding numeral, anything else to null. */
  @Nullable public static Numeral fromChar(char c) {
    return c >= '1' && c <= '9' ? of(c - '0') : null;
  }

  public char toChar() {
    return (char) ('0' + number);
  }

  public NumSet asSet() {
    return NumSet.ofBits(bit);
  }

  /** All the numerals. */
  public static final List<Numeral> ALL;

  @Override public int compareTo(Numeral that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return Integer.toString(number);
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return number;  // Relied upon by NumSet
  }

  private Numeral(int index) {
    this.index = index;
    this.number = index + 1;
    this.bit = (short) (1 << index);
  }

  private static final Numeral[] instances;
  static {
    instances = new Numeral[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Numeral(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
