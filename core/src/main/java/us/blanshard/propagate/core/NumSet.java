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
import static com.google.common.base.Preconditions.checkState;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of Numerals, used to keep track of the candidate values
 * for a given Sudoku box.  Iterates in ascending order, and prints as the
 * compact string of its digits, such as "1379".
 *
 * @author Luke Blanshard
 */
@Immutable
public final class NumSet extends AbstractSet<Numeral> implements Set<Numeral> {

  /** The bits of the set holding every numeral. */
  public static final short ALL_BITS = (1 << Numeral.COUNT) - 1;

  /** The numerals in this set expressed as a bit set. */
  public final short bits;

  private final byte[] nums;

  private NumSet(short bits) {
    this.bits = bits;

    this.nums = new byte[Integer.bitCount(bits)];
    byte num = 1;
    int count = 0;
    for (int bit = 1; bit <= bits; bit = bit << 1, ++num) {
      if ((bits & bit) != 0) {
        nums[count++] = num;
      }
    }
  }

  /** Returns the set corresponding to the given bit set. */
  public static NumSet ofBits(int bits) {
    return instances[bits];
  }

  /** Returns the set containing the given numerals. */
  public static NumSet of(Numeral... nums) {
    int bits = 0;
    for (Numeral n : nums)
      bits |= n.bit;
    return instances[bits];
  }

  /** Returns the set of all nine numerals. */
  public static NumSet all() {
    return instances[ALL_BITS];
  }

  /**
   * Parses a compact digit string such as "128".  Every character must be a
   * digit from 1 to 9; repeats are ignored.
   */
  public static NumSet fromString(String digits) {
    int bits = 0;
    for (int i = 0; i < digits.length(); ++i) {
      Numeral num = Numeral.fromChar(digits.charAt(i));
      checkArgument(num != null, "Not a digit from 1 to 9: '%s' in %s", digits.charAt(i), digits);
      bits |= num.bit;
    }
    return instances[bits];
  }

  /** Returns the intersection of this set and another one. */
  public NumSet and(NumSet that) {
    return instances[this.bits & that.bits];
  }

  /** Returns the asymmetric difference of this set and another one. */
  public NumSet minus(NumSet that) {
    return instances[this.bits & (~that.bits)];
  }

  /** Returns this set less the given numeral. */
  public NumSet minus(Numeral num) {
    return instances[this.bits & (~num.bit)];
  }

  public boolean contains(Numeral num) {
    return (bits & num.bit) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Numeral) {
      return contains((Numeral) o);
    }
    return false;
  }

  /** Tells whether this set has exactly one member. */
  public boolean isSingleton() {
    return nums.length == 1;
  }

  /** Returns the only member of this set, which must be a singleton. */
  public Numeral only() {
    checkState(nums.length == 1, "Not a singleton: %s", this);
    return Numeral.of(nums[0]);
  }

  /** Returns the numeral at the given index within this set. */
  public Numeral get(int index) {
    return Numeral.of(nums[index]);
  }

  @Override public Iterator<Numeral> iterator() {
    return new Iter();
  }

  @Override public int size() {
    return nums.length;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof NumSet) return bits == ((NumSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    int answer = 0;
    for (byte num : nums) answer += num;
    return answer;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder(nums.length);
    for (byte num : nums)
      sb.append((char) ('0' + num));
    return sb.toString();
  }

  private class Iter implements Iterator<Numeral> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < nums.length;
    }

    @Override public Numeral next() {
      if (!hasNext()) throw new NoSuchElementException();
      return Numeral.of(nums[nextIndex++]);
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private static final NumSet[] instances;
  static {
    instances = new NumSet[1 << Numeral.COUNT];
    for (short i = 0; i < instances.length; ++i) {
      instances[i] = new NumSet(i);
    }
  }
}
