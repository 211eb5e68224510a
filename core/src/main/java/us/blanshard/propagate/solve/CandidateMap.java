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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.CandidateView;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.core.Numeral;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The mutable state of one puzzle, or of one search branch: the numerals
 * still possible for each box.  Every box always has at least one candidate.
 *
 * <p> When recording is turned on, every change that leaves a box with a
 * single candidate appends a snapshot of the whole map to its history.  A
 * {@linkplain #copy copy} starts with the history of its original.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class CandidateMap implements CandidateView {

  private final short[] bits;
  private final boolean recording;
  @Nullable private History history;

  private CandidateMap(short[] bits, boolean recording, @Nullable History history) {
    this.bits = bits;
    this.recording = recording;
    this.history = history;
  }

  /** Returns a map starting with the given candidates. */
  public static CandidateMap of(Candidates start, boolean recordHistory) {
    return new CandidateMap(start.copyBits(), recordHistory, null);
  }

  @Override public NumSet get(Box box) {
    return NumSet.ofBits(bits[box.index]);
  }

  /**
   * Replaces the candidates of the given box.  Does nothing and returns false
   * if they are unchanged; otherwise returns true, and if the new set is a
   * singleton and this map is recording, appends a snapshot to the history.
   *
   * @throws IllegalArgumentException if the set is empty: callers must detect
   *     the contradiction before trying to store it
   */
  public boolean set(Box box, NumSet value) {
    checkArgument(!value.isEmpty(), "No candidates left for %s", box);
    if (bits[box.index] == value.bits) return false;
    bits[box.index] = value.bits;
    if (recording && value.isSingleton()) {
      history = new History(snapshot(), history);
    }
    return true;
  }

  /** Sets the given box to the given numeral alone. */
  public boolean assign(Box box, Numeral num) {
    return set(box, num.asSet());
  }

  /** Returns an independent copy of this map, including its history. */
  public CandidateMap copy() {
    return new CandidateMap(bits.clone(), recording, history);
  }

  /** The number of boxes with exactly one candidate. */
  public int solvedCount() {
    return Candidates.solvedCount(bits);
  }

  /** Tells whether every box has exactly one candidate. */
  public boolean isSolved() {
    return solvedCount() == Box.COUNT;
  }

  public boolean isRecording() {
    return recording;
  }

  /** Returns an immutable copy of the current candidates. */
  public Candidates snapshot() {
    return new Candidates(bits.clone());
  }

  /**
   * Returns the snapshots recorded by this map and the maps it was copied
   * from, oldest first.  Empty when not recording.
   */
  public ImmutableList<Candidates> history() {
    return History.toList(history);
  }

  @Override public String toString() {
    return snapshot().toString();
  }
}
