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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A persistent list of candidate snapshots, newest first.  Copies of a
 * candidate map share their common prefix, so the snapshots taken along a
 * failed search branch go away with the branch.
 */
@Immutable
final class History {
  final Candidates snapshot;
  @Nullable final History previous;
  final int size;

  History(Candidates snapshot, @Nullable History previous) {
    this.snapshot = snapshot;
    this.previous = previous;
    this.size = previous == null ? 1 : previous.size + 1;
  }

  /** Returns the snapshots of the given history, oldest first. */
  static ImmutableList<Candidates> toList(@Nullable History history) {
    if (history == null) return ImmutableList.of();
    Candidates[] array = new Candidates[history.size];
    for (History h = history; h != null; h = h.previous)
      array[h.size - 1] = h.snapshot;
    return ImmutableList.copyOf(Arrays.asList(array));
  }
}
