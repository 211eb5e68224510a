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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import us.blanshard.propagate.core.Topology;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * Applies a sequence of strategies over and over until a full pass solves no
 * further boxes.  The number of solved boxes never goes down and cannot pass
 * 81, so this always stops.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Reducer {

  private final Topology topology;
  private final ImmutableList<Strategy> strategies;

  public Reducer(Topology topology, Iterable<Strategy> strategies) {
    this.topology = checkNotNull(topology);
    this.strategies = ImmutableList.copyOf(strategies);
    checkArgument(!this.strategies.isEmpty(), "No strategies");
  }

  /** Elimination followed by only-choice. */
  public static Reducer standard(Topology topology) {
    return new Reducer(topology, ImmutableList.of(Strategy.ELIMINATION, Strategy.ONLY_CHOICE));
  }

  /** Elimination, only-choice, and then naked twins, in each pass. */
  public static Reducer withNakedTwins(Topology topology) {
    return new Reducer(topology, ImmutableList.of(
        Strategy.ELIMINATION, Strategy.ONLY_CHOICE, Strategy.NAKED_TWINS));
  }

  public Topology getTopology() {
    return topology;
  }

  public List<Strategy> getStrategies() {
    return strategies;
  }

  /**
   * Reduces the given map in place to a fixed point.  Returns false if some
   * strategy found a contradiction, in which case the map is left half-done.
   */
  public boolean reduce(CandidateMap map) {
    while (true) {
      int before = map.solvedCount();
      for (Strategy strategy : strategies) {
        if (!strategy.apply(map, topology))
          return false;
      }
      if (map.solvedCount() <= before)
        return true;
    }
  }
}
