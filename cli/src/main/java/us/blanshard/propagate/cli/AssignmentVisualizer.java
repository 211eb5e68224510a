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
package us.blanshard.propagate.cli;

import us.blanshard.propagate.solve.Candidates;

import java.io.IOException;
import java.util.List;

/**
 * Something that can show the sequence of assignments that led to a solution.
 * Optional: a failure here never changes the answer.
 *
 * @author Luke Blanshard
 */
public interface AssignmentVisualizer {

  /**
   * Presents the history of the given puzzle, its snapshots oldest first.
   * Puzzles are numbered from 1 in the order they were solved.
   */
  void visualize(int puzzleNumber, List<Candidates> history) throws IOException;
}
