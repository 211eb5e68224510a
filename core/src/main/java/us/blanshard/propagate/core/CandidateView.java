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

/**
 * Read access to the candidate numerals of every box of a grid.
 *
 * @author Luke Blanshard
 */
public interface CandidateView {

  /** Returns the numerals still possible for the given box; never null. */
  NumSet get(Box box);
}
