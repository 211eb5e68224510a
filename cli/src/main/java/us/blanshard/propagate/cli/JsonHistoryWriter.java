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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.propagate.solve.Candidates;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes each puzzle's assignment history as a json file in a directory, for
 * an external viewer to animate.  Puzzle N goes to {@code puzzle-N.json}.
 *
 * @author Luke Blanshard
 */
public class JsonHistoryWriter implements AssignmentVisualizer {
  private static final Logger logger = Logger.getLogger(JsonHistoryWriter.class.getName());

  private final File directory;

  public JsonHistoryWriter(File directory) {
    this.directory = checkNotNull(directory);
  }

  /** Returns the file that the given puzzle's history is written to. */
  public File fileFor(int puzzleNumber) {
    return new File(directory, "puzzle-" + puzzleNumber + ".json");
  }

  @Override public void visualize(int puzzleNumber, List<Candidates> history) throws IOException {
    if (!directory.isDirectory() && !directory.mkdirs())
      throw new IOException("Unable to create directory " + directory);
    File file = fileFor(puzzleNumber);
    PrintWriter out = new PrintWriter(file, "UTF-8");
    try {
      HistoryJson.GSON.toJson(history, HistoryJson.HISTORY_TYPE, out);
      if (out.checkError())
        throw new IOException("Unable to write " + file);
    } finally {
      out.close();
    }
    logger.info("Wrote " + history.size() + " snapshots to " + file);
  }
}
