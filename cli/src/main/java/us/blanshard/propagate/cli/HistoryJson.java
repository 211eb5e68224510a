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

import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import us.blanshard.propagate.core.Box;
import us.blanshard.propagate.core.NumSet;
import us.blanshard.propagate.solve.CandidateMap;
import us.blanshard.propagate.solve.Candidates;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Static methods that convert assignment histories to and from json.  Each
 * snapshot becomes an object mapping box names to candidate strings, as in
 * {@code {"A1": "2", "A2": "456", ...}}.
 *
 * @author Luke Blanshard
 */
public class HistoryJson {

  /** A Type to use with {@link Gson} for assignment histories. */
  @SuppressWarnings("serial")
  public static final Type HISTORY_TYPE = new TypeToken<List<Candidates>>(){}.getType();

  /** A convenience for reading/writing histories. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers a type adapter in the given builder so that candidate snapshots
   * can be serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Candidates.class, new TypeAdapter<Candidates>() {
      @Override public void write(JsonWriter out, Candidates value) throws IOException {
        out.beginObject();
        for (Box box : Box.ALL)
          out.name(box.name()).value(value.get(box).toString());
        out.endObject();
      }
      @Override public Candidates read(JsonReader in) throws IOException {
        // Boxes left out of the object keep all their candidates.
        CandidateMap map = Candidates.BLANK.toMap();
        in.beginObject();
        while (in.hasNext()) {
          Box box = Box.named(in.nextName());
          map.set(box, NumSet.fromString(in.nextString()));
        }
        in.endObject();
        return map.snapshot();
      }
    });
    return builder;
  }

  public static String toJson(List<Candidates> history) {
    return GSON.toJson(history, HISTORY_TYPE);
  }

  public static List<Candidates> fromJson(String json) {
    return GSON.fromJson(json, HISTORY_TYPE);
  }

  private HistoryJson() {}
}
