/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloudlang.jscomp;

import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Prints the result of the scope analysis and the worker groups derived from it as a JSON
 * object, for inspecting why functions were placed where they were.
 */
public final class AnalysisReportGenerator {

  private AnalysisReportGenerator() {}

  public static String generateReport(AnalysisResult analysis, List<WorkerGroup> groups) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();

      jsonWriter.name("module_vars").beginArray();
      for (ModuleVar var : analysis.getModuleVars()) {
        jsonWriter.beginObject();
        jsonWriter.name("name").value(var.getName());
        jsonWriter.name("mutable_state").value(var.isMutableState());
        jsonWriter.name("function").value(var.isFunction());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();

      jsonWriter.name("closures").beginArray();
      for (ClosureInfo closure : analysis.getClosures()) {
        jsonWriter.beginObject();
        jsonWriter.name("name").value(closure.getName());
        writeStrings(jsonWriter.name("free_vars"), closure.getFreeVars());
        writeStrings(jsonWriter.name("called_functions"), closure.getCalledFunctions());
        writeStrings(jsonWriter.name("captures_mutable"), closure.getCapturesMutable());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();

      writeStrings(jsonWriter.name("exports"), analysis.getExports());

      jsonWriter.name("groups").beginArray();
      for (WorkerGroup group : groups) {
        jsonWriter.beginObject();
        jsonWriter.name("name").value(group.getName());
        writeStrings(jsonWriter.name("functions"), group.getFunctions());
        writeStrings(jsonWriter.name("owned_state"), group.getOwnedState());
        writeStrings(jsonWriter.name("service_deps"), group.getServiceDeps());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();

      jsonWriter.endObject();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  private static void writeStrings(JsonWriter jsonWriter, Iterable<String> values)
      throws IOException {
    jsonWriter.beginArray();
    for (String value : values) {
      jsonWriter.value(value);
    }
    jsonWriter.endArray();
  }
}
