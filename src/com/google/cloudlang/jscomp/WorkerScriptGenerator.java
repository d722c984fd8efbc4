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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the TypeScript handler stub of a worker. The stub declares an {@code Env} interface
 * with one property per binding, reads every binding out of {@code env} and lists the functions the
 * worker hosts.
 *
 * <pre>
 * interface Env {
 *   STORE: KVNamespace;
 * }
 *
 * export default {
 *   async fetch(request: Request, env: Env): Promise&lt;Response&gt; {
 *     const store = env.STORE;
 *
 *     // handler: put
 *     return new Response("ok");
 *   }
 * };
 * </pre>
 */
public final class WorkerScriptGenerator {

  private static final Joiner LINE_JOINER = Joiner.on('\n');
  private static final String INDENT = "  ";

  public WorkerScriptGenerator() {}

  public String generate(WorkerGroup group) {
    List<String> envTypes = new ArrayList<>();
    List<String> envReads = new ArrayList<>();
    for (String state : group.getOwnedState()) {
      envTypes.add(INDENT + bindingName(state) + ": KVNamespace;");
      envReads.add(INDENT + "const " + state + " = env." + bindingName(state) + ";");
    }
    for (String dep : group.getServiceDeps()) {
      envTypes.add(INDENT + bindingName(dep) + ": Fetcher;");
      envReads.add(INDENT + "const " + dep + " = env." + bindingName(dep) + ";");
    }

    List<String> body = new ArrayList<>(envReads);
    if (!envReads.isEmpty()) {
      body.add("");
    }
    for (String function : group.getFunctions()) {
      body.add(INDENT + "// handler: " + function);
    }
    body.add(INDENT + "return new Response(\"ok\");");

    StringBuilder sb = new StringBuilder();
    if (!envTypes.isEmpty()) {
      sb.append("interface Env {\n");
      LINE_JOINER.appendTo(sb, envTypes);
      sb.append("\n}\n\n");
    }
    String envParam = envTypes.isEmpty() ? "_env" : "env";
    sb.append("export default {\n")
        .append(INDENT)
        .append("async fetch(request: Request, ")
        .append(envParam)
        .append(": Env): Promise<Response> {\n");
    LINE_JOINER.appendTo(sb, body);
    sb.append('\n').append(INDENT).append("}\n};\n");
    return sb.toString();
  }

  /** The {@code Env} property that holds a state variable or a service. */
  static String bindingName(String name) {
    return Ascii.toUpperCase(name);
  }
}
