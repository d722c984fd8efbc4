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

import com.google.common.base.Joiner;
import java.io.IOException;
import java.util.List;

/**
 * <p>GroupGraphDotFormatter prints out a dot file of the worker groups and the service
 * dependencies between them. For a detailed description of the dot format and visualization tool
 * refer to <a href="http://www.graphviz.org">Graphviz</a>.</p>
 * <p>Typical usage of this class</p>
 * <code>System.out.println(GroupGraphDotFormatter.toDot(<i>groups</i>));</code>
 */
public final class GroupGraphDotFormatter {
  private static final String INDENT = "  ";
  private static final String ARROW = " -> ";
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final Appendable builder;

  private GroupGraphDotFormatter(Appendable builder) {
    this.builder = builder;
  }

  /**
   * Converts worker groups to dot representation.
   * @param groups the groups, one node each
   * @return the dot representation of the dependency graph
   */
  public static String toDot(List<WorkerGroup> groups) {
    StringBuilder builder = new StringBuilder();
    try {
      appendDot(groups, builder);
    } catch (IOException e) {
      throw new IllegalStateException("Should not happen", e);
    }
    return builder.toString();
  }

  /**
   * Converts worker groups to dot representation and appends it to the given buffer.
   */
  public static void appendDot(List<WorkerGroup> groups, Appendable builder) throws IOException {
    GroupGraphDotFormatter formatter = new GroupGraphDotFormatter(builder);
    formatter.formatPreamble();
    for (WorkerGroup group : groups) {
      formatter.formatGroup(group);
    }
    for (WorkerGroup group : groups) {
      for (String dep : group.getServiceDeps()) {
        formatter.formatEdge(group.getName(), dep);
      }
    }
    formatter.formatConclusion();
  }

  private void formatPreamble() throws IOException {
    builder.append("digraph WorkerGroups {\n");
    builder.append(INDENT).append("node [shape=box];\n");
  }

  private void formatGroup(WorkerGroup group) throws IOException {
    StringBuilder label = new StringBuilder(group.getName());
    label.append("\\n").append(COMMA_JOINER.join(group.getFunctions()));
    if (!group.getOwnedState().isEmpty()) {
      label.append("\\nowns: ").append(COMMA_JOINER.join(group.getOwnedState()));
    }
    builder.append(INDENT);
    builder.append(quote(group.getName()));
    builder.append(" [label=\"");
    builder.append(label);
    builder.append("\"];\n");
  }

  private void formatEdge(String from, String to) throws IOException {
    builder.append(INDENT);
    builder.append(quote(from));
    builder.append(ARROW);
    builder.append(quote(to));
    builder.append(";\n");
  }

  private void formatConclusion() throws IOException {
    builder.append("}\n");
  }

  private static String quote(String id) {
    return "\"" + id.replace("\"", "\\\"") + "\"";
  }
}
