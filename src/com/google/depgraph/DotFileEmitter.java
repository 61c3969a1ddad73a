/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.depgraph;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prints a {@link ModuleDepGraph} as a dot file, with an arc from each definition to each of its
 * uses. For a description of the dot format refer to <a href="http://www.graphviz.org">Graphviz</a>.
 *
 * <p>Typical usage: <code>System.out.println(DotFileEmitter.toDot(graph));</code>
 *
 * <p>Node and arc lines are sorted, so the output does not depend on hash order.
 */
public final class DotFileEmitter {
  private static final String INDENT = "  ";
  private static final String ARROW = " -> ";

  private static final String INTERFACE_COLOR = "lightblue2";
  private static final String IMPLEMENTATION_COLOR = "lightgoldenrod1";

  /** Returns the dot representation of {@code graph}. */
  public static String toDot(ModuleDepGraph graph) {
    StringBuilder builder = new StringBuilder();
    try {
      appendDot(graph, builder);
    } catch (IOException e) {
      // StringBuilder does not throw.
      throw new AssertionError(e);
    }
    return builder.toString();
  }

  /** Appends the dot representation of {@code graph} to {@code out}. */
  public static void appendDot(ModuleDepGraph graph, Appendable out) throws IOException {
    List<String> nodeLines = new ArrayList<>();
    graph.forEachNode(node -> nodeLines.add(formatNode(node)));
    Collections.sort(nodeLines);

    List<String> arcLines = new ArrayList<>();
    graph.forEachArc(
        (def, use) -> arcLines.add(formatNodeName(def) + ARROW + formatNodeName(use)));
    Collections.sort(arcLines);

    out.append("digraph DependencyGraph {\n");
    out.append(INDENT).append("node [style=filled];\n");
    for (String line : nodeLines) {
      out.append(INDENT).append(line).append(";\n");
    }
    for (String line : arcLines) {
      out.append(INDENT).append(line).append(";\n");
    }
    out.append("}\n");
  }

  private static String formatNode(GraphNode node) {
    StringBuilder sb = new StringBuilder();
    sb.append(formatNodeName(node));
    sb.append(" [label=\"").append(escape(node.getKey().toString()));
    if (node.getFile() != null) {
      sb.append("\\n").append(escape(node.getFile()));
    }
    if (node.getFingerprint() != null) {
      sb.append("\\n#").append(escape(node.getFingerprint()));
    }
    sb.append("\" color=\"");
    sb.append(node.getKey().isInterface() ? INTERFACE_COLOR : IMPLEMENTATION_COLOR);
    sb.append('"');
    if (node.isExpat()) {
      sb.append(" style=\"filled,dashed\"");
    }
    sb.append(']');
    return sb.toString();
  }

  private static String formatNodeName(GraphNode node) {
    return "node" + node.getSequenceNumber();
  }

  private static String escape(String label) {
    return label.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private DotFileEmitter() {}
}
