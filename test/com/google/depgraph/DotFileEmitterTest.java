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

import static com.google.common.truth.Truth.assertThat;
import static com.google.depgraph.TestKeys.decl;
import static com.google.depgraph.TestKeys.iface;
import static com.google.depgraph.TestKeys.impl;
import static com.google.depgraph.TestKeys.useOnly;

import com.google.common.base.Joiner;
import com.google.depgraph.snapshot.FileSnapshot;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DotFileEmitter} */
@RunWith(JUnit4.class)
public final class DotFileEmitterTest {

  private final ModuleDepGraph graph = new ModuleDepGraph();

  @Test
  public void testEmptyGraph() {
    assertThat(DotFileEmitter.toDot(graph))
        .isEqualTo("digraph DependencyGraph {\n  node [style=filled];\n}\n");
  }

  @Test
  public void testNodesAndArcs() {
    graph.integrate("a", FileSnapshot.builder("a").add(decl("a", iface("k1"), "1")).build());
    graph.integrate(
        "b",
        FileSnapshot.builder("b")
            .add(decl("b", impl("k2"), null, iface("k1")))
            .add(useOnly(iface("k1")))
            .build());

    assertThat(DotFileEmitter.toDot(graph))
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "digraph DependencyGraph {",
                    "  node [style=filled];",
                    "  node0 [label=\"topLevel interface k1\\na\\n#1\" color=\"lightblue2\"];",
                    "  node1 [label=\"topLevel implementation k2\\nb\""
                        + " color=\"lightgoldenrod1\"];",
                    "  node0 -> node1;",
                    "}\n"));
  }

  @Test
  public void testExpatsAreDashed() {
    graph.integrate(
        "b",
        FileSnapshot.builder("b")
            .add(decl("b", iface("k2"), "2", iface("k1")))
            .add(useOnly(iface("k1")))
            .build());

    String dot = DotFileEmitter.toDot(graph);

    assertThat(dot)
        .contains(
            "  node1 [label=\"topLevel interface k1\" color=\"lightblue2\""
                + " style=\"filled,dashed\"];\n");
    assertThat(dot).contains("  node1 -> node0;\n");
  }

  @Test
  public void testLabelsAreEscaped() {
    graph.integrate(
        "dir\\a", FileSnapshot.builder("dir\\a").add(decl("dir\\a", iface("q\"k"), "1")).build());

    assertThat(DotFileEmitter.toDot(graph))
        .contains("[label=\"topLevel interface q\\\"k\\ndir\\\\a\\n#1\" color=\"lightblue2\"]");
  }
}
