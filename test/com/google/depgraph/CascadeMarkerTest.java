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

import com.google.depgraph.snapshot.FileSnapshot;
import com.google.depgraph.snapshot.SnapshotNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for marking affected files in {@link ModuleDepGraph}. */
@RunWith(JUnit4.class)
public final class CascadeMarkerTest {

  private static final DependencyKey LIB = DependencyKey.forExternalDependency("/sdk/Lib.module");

  private final ModuleDepGraph graph = new ModuleDepGraph();

  private void integrate(String file, SnapshotNode... nodes) {
    FileSnapshot.Builder builder = FileSnapshot.builder(file);
    for (SnapshotNode node : nodes) {
      builder.add(node);
    }
    graph.integrate(file, builder.build());
  }

  @Test
  public void testInterfaceUseCascadesButImplementationUseDoesNot() {
    integrate("a", decl("a", iface("k1"), "1"));
    integrate("b", decl("b", iface("k2"), "2", iface("k1")), useOnly(iface("k1")));
    integrate("c", decl("c", impl("k3"), "3", iface("k2")), useOnly(iface("k2")));

    List<String> visited = graph.markTransitive("a");

    assertThat(visited).containsExactly("a", "b", "c").inOrder();
    assertThat(graph.isMarked("b")).isTrue();
    assertThat(graph.isMarked("c")).isFalse();
    assertThat(graph.isMarked("a")).isFalse();
  }

  @Test
  public void testWalkContinuesThroughImplementationUses() {
    integrate("a", decl("a", iface("k1"), "1"));
    integrate("b", decl("b", impl("k2"), "2", iface("k1")), useOnly(iface("k1")));
    integrate("c", decl("c", iface("k3"), "3", impl("k2")), useOnly(impl("k2")));

    List<String> visited = graph.markTransitive("a");

    assertThat(visited).containsExactly("a", "b", "c").inOrder();
    assertThat(graph.isMarked("b")).isFalse();
    assertThat(graph.isMarked("c")).isTrue();
  }

  @Test
  public void testCyclesTerminate() {
    integrate("a", decl("a", iface("x"), "1", iface("y")), useOnly(iface("y")));
    integrate("b", decl("b", iface("y"), "1", iface("x")), useOnly(iface("x")));

    List<String> visited = graph.markTransitive("a");

    assertThat(visited).containsExactly("a", "b").inOrder();
    assertThat(graph.isMarked("a")).isTrue();
    assertThat(graph.isMarked("b")).isTrue();
  }

  @Test
  public void testAlreadyVisitedFilesAreNotRepeated() {
    integrate("a", decl("a", iface("k1"), "1"));
    integrate("b", decl("b", iface("k2"), "2", iface("k1")), useOnly(iface("k1")));
    integrate("c", decl("c", iface("k3"), "3", iface("k1")), useOnly(iface("k1")));

    List<String> visited = new ArrayList<>();
    visited.add("b");
    graph.markTransitive(visited, "a");

    assertThat(visited).containsExactly("b", "a", "c").inOrder();
  }

  @Test
  public void testFileWithoutNodesAffectsNothing() {
    integrate("a", decl("a", iface("k1"), "1"));

    assertThat(graph.markTransitive("unknown")).isEmpty();
  }

  @Test
  public void testExpatsDoNotCascade() {
    integrate("b", decl("b", iface("k2"), "2"));
    // A use-only record can still use other keys; its node is an expat.
    integrate("a", SnapshotNode.builder(iface("x")).addUse(iface("k2")).build());

    List<String> visited = graph.markTransitive("b");

    assertThat(visited).containsExactly("b");
    assertThat(graph.isMarked("a")).isFalse();
    assertThat(graph.isMarked("b")).isFalse();
  }

  @Test
  public void testMarkIntransitive() {
    assertThat(graph.isMarked("a")).isFalse();
    assertThat(graph.markIntransitive("a")).isTrue();
    assertThat(graph.markIntransitive("a")).isFalse();
    assertThat(graph.isMarked("a")).isTrue();
  }

  @Test
  public void testMarkExternal() {
    integrate("d", decl("d", iface("kd"), "1", LIB), useOnly(LIB));
    integrate("f", decl("f", iface("kf"), "1", iface("kd")), useOnly(iface("kd")));
    integrate("g", decl("g", iface("kg"), "1"));

    List<String> uses = new ArrayList<>();
    graph.markExternal(uses, "/sdk/Lib.module");

    assertThat(uses).containsExactly("d", "f").inOrder();
    assertThat(graph.isMarked("f")).isTrue();
  }

  @Test
  public void testMarkExternalSkipsMarkedFiles() {
    integrate("d", decl("d", iface("kd"), "1", LIB), useOnly(LIB));
    graph.markIntransitive("d");

    List<String> uses = new ArrayList<>();
    graph.markExternal(uses, "/sdk/Lib.module");

    assertThat(uses).isEmpty();
  }

  @Test
  public void testMarkExternalForUnknownDependency() {
    integrate("d", decl("d", iface("kd"), "1", LIB), useOnly(LIB));

    List<String> uses = new ArrayList<>();
    graph.markExternal(uses, "/sdk/Other.module");

    assertThat(uses).isEmpty();
  }
}
