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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.depgraph.snapshot.FileSnapshot;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * The whole-program dependency graph for one build session, keyed by file identifiers.
 *
 * <p>Snapshots are integrated one file at a time with {@link #integrate}; afterwards the marking
 * operations tell the caller which other files are affected. The graph is mutated in place across
 * incremental builds and is never torn down until the session ends.
 *
 * <p>This class is not thread safe. Compilations may run in parallel, but their results must be
 * integrated one at a time.
 */
public final class ModuleDepGraph {
  private final DepGraphOptions options;
  private final NodeStore nodes = new NodeStore();
  private final ReverseUseIndex usesByDef = new ReverseUseIndex();

  /** Files whose interface is known to require downstream recompilation. */
  private final Set<String> cascadingFiles = new LinkedHashSet<>();

  /** Names of external dependencies currently referenced by some node. */
  private final Set<String> externalDependencies = new LinkedHashSet<>();

  private final GraphIntegrator integrator;
  private final CascadeMarker marker;

  public ModuleDepGraph() {
    this(new DepGraphOptions());
  }

  public ModuleDepGraph(DepGraphOptions options) {
    this.options = checkNotNull(options);
    this.integrator = new GraphIntegrator(nodes, usesByDef, externalDependencies);
    this.marker = new CascadeMarker(nodes, usesByDef, cascadingFiles);
  }

  public DepGraphOptions getOptions() {
    return options;
  }

  /**
   * Merges {@code snapshot} into the graph as the current contents of {@code file}.
   *
   * @return {@link LoadResult#UP_TO_DATE} if no key changed, else {@link
   *     LoadResult#AFFECTS_DOWNSTREAM}, along with the changed keys
   */
  @CanIgnoreReturnValue
  public IntegrationResult integrate(String file, FileSnapshot snapshot) {
    checkNotNull(file);
    checkNotNull(snapshot);
    if (options.shouldVerify()) {
      verify();
    }
    IntegrationResult result = integrator.integrate(file, snapshot);
    if (options.shouldVerify()) {
      verify();
    }
    return result;
  }

  /** Whether {@code file} has been marked as cascading. */
  public boolean isMarked(String file) {
    return marker.isMarked(file);
  }

  /** Marks {@code file} as cascading, returning whether it was newly marked. */
  @CanIgnoreReturnValue
  public boolean markIntransitive(String file) {
    return marker.markIntransitive(file);
  }

  /**
   * Appends to {@code visitedFiles} every file transitively affected by {@code file}, including
   * {@code file} itself, marking the ones reached through interface keys as cascading.
   */
  public void markTransitive(List<String> visitedFiles, String file) {
    marker.markTransitive(visitedFiles, file);
  }

  /** Convenience form of {@link #markTransitive(List, String)}. */
  public ImmutableList<String> markTransitive(String file) {
    List<String> visited = new ArrayList<>();
    marker.markTransitive(visited, file);
    return ImmutableList.copyOf(visited);
  }

  /**
   * Appends to {@code uses} the files affected by a change to the external dependency {@code
   * externalDependency}.
   */
  public void markExternal(List<String> uses, String externalDependency) {
    marker.markExternal(uses, externalDependency);
  }

  /** The external dependencies currently used by the program, in the order first seen. */
  public ImmutableList<String> getExternalDependencies() {
    return ImmutableList.copyOf(externalDependencies);
  }

  public void forEachNode(Consumer<GraphNode> fn) {
    nodes.forEachEntry((file, key, node) -> fn.accept(node));
  }

  /** Calls {@code fn} with every node whose key matches {@code key}, in any file. */
  public void forEachMatchingNode(DependencyKey key, Consumer<GraphNode> fn) {
    for (GraphNode node : nodes.allValuesForKey(key)) {
      fn.accept(node);
    }
  }

  /** Calls {@code fn} with each node that uses {@code def}. */
  public void forEachUseOf(GraphNode def, Consumer<GraphNode> fn) {
    marker.forEachUseOf(def, fn);
  }

  /** Calls {@code fn} with every (definition, use) pair of nodes. */
  public void forEachArc(BiConsumer<GraphNode, GraphNode> fn) {
    usesByDef.forEachDef(
        (defKey, useKeys) ->
            forEachMatchingNode(
                defKey,
                defNode -> {
                  for (DependencyKey useKey : useKeys) {
                    forEachMatchingNode(useKey, useNode -> fn.accept(defNode, useNode));
                  }
                }));
  }

  /**
   * Checks the data model invariants: one node per (file, key), the store indices agree with each
   * other and with the nodes, an expat never coexists with a definition of the same key, and the
   * external dependency names correspond exactly to the external dependency nodes.
   *
   * @throws IllegalStateException if the graph is corrupt
   */
  public void verify() {
    nodes.verify();
    nodes.forEachEntry(
        (file, key, node) -> {
          if (file == null) {
            checkState(
                nodes.allValuesForKey(key).size() == 1,
                "expat coexists with a definition of %s",
                key);
          }
          checkState(
              key.getKind() != NodeKind.EXTERNAL_DEPEND
                  || externalDependencies.contains(key.getName()),
              "external dependency is not tracked: %s",
              key.getName());
        });
    for (String external : externalDependencies) {
      checkState(
          !nodes.allValuesForKey(DependencyKey.forExternalDependency(external)).isEmpty(),
          "tracked external dependency has no node: %s",
          external);
    }
  }

  /** Whether {@code file} currently declares anything. */
  public boolean hasNodesInFile(String file) {
    return nodes.hasNodesInFile(file);
  }

  /** Visits each file holding nodes. */
  void forEachFile(Consumer<String> fn) {
    nodes.forEachKey1(
        (file, fileNodes) -> {
          if (file != null) {
            fn.accept(file);
          }
        });
  }

  @VisibleForTesting
  NodeStore getNodeStore() {
    return nodes;
  }

  @VisibleForTesting
  ReverseUseIndex getReverseUseIndex() {
    return usesByDef;
  }
}
