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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Works out which files are affected, transitively, by a change.
 *
 * <p>Two things are tracked separately. Every file reachable through use edges must be
 * re-examined. A file is additionally marked <i>cascading</i> when one of its nodes is reached
 * through an interface key: from then on any change to it must be assumed to affect all of its
 * users. Marks are permanent for the life of the graph.
 */
final class CascadeMarker {
  private static final Logger logger = Logger.getLogger(CascadeMarker.class.getName());

  private final NodeStore nodes;
  private final ReverseUseIndex usesByDef;
  private final Set<String> cascadingFiles;

  CascadeMarker(NodeStore nodes, ReverseUseIndex usesByDef, Set<String> cascadingFiles) {
    this.nodes = checkNotNull(nodes);
    this.usesByDef = checkNotNull(usesByDef);
    this.cascadingFiles = checkNotNull(cascadingFiles);
  }

  boolean isMarked(String file) {
    return cascadingFiles.contains(file);
  }

  /** Marks {@code file} as cascading, returning whether it was not marked before. */
  @CanIgnoreReturnValue
  boolean markIntransitive(String file) {
    return cascadingFiles.add(file);
  }

  /**
   * Walks from every node of {@code file} to everything that transitively uses it, marking files
   * reached through interface keys, and appends each visited file to {@code visitedFiles} unless
   * it is already there.
   */
  void markTransitive(List<String> visitedFiles, String file) {
    // GraphNode does not override equals, so this is an identity set.
    Set<GraphNode> visitedNodes = new LinkedHashSet<>();
    for (GraphNode node : nodes.nodesInFile(file).values()) {
      checkTransitiveClosureForCascading(visitedNodes, node);
    }

    Set<String> alreadyListed = new HashSet<>(visitedFiles);
    for (GraphNode node : visitedNodes) {
      String visitedFile = node.getFile();
      if (visitedFile != null && alreadyListed.add(visitedFile)) {
        visitedFiles.add(visitedFile);
      }
    }
    logger.fine(
        () ->
            "Marking from "
                + file
                + " visited "
                + visitedNodes.size()
                + " node(s); "
                + cascadingFiles.size()
                + " file(s) now cascade");
  }

  /**
   * Appends to {@code uses} every file using the external dependency {@code externalDependency}
   * that is not already marked, together with the files each of them affects.
   */
  void markExternal(List<String> uses, String externalDependency) {
    // These nodes depend on the interface of the external declaration.
    DependencyKey key = DependencyKey.forExternalDependency(externalDependency);
    for (DependencyKey keyOfUse : usesByDef.getUses(key)) {
      for (GraphNode use : nodes.allValuesForKey(keyOfUse)) {
        String file = use.getFile();
        if (file == null || isMarked(file) || uses.contains(file)) {
          continue;
        }
        uses.add(file);
        markTransitive(uses, file);
      }
    }
  }

  /**
   * Visits {@code potentiallyCascadingDef} and everything that transitively uses it. Only the
   * marking is gated on the use being an interface key; the walk continues through
   * implementation uses too, since their users still need re-examining.
   */
  private void checkTransitiveClosureForCascading(
      Set<GraphNode> visited, GraphNode potentiallyCascadingDef) {
    Deque<GraphNode> worklist = new ArrayDeque<>();
    worklist.push(potentiallyCascadingDef);
    while (!worklist.isEmpty()) {
      GraphNode def = worklist.pop();
      // Cycle check.
      if (!visited.add(def)) {
        continue;
      }
      ImmutableList<GraphNode> uses = usesOf(def);
      for (GraphNode use : uses) {
        if (use.getKey().isInterface() && use.getFile() != null) {
          rememberThatFileCascades(use.getFile());
        }
      }
      // Reversed so that the first use is walked first.
      for (GraphNode use : uses.reverse()) {
        worklist.push(use);
      }
    }
  }

  private void rememberThatFileCascades(String file) {
    if (cascadingFiles.add(file)) {
      logger.finest(() -> file + " cascades");
    }
  }

  private ImmutableList<GraphNode> usesOf(GraphNode def) {
    ImmutableList.Builder<GraphNode> uses = ImmutableList.builder();
    forEachUseOf(def, uses::add);
    return uses.build();
  }

  /** Calls {@code fn} with every node whose key is recorded as using {@code def}'s key. */
  void forEachUseOf(GraphNode def, Consumer<GraphNode> fn) {
    for (DependencyKey useKey : usesByDef.getUses(def.getKey())) {
      for (GraphNode use : nodes.allValuesForKey(useKey)) {
        fn.accept(use);
      }
    }
  }
}
