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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.depgraph.snapshot.FileSnapshot;
import com.google.depgraph.snapshot.SnapshotNode;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Merges one file's {@link FileSnapshot} into the whole-program graph.
 *
 * <p>A file may be integrated before the file defining something it uses. The use then becomes
 * an expat node, which is moved into the defining file when that file's snapshot arrives. In the
 * other order, the use finds the existing definition and adds nothing.
 */
final class GraphIntegrator {
  private static final Logger logger = Logger.getLogger(GraphIntegrator.class.getName());

  private final NodeStore nodes;
  private final ReverseUseIndex usesByDef;
  private final Set<String> externalDependencies;

  GraphIntegrator(NodeStore nodes, ReverseUseIndex usesByDef, Set<String> externalDependencies) {
    this.nodes = checkNotNull(nodes);
    this.usesByDef = checkNotNull(usesByDef);
    this.externalDependencies = checkNotNull(externalDependencies);
  }

  /**
   * Integrates {@code snapshot} as the new contents of {@code file}. Nodes {@code file} held
   * before that the snapshot no longer mentions are removed.
   *
   * @throws IllegalArgumentException if a declaration in the snapshot names another file
   */
  IntegrationResult integrate(String file, FileSnapshot snapshot) {
    checkArgument(!file.isEmpty(), "file identifiers must not be empty");

    // When done, contains the nodes which no longer exist.
    Map<DependencyKey, GraphNode> disappearedNodes = new LinkedHashMap<>(nodes.nodesInFile(file));
    Set<DependencyKey> changedKeys = new LinkedHashSet<>();

    Set<DependencyKey> declaredHere = new HashSet<>();
    for (SnapshotNode integrand : snapshot.getNodes()) {
      if (integrand.isDeclaration()) {
        checkArgument(
            file.equals(integrand.getFile()),
            "Snapshot for %s declares %s",
            file,
            integrand);
        declaredHere.add(integrand.getKey());
      }
    }

    for (SnapshotNode integrand : snapshot.getNodes()) {
      integrateUsesByDef(integrand);
      DependencyKey key = integrand.getKey();
      GraphNode preexistingNodeInPlace = nodes.find(file, key);
      boolean changed =
          integrand.isDeclaration()
              ? integrateDeclNode(file, integrand, preexistingNodeInPlace, disappearedNodes)
              : integrateExpatNode(
                  file,
                  integrand,
                  preexistingNodeInPlace,
                  declaredHere.contains(key),
                  disappearedNodes);
      if (changed) {
        changedKeys.add(key);
      }

      // Track external dependencies so the driver can watch them.
      if (key.getKind() == NodeKind.EXTERNAL_DEPEND) {
        externalDependencies.add(key.getName());
      }
    }

    for (GraphNode disappeared : disappearedNodes.values()) {
      logger.finest(() -> "Removing " + disappeared);
      changedKeys.add(disappeared.getKey());
      removeNode(disappeared);
    }

    IntegrationResult result = IntegrationResult.create(ImmutableSet.copyOf(changedKeys));
    logger.fine(
        () ->
            "Integrated "
                + file
                + ": "
                + result.getLoadResult()
                + ", "
                + changedKeys.size()
                + " changed key(s)");
    return result;
  }

  private boolean integrateDeclNode(
      String file,
      SnapshotNode integrand,
      @Nullable GraphNode preexistingNodeInPlace,
      Map<DependencyKey, GraphNode> disappearedNodes) {
    DependencyKey key = integrand.getKey();
    if (preexistingNodeInPlace != null) {
      disappearedNodes.remove(key);
      return preexistingNodeInPlace.integrateFingerprintFrom(integrand);
    }

    GraphNode preexistingExpat = nodes.find(null, key);
    if (preexistingExpat != null) {
      // Some other file depended on this, but didn't know where it was.
      logger.finest(() -> "Resolving expat " + key + " to " + file);
      nodes.moveToFile(preexistingExpat, file);
      preexistingExpat.integrateFingerprintFrom(integrand);
      return true;
    }
    nodes.createNode(key, integrand.getFingerprint(), file);
    return true;
  }

  private boolean integrateExpatNode(
      String file,
      SnapshotNode integrand,
      @Nullable GraphNode preexistingNodeInPlace,
      boolean declaredInSameSnapshot,
      Map<DependencyKey, GraphNode> disappearedNodes) {
    DependencyKey key = integrand.getKey();
    if (declaredInSameSnapshot) {
      // The file uses something it also declares; the declaration represents it.
      return false;
    }

    GraphNode preexistingExpat = nodes.find(null, key);
    if (preexistingExpat != null || definedInOtherFiles(key, file)) {
      // A use of something already represented elsewhere. Nothing to be done.
      checkState(
          integrand.getFingerprint() == null,
          "Use-only node %s carries a fingerprint",
          integrand);
      return false;
    }

    if (preexistingNodeInPlace != null) {
      // This file used to declare the key and now only uses it.
      disappearedNodes.remove(key);
      boolean changed = preexistingNodeInPlace.integrateFingerprintFrom(integrand);
      nodes.moveToFile(preexistingNodeInPlace, null);
      return changed;
    }
    nodes.createNode(key, integrand.getFingerprint(), null);
    return true;
  }

  private boolean definedInOtherFiles(DependencyKey key, String file) {
    for (GraphNode node : nodes.allValuesForKey(key)) {
      if (!node.isExpat() && !file.equals(node.getFile())) {
        return true;
      }
    }
    return false;
  }

  private void integrateUsesByDef(SnapshotNode use) {
    for (DependencyKey def : use.getUses()) {
      usesByDef.addUse(def, use.getKey());
    }
  }

  private void removeNode(GraphNode node) {
    nodes.erase(node);
    DependencyKey key = node.getKey();
    if (key.getKind() == NodeKind.EXTERNAL_DEPEND && nodes.allValuesForKey(key).isEmpty()) {
      externalDependencies.remove(key.getName());
    }
  }
}
