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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.function.BiConsumer;
import org.jspecify.annotations.Nullable;

/**
 * Owns every live {@link GraphNode}, indexed both by (file, key) and by (key, file).
 *
 * <p>Expats live under the file position {@link #EXPAT}. All mutation goes through {@link
 * #insert}, {@link #erase} and {@link #moveToFile}, which keep the two indices in step.
 */
public final class NodeStore {

  /** The file position of nodes whose defining file is unknown. */
  static final String EXPAT = "";

  /** Visits one node along with its position in the store. */
  public interface EntryVisitor {
    void visit(@Nullable String file, DependencyKey key, GraphNode node);
  }

  private final TwoStageMap<String, DependencyKey, GraphNode> nodesByFile = new TwoStageMap<>();
  private final TwoStageMap<DependencyKey, String, GraphNode> nodesByKey = new TwoStageMap<>();

  private int nextSequenceNumber = 0;

  /** Returns the node for {@code key} in {@code file}, where a null file means the expat. */
  public @Nullable GraphNode find(@Nullable String file, DependencyKey key) {
    return nodesByFile.find(position(file), key);
  }

  /** All nodes with {@code key}, whichever file holds them. */
  public ImmutableList<GraphNode> allValuesForKey(DependencyKey key) {
    return nodesByKey.findAll(key).values().asList();
  }

  /** A snapshot of the nodes in {@code file}, keyed by their keys. */
  public ImmutableMap<DependencyKey, GraphNode> nodesInFile(@Nullable String file) {
    return nodesByFile.findAll(position(file));
  }

  public boolean hasNodesInFile(String file) {
    return nodesByFile.containsKey1(position(file));
  }

  /** Creates a node and adds it to both indices. */
  @CanIgnoreReturnValue
  GraphNode createNode(DependencyKey key, @Nullable String fingerprint, @Nullable String file) {
    GraphNode node = new GraphNode(key, fingerprint, file, nextSequenceNumber++);
    insert(node);
    return node;
  }

  @VisibleForTesting
  void insert(GraphNode node) {
    String file = position(node.getFile());
    checkState(
        nodesByFile.find(file, node.getKey()) == null,
        "duplicate nodes for %s in %s",
        node.getKey(),
        node.isExpat() ? "the expats" : node.getFile());
    nodesByFile.insert(file, node.getKey(), node);
    nodesByKey.insert(node.getKey(), file, node);
  }

  /** Removes {@code node} from both indices. The node must not be used afterwards. */
  void erase(GraphNode node) {
    String file = position(node.getFile());
    GraphNode byFile = nodesByFile.remove(file, node.getKey());
    GraphNode byKey = nodesByKey.remove(node.getKey(), file);
    checkState(byFile == node && byKey == node, "erasing a node the store does not hold: %s", node);
  }

  /** Relocates {@code node} to {@code newFile}; null makes it an expat. */
  void moveToFile(GraphNode node, @Nullable String newFile) {
    erase(node);
    node.setFile(newFile);
    insert(node);
  }

  public void forEachEntry(EntryVisitor visitor) {
    nodesByFile.forEachEntry((file, key, node) -> visitor.visit(fileOf(file), key, node));
  }

  /** Visits each file holding nodes; the expats are visited with a null file. */
  public void forEachKey1(BiConsumer<@Nullable String, Map<DependencyKey, GraphNode>> visitor) {
    nodesByFile.forEachKey1((file, nodes) -> visitor.accept(fileOf(file), nodes));
  }

  public int size() {
    return nodesByFile.size();
  }

  /**
   * Checks that both indices hold exactly the same nodes at the same positions, and that each
   * node's own file and key agree with where it is stored.
   *
   * @throws IllegalStateException describing the first inconsistency found
   */
  void verify() {
    checkState(
        nodesByFile.size() == nodesByKey.size(),
        "node indices diverged: %s nodes by file, %s by key",
        nodesByFile.size(),
        nodesByKey.size());
    nodesByFile.forEachEntry(
        (file, key, node) -> {
          checkState(
              nodesByKey.find(key, file) == node, "node missing from the key index: %s", node);
          checkState(position(node.getFile()).equals(file), "node misplaced for file: %s", node);
          checkState(node.getKey().equals(key), "node misplaced for key: %s", node);
        });
    nodesByKey.forEachEntry(
        (key, file, node) ->
            checkState(
                nodesByFile.find(file, key) == node, "node missing from the file index: %s", node));
  }

  private static String position(@Nullable String file) {
    if (file == null) {
      return EXPAT;
    }
    checkArgument(!file.isEmpty(), "file identifiers must not be empty");
    return file;
  }

  private static @Nullable String fileOf(String position) {
    return Strings.emptyToNull(position);
  }
}
