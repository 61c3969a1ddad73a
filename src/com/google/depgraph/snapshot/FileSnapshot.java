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

package com.google.depgraph.snapshot;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.depgraph.DeclAspect;
import com.google.depgraph.DependencyKey;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The dependency information produced by compiling one file: the entities it declares, the
 * entities it only uses, and which keys each of them depends upon.
 *
 * <p>Snapshots are produced fresh for every integration and are never mutated.
 */
public final class FileSnapshot {
  private final String fileIdentifier;
  private final ImmutableList<SnapshotNode> nodes;

  private FileSnapshot(String fileIdentifier, ImmutableList<SnapshotNode> nodes) {
    this.fileIdentifier = fileIdentifier;
    this.nodes = nodes;
  }

  /** The identifier of the file this snapshot describes, canonically its report path. */
  public String getFileIdentifier() {
    return fileIdentifier;
  }

  /** All nodes, in the order the producer emitted them. */
  public ImmutableList<SnapshotNode> getNodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return fileIdentifier + " {" + Joiner.on(", ").join(nodes) + "}";
  }

  public static Builder builder(String fileIdentifier) {
    return new Builder(fileIdentifier);
  }

  /**
   * Accumulates the nodes of a snapshot. Two nodes may not share both key and owning file.
   */
  public static final class Builder {
    private final String fileIdentifier;
    private final ImmutableList.Builder<SnapshotNode> nodes = ImmutableList.builder();
    private final Set<Map.Entry<String, DependencyKey>> seen = new HashSet<>();

    private Builder(String fileIdentifier) {
      this.fileIdentifier = checkNotNull(fileIdentifier);
    }

    public Builder add(SnapshotNode node) {
      String file = node.isDeclaration() ? node.getFile() : "";
      checkArgument(
          seen.add(Maps.immutableEntry(file, node.getKey())), "Duplicate snapshot node: %s", node);
      nodes.add(node);
      return this;
    }

    public Builder add(SnapshotNode.Builder node) {
      return add(node.build());
    }

    /**
     * Adds the interface and implementation anchors for this file, the way a compiler records
     * that the file was compiled. The fingerprint stands for the whole file's contents.
     */
    public Builder addSourceFileAnchors(String fingerprint) {
      for (DeclAspect aspect : DeclAspect.values()) {
        add(
            SnapshotNode.declaredIn(
                    fileIdentifier, DependencyKey.forSourceFile(aspect, fileIdentifier))
                .setFingerprint(fingerprint));
      }
      return this;
    }

    public FileSnapshot build() {
      return new FileSnapshot(fileIdentifier, nodes.build());
    }
  }
}
