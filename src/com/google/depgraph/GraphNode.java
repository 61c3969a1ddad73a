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

import com.google.depgraph.snapshot.SnapshotNode;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A vertex of the whole-program graph.
 *
 * <p>GraphNode has identity semantics: two nodes with the same key in different files are
 * different vertices, and traversals track visited nodes by identity. A node with no file is an
 * expat, something some file uses whose defining file is not yet known.
 *
 * <p>Only {@link NodeStore} may change a node's file, so that the node and its index positions
 * agree.
 */
public final class GraphNode {
  private final DependencyKey key;
  private final int sequenceNumber;
  private @Nullable String fingerprint;
  private @Nullable String file;

  GraphNode(
      DependencyKey key, @Nullable String fingerprint, @Nullable String file, int sequenceNumber) {
    this.key = key;
    this.fingerprint = fingerprint;
    this.file = file;
    this.sequenceNumber = sequenceNumber;
  }

  public DependencyKey getKey() {
    return key;
  }

  public @Nullable String getFingerprint() {
    return fingerprint;
  }

  /** The file declaring this entity, or null for an expat. */
  public @Nullable String getFile() {
    return file;
  }

  public boolean isExpat() {
    return file == null;
  }

  /** Order of creation within the store. Only meaningful for stable debug output. */
  int getSequenceNumber() {
    return sequenceNumber;
  }

  void setFile(@Nullable String file) {
    this.file = file;
  }

  /**
   * Takes the fingerprint from the incoming snapshot node.
   *
   * @return whether the fingerprint changed
   */
  boolean integrateFingerprintFrom(SnapshotNode integrand) {
    String newFingerprint = integrand.getFingerprint();
    boolean changed = !Objects.equals(fingerprint, newFingerprint);
    fingerprint = newFingerprint;
    return changed;
  }

  @Override
  public String toString() {
    return key + (file == null ? " (expat)" : " in " + file);
  }
}
