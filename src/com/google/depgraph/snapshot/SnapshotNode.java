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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.depgraph.DependencyKey;
import org.jspecify.annotations.Nullable;

/**
 * One entity recorded in a {@link FileSnapshot}.
 *
 * <p>A node with an owning file is a declaration made by that file. A node without one only
 * records that the file uses the key, and must not carry a fingerprint.
 */
@AutoValue
public abstract class SnapshotNode {

  public abstract DependencyKey getKey();

  /** Content signature of the definition, if the producer computed one. */
  public abstract @Nullable String getFingerprint();

  /** The file that declares this entity, or null if the file only uses it. */
  public abstract @Nullable String getFile();

  /** Keys whose definitions this entity depends upon. */
  public abstract ImmutableSet<DependencyKey> getUses();

  public final boolean isDeclaration() {
    return getFile() != null;
  }

  public static Builder builder(DependencyKey key) {
    return new AutoValue_SnapshotNode.Builder().setKey(key);
  }

  /** A declaration of {@code key} made by {@code file}. */
  public static Builder declaredIn(String file, DependencyKey key) {
    return builder(key).setFile(file);
  }

  /** A use-only record for {@code key}. */
  public static SnapshotNode usedOnly(DependencyKey key) {
    return builder(key).build();
  }

  @Override
  public final String toString() {
    return getKey() + (isDeclaration() ? " in " + getFile() : " (expat)");
  }

  /** Builder for {@link SnapshotNode}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setKey(DependencyKey key);

    public abstract Builder setFingerprint(@Nullable String fingerprint);

    public abstract Builder setFile(@Nullable String file);

    abstract ImmutableSet.Builder<DependencyKey> usesBuilder();

    public Builder addUse(DependencyKey used) {
      usesBuilder().add(used);
      return this;
    }

    public Builder addUses(Iterable<DependencyKey> used) {
      usesBuilder().addAll(used);
      return this;
    }

    public abstract SnapshotNode build();
  }
}
