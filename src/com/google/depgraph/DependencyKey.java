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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * Names an entity in the whole-program dependency graph.
 *
 * <p>Keys are compared by value. The same declaration has two keys, one per {@link DeclAspect};
 * the graph treats them as unrelated vertices.
 */
@AutoValue
@Immutable
public abstract class DependencyKey {

  public abstract NodeKind getKind();

  public abstract DeclAspect getAspect();

  /** The scope of a member; empty for every kind that has no context. */
  public abstract String getContext();

  /** Empty only for {@link NodeKind#POTENTIAL_MEMBER}. */
  public abstract String getName();

  public final boolean isInterface() {
    return getAspect() == DeclAspect.INTERFACE;
  }

  /**
   * Creates a key, checking that the fields make sense for {@code kind}.
   *
   * @throws IllegalArgumentException if the key is ill-formed
   */
  public static DependencyKey create(
      NodeKind kind, DeclAspect aspect, String context, String name) {
    checkNotNull(kind);
    checkNotNull(aspect);
    checkNotNull(context);
    checkNotNull(name);
    checkArgument(
        kind.hasContext() != context.isEmpty(),
        "%s keys %s a context, got \"%s\"",
        kind.getReportName(),
        kind.hasContext() ? "need" : "must not have",
        context);
    checkArgument(
        (kind == NodeKind.POTENTIAL_MEMBER) == name.isEmpty(),
        "%s keys %s a name, got \"%s\"",
        kind.getReportName(),
        kind == NodeKind.POTENTIAL_MEMBER ? "must not have" : "need",
        name);
    checkArgument(
        kind != NodeKind.EXTERNAL_DEPEND || aspect == DeclAspect.INTERFACE,
        "External dependencies are always interfaces: %s",
        name);
    return new AutoValue_DependencyKey(kind, aspect, context, name);
  }

  /** The key that users of the external dependency {@code name} depend upon. */
  public static DependencyKey forExternalDependency(String name) {
    return create(NodeKind.EXTERNAL_DEPEND, DeclAspect.INTERFACE, "", name);
  }

  /** The anchor key for the file whose dependency report is {@code fileIdentifier}. */
  public static DependencyKey forSourceFile(DeclAspect aspect, String fileIdentifier) {
    return create(NodeKind.SOURCE_FILE_PROVIDE, aspect, "", fileIdentifier);
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(getKind().getReportName()).append(' ').append(getAspect().getReportName());
    sb.append(' ');
    if (!getContext().isEmpty()) {
      sb.append(getContext());
      if (!getName().isEmpty()) {
        sb.append('.');
      }
    }
    sb.append(getName());
    return sb.toString();
  }
}
