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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Maps the key of a definition to the keys of everything that uses it, across all integrated
 * files.
 *
 * <p>Entries are only ever added. When a file stops using a key, or a definition disappears, the
 * stale entries stay; that can only make marking visit more files than necessary, never fewer.
 */
public final class ReverseUseIndex {
  private final SetMultimap<DependencyKey, DependencyKey> usesByDef =
      LinkedHashMultimap.create();

  /**
   * Records that {@code use} depends on {@code def}. Self-uses are ignored.
   *
   * @return whether the entry is new
   */
  @CanIgnoreReturnValue
  public boolean addUse(DependencyKey def, DependencyKey use) {
    if (def.equals(use)) {
      return false;
    }
    return usesByDef.put(def, use);
  }

  /** The keys recorded as using {@code def}, in the order they were first recorded. */
  public ImmutableSet<DependencyKey> getUses(DependencyKey def) {
    return ImmutableSet.copyOf(usesByDef.get(def));
  }

  public boolean hasUses(DependencyKey def) {
    return usesByDef.containsKey(def);
  }

  /** Visits each definition key with the keys that use it. */
  public void forEachDef(BiConsumer<DependencyKey, Collection<DependencyKey>> visitor) {
    for (Map.Entry<DependencyKey, Collection<DependencyKey>> entry :
        usesByDef.asMap().entrySet()) {
      visitor.accept(entry.getKey(), entry.getValue());
    }
  }

  public int size() {
    return usesByDef.size();
  }
}
