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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import org.jspecify.annotations.Nullable;

/**
 * A map from {@code (K1, K2)} to {@code V}, organized so that all values for a given {@code K1}
 * can be found without scanning.
 *
 * <p>Iteration follows insertion order at both levels. Empty inner maps are dropped.
 */
final class TwoStageMap<K1, K2, V> {

  /** Visits one entry. */
  interface EntryVisitor<K1, K2, V> {
    void visit(K1 k1, K2 k2, V value);
  }

  private final Map<K1, Map<K2, V>> map = new LinkedHashMap<>();

  @Nullable V find(K1 k1, K2 k2) {
    Map<K2, V> inner = map.get(k1);
    return inner == null ? null : inner.get(k2);
  }

  /** Returns a copy of the inner map for {@code k1}, empty if there is none. */
  ImmutableMap<K2, V> findAll(K1 k1) {
    Map<K2, V> inner = map.get(k1);
    return inner == null ? ImmutableMap.of() : ImmutableMap.copyOf(inner);
  }

  boolean containsKey1(K1 k1) {
    return map.containsKey(k1);
  }

  /** Stores {@code value}, returning the value previously at {@code (k1, k2)}. */
  @CanIgnoreReturnValue
  @Nullable V insert(K1 k1, K2 k2, V value) {
    return map.computeIfAbsent(k1, k -> new LinkedHashMap<>()).put(k2, value);
  }

  @CanIgnoreReturnValue
  @Nullable V remove(K1 k1, K2 k2) {
    Map<K2, V> inner = map.get(k1);
    if (inner == null) {
      return null;
    }
    V removed = inner.remove(k2);
    if (inner.isEmpty()) {
      map.remove(k1);
    }
    return removed;
  }

  void forEachEntry(EntryVisitor<? super K1, ? super K2, ? super V> visitor) {
    for (Map.Entry<K1, Map<K2, V>> outer : map.entrySet()) {
      for (Map.Entry<K2, V> inner : outer.getValue().entrySet()) {
        visitor.visit(outer.getKey(), inner.getKey(), inner.getValue());
      }
    }
  }

  /** Visits each first-stage key with a read-only view of its entries. */
  void forEachKey1(BiConsumer<? super K1, Map<K2, V>> visitor) {
    for (Map.Entry<K1, Map<K2, V>> outer : map.entrySet()) {
      visitor.accept(outer.getKey(), Collections.unmodifiableMap(outer.getValue()));
    }
  }

  int size() {
    int size = 0;
    for (Map<K2, V> inner : map.values()) {
      size += inner.size();
    }
    return size;
  }
}
