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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/** The outcome of integrating one snapshot, with the keys it changed. */
@AutoValue
public abstract class IntegrationResult {

  public abstract LoadResult getLoadResult();

  /** Keys added, removed or changed by the integration, in the order they were found. */
  public abstract ImmutableSet<DependencyKey> getChangedKeys();

  static IntegrationResult create(ImmutableSet<DependencyKey> changedKeys) {
    return new AutoValue_IntegrationResult(
        changedKeys.isEmpty() ? LoadResult.UP_TO_DATE : LoadResult.AFFECTS_DOWNSTREAM,
        changedKeys);
  }
}
