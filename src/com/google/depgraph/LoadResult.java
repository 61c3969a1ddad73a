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

/** What loading one file's dependency report did to the graph. */
public enum LoadResult {
  /** Nothing any other file could observe changed. */
  UP_TO_DATE,
  /** Some key was added, removed, relocated or refingerprinted. */
  AFFECTS_DOWNSTREAM,
  /**
   * The report could not be read or parsed. The file's dependencies are unknown, so a driver
   * should treat it and everything that used it as needing recompilation.
   */
  HAD_ERROR;
}
