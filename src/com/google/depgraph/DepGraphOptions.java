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

import java.io.Serializable;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/** Options controlling how a dependency graph checks and reports itself. */
public class DepGraphOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Run the consistency check before and after each integration. On by default; large builds
   * may turn it off for speed.
   */
  private boolean verify = true;

  /** Write a Graphviz file of the whole graph before and after each report is loaded. */
  private boolean emitDotFiles = false;

  /** Where dot files go. If null, each is written next to the report it was emitted for. */
  private transient @Nullable Path dotFileDirectory = null;

  public boolean shouldVerify() {
    return verify;
  }

  public void setVerify(boolean verify) {
    this.verify = verify;
  }

  public boolean shouldEmitDotFiles() {
    return emitDotFiles;
  }

  public void setEmitDotFiles(boolean emitDotFiles) {
    this.emitDotFiles = emitDotFiles;
  }

  public @Nullable Path getDotFileDirectory() {
    return dotFileDirectory;
  }

  public void setDotFileDirectory(@Nullable Path dotFileDirectory) {
    this.dotFileDirectory = dotFileDirectory;
  }

  @Override
  public String toString() {
    return "DepGraphOptions{verify="
        + verify
        + ", emitDotFiles="
        + emitDotFiles
        + ", dotFileDirectory="
        + dotFileDirectory
        + "}";
  }
}
