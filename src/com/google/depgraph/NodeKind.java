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
import com.google.common.collect.Maps;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of entities a {@link DependencyKey} can name.
 *
 * <p>The first five are declarations found in source. {@link #EXTERNAL_DEPEND} and {@link
 * #SOURCE_FILE_PROVIDE} are synthetic: the former stands for something defined outside the whole
 * program, the latter is the per-file anchor recording that a file was compiled.
 */
public enum NodeKind {
  TOP_LEVEL("topLevel"),
  NOMINAL("nominal"),
  /** Some member of a nominal type may be used; the key has a context but no name. */
  POTENTIAL_MEMBER("potentialMember"),
  MEMBER("member"),
  DYNAMIC_LOOKUP("dynamicLookup"),
  EXTERNAL_DEPEND("externalDepend"),
  SOURCE_FILE_PROVIDE("sourceFileProvide");

  private static final ImmutableMap<String, NodeKind> BY_REPORT_NAME =
      Maps.uniqueIndex(Arrays.asList(values()), NodeKind::getReportName);

  private final String reportName;

  NodeKind(String reportName) {
    this.reportName = reportName;
  }

  /** The spelling used in dependency reports and debug output. */
  public String getReportName() {
    return reportName;
  }

  /** Whether keys of this kind are scoped by a context string. */
  public boolean hasContext() {
    return this == MEMBER || this == POTENTIAL_MEMBER;
  }

  /** Returns the kind spelled {@code reportName} in a dependency report, or null. */
  public static @Nullable NodeKind forReportName(String reportName) {
    return BY_REPORT_NAME.get(reportName);
  }
}
