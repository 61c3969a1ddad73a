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
 * Which facet of a declaration a key refers to. A change to the interface is observable by other
 * files; a change to the implementation is not.
 */
public enum DeclAspect {
  INTERFACE("interface"),
  IMPLEMENTATION("implementation");

  private static final ImmutableMap<String, DeclAspect> BY_REPORT_NAME =
      Maps.uniqueIndex(Arrays.asList(values()), DeclAspect::getReportName);

  private final String reportName;

  DeclAspect(String reportName) {
    this.reportName = reportName;
  }

  public String getReportName() {
    return reportName;
  }

  /** Returns the aspect spelled {@code reportName} in a dependency report, or null. */
  public static @Nullable DeclAspect forReportName(String reportName) {
    return BY_REPORT_NAME.get(reportName);
  }
}
