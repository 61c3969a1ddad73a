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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Loads dependency reports into a graph and reports which of them a change affects.
 *
 * <p>Each report path serves as both the file identifier and the task handle. Reports are loaded
 * in the order given, so a report may be listed twice to simulate a rebuild.
 */
public final class DepGraphRunner {

  /** Command line flags. */
  static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--changed",
        usage =
            "A loaded report whose file changed; prints the reports it affects. May be repeated")
    private List<String> changed = new ArrayList<>();

    @Option(
        name = "--external_changed",
        usage =
            "An external dependency that changed; prints the reports it affects. May be repeated")
    private List<String> externalChanged = new ArrayList<>();

    @Option(
        name = "--print_externals",
        handler = BooleanOptionHandler.class,
        usage = "Prints the external dependencies the loaded reports use")
    private boolean printExternals = false;

    @Option(
        name = "--print_graph",
        handler = BooleanOptionHandler.class,
        usage = "Prints a dot file describing the final graph")
    private boolean printGraph = false;

    @Option(
        name = "--emit_dot_files",
        handler = BooleanOptionHandler.class,
        usage = "Writes <report>.<n>.dot before and after each report is loaded")
    private boolean emitDotFiles = false;

    @Option(
        name = "--verify",
        handler = BooleanOptionHandler.class,
        usage = "Checks the graph's consistency after each load. Defaults to true")
    private boolean verify = true;

    @Argument(metaVar = "REPORT", usage = "Dependency reports to load")
    private List<String> reports = new ArrayList<>();
  }

  private final PrintStream out;
  private final PrintStream err;

  DepGraphRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int status = new DepGraphRunner(System.out, System.err).run(args);
    System.exit(status);
  }

  /** Runs with {@code args}, returning the process exit status. */
  int run(String[] args) {
    Flags flags = new Flags();
    CmdLineParser parser = new CmdLineParser(flags);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return 1;
    }
    if (flags.displayHelp) {
      parser.printUsage(out);
      return 0;
    }

    DriverGraph<String> driver = new DriverGraph<>(createOptions(flags));
    boolean hadError = false;
    for (String report : flags.reports) {
      LoadResult result = driver.loadFromPath(report, Paths.get(report));
      out.println(report + ": " + result);
      hadError |= result == LoadResult.HAD_ERROR;
    }

    for (String report : flags.changed) {
      if (!driver.isTracked(report)) {
        err.println("ERROR - " + report + " was not loaded");
        hadError = true;
        continue;
      }
      printAffected("affected by " + report, driver.markTransitive(report));
    }
    for (String external : flags.externalChanged) {
      if (external.isEmpty()) {
        err.println("ERROR - --external_changed needs a non-empty dependency name");
        hadError = true;
        continue;
      }
      printAffected("affected by external " + external, driver.markExternal(external));
    }
    if (flags.printExternals) {
      for (String external : driver.getExternalDependencies()) {
        out.println(external);
      }
    }
    if (flags.printGraph) {
      out.print(DotFileEmitter.toDot(driver.getGraph()));
    }
    return hadError ? 1 : 0;
  }

  private void printAffected(String header, ImmutableList<String> reports) {
    out.println(header + ": " + Joiner.on(", ").join(reports));
  }

  static DepGraphOptions createOptions(Flags flags) {
    DepGraphOptions options = new DepGraphOptions();
    options.setVerify(flags.verify);
    options.setEmitDotFiles(flags.emitDotFiles);
    return options;
  }
}
