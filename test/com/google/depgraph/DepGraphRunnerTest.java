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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kohsuke.args4j.CmdLineParser;

/** Tests for {@link DepGraphRunner} */
@RunWith(JUnit4.class)
public final class DepGraphRunnerTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private DepGraphRunner runner;
  private String reportA;
  private String reportB;

  @Before
  public void setUp() throws IOException {
    runner =
        new DepGraphRunner(
            new PrintStream(outBytes, true, "UTF-8"), new PrintStream(errBytes, true, "UTF-8"));
    reportA = writeReport("a.json", DriverGraphTest.REPORT_A);
    reportB = writeReport("b.json", DriverGraphTest.REPORT_B);
  }

  private String writeReport(String name, String contents) throws IOException {
    File report = folder.newFile(name);
    Files.write(report.toPath(), contents.getBytes(UTF_8));
    return report.getPath();
  }

  private String out() {
    return new String(outBytes.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(errBytes.toByteArray(), UTF_8);
  }

  @Test
  public void testLoadsReports() {
    assertThat(runner.run(new String[] {reportA, reportB})).isEqualTo(0);

    assertThat(out()).contains(reportA + ": AFFECTS_DOWNSTREAM\n");
    assertThat(out()).contains(reportB + ": AFFECTS_DOWNSTREAM\n");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testChanged() {
    int status = runner.run(new String[] {"--changed", reportA, reportA, reportB});

    assertThat(status).isEqualTo(0);
    assertThat(out()).contains("affected by " + reportA + ": " + reportA + ", " + reportB + "\n");
  }

  @Test
  public void testChangedButNotLoaded() {
    int status = runner.run(new String[] {"--changed", reportB, reportA});

    assertThat(status).isEqualTo(1);
    assertThat(err()).contains("ERROR - " + reportB + " was not loaded");
  }

  @Test
  public void testExternalChanged() {
    int status =
        runner.run(
            new String[] {"--external_changed", "/sdk/Lib", "--print_externals", reportA, reportB});

    assertThat(status).isEqualTo(0);
    assertThat(out()).contains("affected by external /sdk/Lib: " + reportB + "\n");
    assertThat(out()).contains("\n/sdk/Lib\n");
  }

  @Test
  public void testPrintGraph() {
    assertThat(runner.run(new String[] {"--print_graph", reportA})).isEqualTo(0);

    assertThat(out()).contains("digraph DependencyGraph {\n");
    assertThat(out()).contains("topLevel interface k1");
  }

  @Test
  public void testMissingReport() {
    String missing = folder.getRoot().toPath().resolve("missing.json").toString();

    assertThat(runner.run(new String[] {missing})).isEqualTo(1);
    assertThat(out()).contains(missing + ": HAD_ERROR\n");
  }

  @Test
  public void testUnknownFlag() {
    assertThat(runner.run(new String[] {"--no_such_flag"})).isEqualTo(1);
    assertThat(err()).contains("--no_such_flag");
  }

  @Test
  public void testHelp() {
    assertThat(runner.run(new String[] {"--help"})).isEqualTo(0);
    assertThat(out()).contains("--changed");
  }

  @Test
  public void testVerifyFlag() throws Exception {
    DepGraphRunner.Flags flags = new DepGraphRunner.Flags();
    new CmdLineParser(flags).parseArgument("--verify", "false");

    DepGraphOptions options = DepGraphRunner.createOptions(flags);

    assertThat(options.shouldVerify()).isFalse();
    assertThat(options.shouldEmitDotFiles()).isFalse();
  }

  @Test
  public void testEmptyExternalName() {
    int status = runner.run(new String[] {"--external_changed", "", reportA, reportB});

    assertThat(status).isEqualTo(1);
    assertThat(err()).contains("ERROR - --external_changed needs a non-empty dependency name");
    assertThat(out()).doesNotContain("affected by external");
  }
}
