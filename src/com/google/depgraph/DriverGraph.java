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
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.depgraph.snapshot.FileSnapshot;
import com.google.depgraph.snapshot.SnapshotParseException;
import com.google.depgraph.snapshot.SnapshotParser;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The face of the dependency graph that a build driver sees: files are named by the tasks that
 * compile them.
 *
 * <p>Each file identifier, canonically the path of the file's dependency report, corresponds to
 * exactly one task handle of type {@code J}. The handles are opaque here; they are only stored
 * and handed back.
 *
 * @param <J> the driver's task handle type
 */
public final class DriverGraph<J> {
  private static final Logger logger = Logger.getLogger(DriverGraph.class.getName());

  private final ModuleDepGraph graph;
  private final BiMap<String, J> jobsByFile = HashBiMap.create();
  private final Map<String, Integer> dotFileSequenceNumberByFile = new HashMap<>();

  public DriverGraph() {
    this(new DepGraphOptions());
  }

  public DriverGraph(DepGraphOptions options) {
    this.graph = new ModuleDepGraph(options);
  }

  /** The underlying graph, keyed by file identifier. */
  public ModuleDepGraph getGraph() {
    return graph;
  }

  /**
   * Reads the dependency report at {@code path} and integrates it as the output of {@code job}.
   * The report path is the file identifier.
   */
  public LoadResult loadFromPath(J job, Path path) {
    String file = path.toString();
    byte[] contents;
    try {
      contents = Files.readAllBytes(path);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not read dependency report " + file, e);
      return LoadResult.HAD_ERROR;
    }
    // For debugging, emit dot files before and after.
    emitDotFileForFile(file);
    LoadResult result = loadFromBuffer(job, file, contents);
    emitDotFileForFile(file);
    return result;
  }

  /** Parses {@code contents} as the dependency report of {@code file} and integrates it. */
  public LoadResult loadFromBuffer(J job, String file, byte[] contents) {
    FileSnapshot snapshot;
    try {
      snapshot = SnapshotParser.parse(contents, file);
    } catch (SnapshotParseException e) {
      logger.warning("Malformed dependency report " + file + ": " + e.getMessage());
      return LoadResult.HAD_ERROR;
    }
    return integrate(job, snapshot);
  }

  /** Integrates a snapshot that is already in hand as the output of {@code job}. */
  public LoadResult integrate(J job, FileSnapshot snapshot) {
    String file = snapshot.getFileIdentifier();
    addIndependentNode(job, file);
    LoadResult result = graph.integrate(file, snapshot).getLoadResult();
    if (graph.getOptions().shouldVerify()) {
      verify();
    }
    return result;
  }

  /**
   * Records that {@code job} produces the report for {@code file}. No nodes are created; that
   * happens when the report is loaded.
   *
   * @throws IllegalStateException if either side is already paired with something else
   */
  public void addIndependentNode(J job, String file) {
    checkNotNull(job);
    checkArgument(!file.isEmpty(), "file identifiers must not be empty");
    J existingJob = jobsByFile.get(file);
    if (existingJob != null) {
      checkState(existingJob.equals(job), "%s is already produced by %s", file, existingJob);
      return;
    }
    String existingFile = jobsByFile.inverse().get(job);
    checkState(existingFile == null, "%s already produces %s", job, existingFile);
    jobsByFile.put(file, job);
  }

  /** Whether a report has been recorded for {@code job}. */
  public boolean isTracked(J job) {
    return jobsByFile.containsValue(job);
  }

  public boolean isMarked(J job) {
    return graph.isMarked(getFile(job));
  }

  @CanIgnoreReturnValue
  public boolean markIntransitive(J job) {
    return graph.markIntransitive(getFile(job));
  }

  /**
   * Appends to {@code visited} the jobs of every file transitively affected by {@code job}'s file,
   * skipping jobs already present.
   */
  public void markTransitive(List<J> visited, J job) {
    List<String> files = new ArrayList<>();
    for (J alreadyVisited : visited) {
      String file = jobsByFile.inverse().get(alreadyVisited);
      if (file != null) {
        files.add(file);
      }
    }
    int firstNew = files.size();
    graph.markTransitive(files, getFile(job));
    for (String file : files.subList(firstNew, files.size())) {
      visited.add(getJob(file));
    }
  }

  public ImmutableList<J> markTransitive(J job) {
    List<J> visited = new ArrayList<>();
    markTransitive(visited, job);
    return ImmutableList.copyOf(visited);
  }

  /** The jobs affected by a change to the external dependency {@code externalDependency}. */
  public ImmutableList<J> markExternal(String externalDependency) {
    List<String> files = new ArrayList<>();
    graph.markExternal(files, externalDependency);
    ImmutableList.Builder<J> uses = ImmutableList.builder();
    for (String file : files) {
      uses.add(getJob(file));
    }
    return uses.build();
  }

  /** Every external dependency the program uses, for the driver to watch. */
  public ImmutableList<String> getExternalDependencies() {
    return graph.getExternalDependencies();
  }

  /** The job producing {@code file}. */
  public J getJob(String file) {
    J job = jobsByFile.get(file);
    checkState(job != null, "no job is tracked for %s", file);
    return job;
  }

  /** The file identifier {@code job} produces. */
  public String getFile(J job) {
    String file = jobsByFile.inverse().get(job);
    checkState(file != null, "%s is not tracked", job);
    return file;
  }

  /**
   * Runs {@link ModuleDepGraph#verify} and also checks that every file in the graph has a job.
   *
   * @throws IllegalStateException if the graph is corrupt
   */
  public void verify() {
    graph.verify();
    graph.forEachFile(
        file -> checkState(jobsByFile.containsKey(file), "no job is tracked for %s", file));
  }

  private void emitDotFileForFile(String file) {
    if (!graph.getOptions().shouldEmitDotFiles()) {
      return;
    }
    Path out = dotFilenameForFile(file);
    try {
      MoreFiles.asCharSink(out, UTF_8).write(DotFileEmitter.toDot(graph));
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not write dot file " + out, e);
    }
  }

  private Path dotFilenameForFile(String file) {
    int seqNo = dotFileSequenceNumberByFile.merge(file, 1, Integer::sum) - 1;
    String name = file + "." + seqNo + ".dot";
    Path directory = graph.getOptions().getDotFileDirectory();
    if (directory == null) {
      return Paths.get(name);
    }
    return directory.resolve(Paths.get(name).getFileName());
  }
}
