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

package com.google.depgraph.snapshot;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.depgraph.DeclAspect;
import com.google.depgraph.DependencyKey;
import com.google.depgraph.NodeKind;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads a JSON dependency report into a {@link FileSnapshot}.
 *
 * <p>The report is an object with a {@code nodes} array. Each node names its key with {@code
 * kind}, {@code aspect}, {@code context} and {@code name}, may carry a {@code fingerprint}, is a
 * declaration of the reported file when {@code defined} is true, and lists the indices of the
 * nodes it depends upon in {@code uses}:
 *
 * <pre>
 * {"nodes": [
 *   {"kind": "sourceFileProvide", "aspect": "interface", "name": "a.deps",
 *    "fingerprint": "1f3a", "defined": true},
 *   {"kind": "topLevel", "aspect": "interface", "name": "foo", "defined": true, "uses": [2]},
 *   {"kind": "externalDepend", "aspect": "interface", "name": "/sdk/Lib.module"}
 * ]}
 * </pre>
 */
public final class SnapshotParser {

  /** Parses a UTF-8 encoded report produced for {@code fileIdentifier}. */
  public static FileSnapshot parse(byte[] contents, String fileIdentifier)
      throws SnapshotParseException {
    return parse(new String(contents, UTF_8), fileIdentifier);
  }

  public static FileSnapshot parse(String contents, String fileIdentifier)
      throws SnapshotParseException {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new SnapshotParseException("JSON parse exception: " + ex.getMessage(), ex);
    }
    if (root == null) {
      throw new SnapshotParseException("Empty dependency report for " + fileIdentifier);
    }
    JsonArray nodes = getArray(root, "nodes");
    if (nodes == null) {
      throw new SnapshotParseException("Dependency report has no 'nodes' array");
    }

    // Keys first, since uses refer to later nodes as well as earlier ones.
    List<DependencyKey> keys = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      keys.add(parseKey(getNodeObject(nodes, i), i));
    }

    FileSnapshot.Builder snapshot = FileSnapshot.builder(fileIdentifier);
    for (int i = 0; i < nodes.size(); i++) {
      JsonObject node = getNodeObject(nodes, i);
      SnapshotNode.Builder builder = SnapshotNode.builder(keys.get(i));
      boolean defined = getBoolean(node, "defined", i);
      if (defined) {
        builder.setFile(fileIdentifier);
      }
      String fingerprint = getString(node, "fingerprint", i);
      if (fingerprint != null) {
        if (!defined) {
          throw new SnapshotParseException(
              "Node " + i + " only records a use but has a fingerprint");
        }
        builder.setFingerprint(fingerprint);
      }
      builder.addUses(parseUses(node, i, keys));
      try {
        snapshot.add(builder);
      } catch (IllegalArgumentException ex) {
        throw new SnapshotParseException(ex.getMessage(), ex);
      }
    }
    return snapshot.build();
  }

  private static DependencyKey parseKey(JsonObject node, int index)
      throws SnapshotParseException {
    String kindName = getString(node, "kind", index);
    String aspectName = getString(node, "aspect", index);
    if (kindName == null || aspectName == null) {
      throw new SnapshotParseException("Node " + index + " needs both 'kind' and 'aspect'");
    }
    NodeKind kind = NodeKind.forReportName(kindName);
    if (kind == null) {
      throw new SnapshotParseException("Node " + index + " has unknown kind '" + kindName + "'");
    }
    DeclAspect aspect = DeclAspect.forReportName(aspectName);
    if (aspect == null) {
      throw new SnapshotParseException(
          "Node " + index + " has unknown aspect '" + aspectName + "'");
    }
    String context = getString(node, "context", index);
    String name = getString(node, "name", index);
    try {
      return DependencyKey.create(
          kind, aspect, context == null ? "" : context, name == null ? "" : name);
    } catch (IllegalArgumentException ex) {
      throw new SnapshotParseException("Node " + index + ": " + ex.getMessage(), ex);
    }
  }

  private static ImmutableList<DependencyKey> parseUses(
      JsonObject node, int index, List<DependencyKey> keys) throws SnapshotParseException {
    JsonArray uses = getArray(node, "uses");
    if (uses == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<DependencyKey> result = ImmutableList.builder();
    for (JsonElement use : uses) {
      if (!use.isJsonPrimitive() || !use.getAsJsonPrimitive().isNumber()) {
        throw new SnapshotParseException("Node " + index + " has a non-integer use: " + use);
      }
      int target;
      try {
        target = use.getAsBigDecimal().intValueExact();
      } catch (ArithmeticException | NumberFormatException ex) {
        throw new SnapshotParseException("Node " + index + " has a non-integer use: " + use, ex);
      }
      if (target < 0 || target >= keys.size()) {
        throw new SnapshotParseException(
            "Node " + index + " uses node " + target + ", which does not exist");
      }
      result.add(keys.get(target));
    }
    return result.build();
  }

  private static JsonObject getNodeObject(JsonArray nodes, int index)
      throws SnapshotParseException {
    JsonElement element = nodes.get(index);
    if (!element.isJsonObject()) {
      throw new SnapshotParseException("Node " + index + " is not an object");
    }
    return element.getAsJsonObject();
  }

  private static @Nullable JsonArray getArray(JsonObject object, String member)
      throws SnapshotParseException {
    JsonElement element = object.get(member);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonArray()) {
      throw new SnapshotParseException("'" + member + "' must be an array");
    }
    return element.getAsJsonArray();
  }

  private static @Nullable String getString(JsonObject node, String member, int index)
      throws SnapshotParseException {
    JsonElement element = node.get(member);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new SnapshotParseException("Node " + index + ": '" + member + "' must be a string");
    }
    return element.getAsString();
  }

  private static boolean getBoolean(JsonObject node, String member, int index)
      throws SnapshotParseException {
    JsonElement element = node.get(member);
    if (element == null || element.isJsonNull()) {
      return false;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
      throw new SnapshotParseException("Node " + index + ": '" + member + "' must be a boolean");
    }
    return element.getAsBoolean();
  }

  private SnapshotParser() {}
}
