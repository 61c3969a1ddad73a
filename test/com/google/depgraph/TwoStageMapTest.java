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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TwoStageMap} */
@RunWith(JUnit4.class)
public final class TwoStageMapTest {

  private final TwoStageMap<String, String, Integer> map = new TwoStageMap<>();

  @Test
  public void testFindAndFindAll() {
    map.insert("a", "x", 1);
    map.insert("a", "y", 2);
    map.insert("b", "x", 3);

    assertThat(map.find("a", "y")).isEqualTo(2);
    assertThat(map.find("b", "y")).isNull();
    assertThat(map.find("c", "x")).isNull();
    assertThat(map.findAll("a")).containsExactly("x", 1, "y", 2).inOrder();
    assertThat(map.findAll("c")).isEmpty();
    assertThat(map.size()).isEqualTo(3);
  }

  @Test
  public void testInsertReplaces() {
    assertThat(map.insert("a", "x", 1)).isNull();
    assertThat(map.insert("a", "x", 2)).isEqualTo(1);
    assertThat(map.find("a", "x")).isEqualTo(2);
  }

  @Test
  public void testRemoveDropsEmptyInnerMaps() {
    map.insert("a", "x", 1);
    assertThat(map.remove("a", "y")).isNull();
    assertThat(map.remove("a", "x")).isEqualTo(1);
    assertThat(map.containsKey1("a")).isFalse();
    assertThat(map.remove("a", "x")).isNull();
  }

  @Test
  public void testForEachEntryInInsertionOrder() {
    map.insert("b", "y", 1);
    map.insert("a", "x", 2);
    map.insert("b", "x", 3);

    List<String> visited = new ArrayList<>();
    map.forEachEntry((k1, k2, v) -> visited.add(k1 + k2 + v));
    assertThat(visited).containsExactly("by1", "bx3", "ax2").inOrder();

    List<String> firstKeys = new ArrayList<>();
    map.forEachKey1((k1, inner) -> firstKeys.add(k1 + inner.size()));
    assertThat(firstKeys).containsExactly("b2", "a1").inOrder();
  }
}
