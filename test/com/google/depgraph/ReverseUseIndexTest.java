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
import static com.google.depgraph.TestKeys.iface;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReverseUseIndexTest {

  private final ReverseUseIndex index = new ReverseUseIndex();

  @Test
  public void testAddUse() {
    assertThat(index.addUse(iface("def"), iface("u1"))).isTrue();
    assertThat(index.addUse(iface("def"), iface("u2"))).isTrue();
    assertThat(index.addUse(iface("def"), iface("u1"))).isFalse();

    assertThat(index.getUses(iface("def"))).containsExactly(iface("u1"), iface("u2")).inOrder();
    assertThat(index.hasUses(iface("u1"))).isFalse();
    assertThat(index.size()).isEqualTo(2);
  }

  @Test
  public void testSelfUseIgnored() {
    assertThat(index.addUse(iface("k"), iface("k"))).isFalse();
    assertThat(index.hasUses(iface("k"))).isFalse();
  }
}
