/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
package ai.floedb.metricat.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.metricat.catalog.MetricCatalogException.MetricNotFoundException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NamespaceTrieTest {

  private NamespaceTrie trie;
  private TestPlugin pluginA;
  private TestPlugin pluginB;

  @BeforeEach
  void setUp() {
    trie = new NamespaceTrie();
    pluginA = TestPlugin.of("a", 1);
    pluginB = TestPlugin.of("b", 2);
  }

  @Test
  void getReturnsAllVersionsAtExactPathOrderedByVersion() {
    MetricEntry v2 = pluginB.entry(2, "intel", "cpu", "load");
    MetricEntry v1 = pluginA.entry(1, "intel", "cpu", "load");
    trie.add(v2);
    trie.add(v1);
    trie.add(pluginA.entry(1, "intel", "cpu", "load", "avg"));

    assertThat(trie.get(List.of("intel", "cpu", "load"))).containsExactly(v1, v2);
  }

  @Test
  void addReplacesSameVersion() {
    MetricEntry first = pluginA.entry(1, "intel", "cpu");
    MetricEntry second = pluginA.entry(1, "intel", "cpu");
    trie.add(first);
    trie.add(second);

    assertThat(trie.get(List.of("intel", "cpu"))).containsExactly(second);
  }

  @Test
  void getOnIntermediateNodeIsNotFound() {
    trie.add(pluginA.entry(1, "intel", "cpu", "load"));

    assertThatThrownBy(() -> trie.get(List.of("intel", "cpu")))
        .isInstanceOf(MetricNotFoundException.class)
        .hasMessage("Metric not found: intel/cpu");
    assertThatThrownBy(() -> trie.get(List.of("intel", "mem")))
        .isInstanceOf(MetricNotFoundException.class);
  }

  @Test
  void fetchCollectsWholeSubtree() {
    MetricEntry load = pluginA.entry(1, "intel", "cpu", "load");
    MetricEntry temp = pluginA.entry(1, "intel", "cpu", "temperature");
    MetricEntry mem = pluginA.entry(1, "intel", "mem", "free");
    trie.add(load);
    trie.add(temp);
    trie.add(mem);

    assertThat(trie.fetch(List.of("intel", "cpu"))).containsExactly(load, temp);
    assertThat(trie.fetch(List.of("intel", "cpu", "load"))).containsExactly(load);
    assertThat(trie.fetch(List.of())).containsExactly(load, temp, mem);
  }

  @Test
  void fetchIncludesEntriesAtTheNodeItself() {
    MetricEntry parent = pluginA.entry(1, "intel", "cpu");
    MetricEntry child = pluginA.entry(1, "intel", "cpu", "load");
    trie.add(child);
    trie.add(parent);

    assertThat(trie.fetch(List.of("intel", "cpu"))).containsExactly(parent, child);
    assertThat(trie.get(List.of("intel", "cpu"))).containsExactly(parent);
  }

  @Test
  void fetchOnMissingPathIsNotFound() {
    assertThatThrownBy(() -> trie.fetch(List.of("intel")))
        .isInstanceOf(MetricNotFoundException.class);
  }

  @Test
  void removePrunesEmptyAncestors() {
    trie.add(pluginA.entry(1, "intel", "cpu", "load"));

    assertThat(trie.remove(List.of("intel", "cpu", "load"))).isTrue();
    assertThat(trie.isEmpty()).isTrue();
    assertThatThrownBy(() -> trie.fetch(List.of("intel")))
        .isInstanceOf(MetricNotFoundException.class);
  }

  @Test
  void removeKeepsSiblingsAndDescendants() {
    MetricEntry temp = pluginA.entry(1, "intel", "cpu", "temperature");
    MetricEntry avg = pluginA.entry(1, "intel", "cpu", "load", "avg");
    trie.add(pluginA.entry(1, "intel", "cpu", "load"));
    trie.add(avg);
    trie.add(temp);

    trie.remove(List.of("intel", "cpu", "load"));

    assertThat(trie.fetch(List.of("intel"))).containsExactly(avg, temp);
    assertThat(trie.lookup(List.of("intel", "cpu", "load"))).isEmpty();
  }

  @Test
  void removeOfUnknownPathReportsFalse() {
    trie.add(pluginA.entry(1, "intel", "cpu"));
    assertThat(trie.remove(List.of("intel", "mem"))).isFalse();
    assertThat(trie.remove(List.of("intel"))).isFalse();
    assertThat(trie.get(List.of("intel", "cpu"))).hasSize(1);
  }

  @Test
  void deleteByPluginRemovesOnlyThatPluginsEntries() {
    MetricEntry a1 = pluginA.entry(1, "intel", "cpu", "load");
    trie.add(a1);
    trie.add(pluginB.entry(2, "intel", "cpu", "load"));
    trie.add(pluginB.entry(2, "intel", "disk", "io"));

    assertThat(trie.deleteByPlugin(pluginB)).isEqualTo(2);

    assertThat(trie.fetch(List.of())).containsExactly(a1);
    assertThatThrownBy(() -> trie.fetch(List.of("intel", "disk")))
        .isInstanceOf(MetricNotFoundException.class);
  }

  @Test
  void deleteByPluginComparesByIdentity() {
    trie.add(pluginA.entry(1, "intel", "cpu"));
    TestPlugin lookalike = TestPlugin.of("a", 1);

    assertThat(trie.deleteByPlugin(lookalike)).isZero();
    assertThat(trie.get(List.of("intel", "cpu"))).hasSize(1);
  }

  @Test
  void deleteByPluginPrunesWholeTreeWhenEverythingGoes() {
    trie.add(pluginA.entry(1, "a", "b", "c"));
    trie.add(pluginA.entry(2, "a", "b"));
    trie.add(pluginA.entry(1, "x"));

    assertThat(trie.deleteByPlugin(pluginA)).isEqualTo(3);
    assertThat(trie.isEmpty()).isTrue();
    assertThat(trie.entries()).isEmpty();
  }
}
