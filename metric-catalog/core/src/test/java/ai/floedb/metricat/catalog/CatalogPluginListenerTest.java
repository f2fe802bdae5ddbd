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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.metricat.catalog.MetricCatalogException.MetricNotFoundException;
import ai.floedb.metricat.catalog.plugin.AdvertisedMetric;
import ai.floedb.metricat.catalog.plugin.ConfigPolicyTree;
import ai.floedb.metricat.catalog.plugin.LoadedPlugin;
import ai.floedb.metricat.catalog.plugin.PolicyProcessor;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogPluginListenerTest {

  @Mock LoadedPlugin plugin;
  @Mock ConfigPolicyTree policyTree;
  @Mock PolicyProcessor policy;

  private MetricCatalog catalog;
  private CatalogPluginListener listener;

  @BeforeEach
  void setUp() {
    when(plugin.name()).thenReturn("psutil");
    when(plugin.version()).thenReturn(3);
    when(plugin.policyTree()).thenReturn(Optional.of(policyTree));
    when(policyTree.get(any())).thenReturn(policy);
    catalog = new MetricCatalog();
    listener = new CatalogPluginListener(catalog);
  }

  @Test
  void loadRegistersEveryAdvertisedMetric() {
    List<MetricEntry> registered =
        listener.pluginLoaded(
            plugin,
            List.of(
                AdvertisedMetric.of(0, "psutil", "load", "load1"),
                AdvertisedMetric.of(0, "psutil", "load", "load5")));

    assertThat(registered).hasSize(2).allSatisfy(e -> assertThat(e.plugin()).isSameAs(plugin));
    assertThat(catalog.fetch(List.of("psutil"))).containsExactlyElementsOf(registered);
    assertThat(catalog.get(List.of("psutil", "load", "load1"), 3).policy()).isSameAs(policy);
    verify(policyTree).get(List.of("psutil", "load", "load1"));
    verify(policyTree).get(List.of("psutil", "load", "load5"));
  }

  @Test
  void loadWithoutAdvertisedMetricsRegistersNothing() {
    assertThat(listener.pluginLoaded(plugin, List.of())).isEmpty();
    assertThat(catalog.stats().entries()).isZero();
    verify(plugin, never()).policyTree();
  }

  @Test
  void loadOfPluginWithoutPolicyTreeFails() {
    when(plugin.policyTree()).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> listener.pluginLoaded(plugin, List.of(AdvertisedMetric.of(1, "psutil", "x"))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unloadRemovesPluginMetrics() {
    listener.pluginLoaded(plugin, List.of(AdvertisedMetric.of(0, "psutil", "load", "load1")));

    assertThat(listener.pluginUnloaded(plugin)).isEqualTo(1);

    assertThatThrownBy(() -> catalog.get(List.of("psutil", "load", "load1"), -1))
        .isInstanceOf(MetricNotFoundException.class);
    verify(plugin, times(1)).policyTree();
  }
}
