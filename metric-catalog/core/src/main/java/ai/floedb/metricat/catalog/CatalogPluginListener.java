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

import ai.floedb.metricat.catalog.plugin.LoadedPlugin;
import ai.floedb.metricat.catalog.plugin.MetricDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/** Feeds plugin load and unload events from the plugin manager into a {@link MetricCatalog}. */
public final class CatalogPluginListener {
  private static final Logger LOG = Logger.getLogger(CatalogPluginListener.class);

  private final MetricCatalog catalog;

  public CatalogPluginListener(MetricCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /** Registers every metric {@code plugin} advertised while loading. */
  public List<MetricEntry> pluginLoaded(
      LoadedPlugin plugin, List<? extends MetricDescriptor> advertised) {
    Objects.requireNonNull(plugin, "plugin");
    Objects.requireNonNull(advertised, "advertised");
    if (advertised.isEmpty()) {
      LOG.warnf("Plugin %s v%d advertised no metrics", plugin.name(), plugin.version());
      return List.of();
    }
    List<MetricEntry> registered = new ArrayList<>(advertised.size());
    for (MetricDescriptor descriptor : advertised) {
      registered.add(catalog.addLoadedMetricType(plugin, descriptor));
    }
    LOG.infof(
        "Registered %d metrics advertised by plugin %s v%d",
        registered.size(), plugin.name(), plugin.version());
    return Collections.unmodifiableList(registered);
  }

  /** Removes every metric of {@code plugin}; returns how many entries were dropped. */
  public int pluginUnloaded(LoadedPlugin plugin) {
    return catalog.rmUnloadedPluginMetrics(plugin);
  }
}
