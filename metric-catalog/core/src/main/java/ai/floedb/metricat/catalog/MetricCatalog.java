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

import ai.floedb.metricat.catalog.MetricCatalogException.MetricNotFoundException;
import ai.floedb.metricat.catalog.MetricCatalogException.NegativeSubscriptionCountException;
import ai.floedb.metricat.catalog.config.CatalogConfig;
import ai.floedb.metricat.catalog.config.CatalogConfigs;
import ai.floedb.metricat.catalog.plugin.ConfigPolicyTree;
import ai.floedb.metricat.catalog.plugin.LoadedPlugin;
import ai.floedb.metricat.catalog.plugin.MetricDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Process-wide index of every metric the loaded plugins can produce.
 *
 * <p>A single lock serializes every operation: trie mutations, lookups, subscription counters and
 * the enumeration cursor. Lookups that span a large subtree therefore block all other callers for
 * their duration.
 *
 * <p>A version argument of {@code -1} (any negative value) asks for the latest version.
 */
public final class MetricCatalog {
  private static final Logger LOG = Logger.getLogger(MetricCatalog.class);

  public static final int LATEST_VERSION = -1;

  private final NamespaceTrie tree = new NamespaceTrie();
  private final List<String> keys = new ArrayList<>();
  private final Map<String, List<String>> namespacesByKey = new HashMap<>();
  private final ReentrantLock lock;
  private final boolean pruneKeysOnRemove;
  private int cursor;

  public MetricCatalog() {
    this(CatalogConfigs.defaults());
  }

  public MetricCatalog(CatalogConfig config) {
    Objects.requireNonNull(config, "config");
    this.lock = new ReentrantLock(config.fairLock());
    this.pruneKeysOnRemove = config.pruneKeysOnRemove();
  }

  /**
   * Registers a metric advertised by {@code plugin}, binding the plugin's policy for that
   * namespace.
   *
   * @throws IllegalStateException when the plugin has no configuration policy tree; this is a
   *     broken contract in the plugin manager, not a recoverable condition
   */
  public MetricEntry addLoadedMetricType(LoadedPlugin plugin, MetricDescriptor descriptor) {
    Objects.requireNonNull(plugin, "plugin");
    Objects.requireNonNull(descriptor, "descriptor");
    ConfigPolicyTree policyTree = plugin.policyTree().orElse(null);
    if (policyTree == null) {
      LOG.errorf(
          "Plugin %s v%d has no config policy tree; cannot register %s",
          plugin.name(), plugin.version(), Namespaces.path(descriptor.namespace()));
      throw new IllegalStateException(
          "Loaded plugin " + plugin.name() + " has no config policy tree");
    }
    MetricEntry entry =
        new MetricEntry(
            descriptor.namespace(),
            descriptor.version(),
            descriptor.lastAdvertisedTime(),
            plugin,
            policyTree.get(descriptor.namespace()));
    add(entry);
    return entry;
  }

  /**
   * Drops every entry owned by {@code plugin}. Called once per plugin unload.
   *
   * @return number of entries removed
   */
  public int rmUnloadedPluginMetrics(LoadedPlugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    lock.lock();
    try {
      int removed = tree.deleteByPlugin(plugin);
      LOG.infof(
          "Removed %d metrics of unloaded plugin %s v%d", removed, plugin.name(), plugin.version());
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** Inserts {@code entry}, replacing an entry with the same namespace and resolved version. */
  public void add(MetricEntry entry) {
    Objects.requireNonNull(entry, "entry");
    lock.lock();
    try {
      String key = Namespaces.key(entry.namespace());
      if (!namespacesByKey.containsKey(key)) {
        keys.add(key);
        namespacesByKey.put(key, entry.namespace());
      }
      tree.add(entry);
      LOG.debugf("Registered metric %s", entry.key());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Resolves one entry. A namespace holding a single entry returns it whatever the requested
   * version. Among several, a non-negative {@code version} is matched against the owning plugin's
   * version, or the entry's own for entries registered without a plugin.
   *
   * @throws MetricNotFoundException when nothing matches
   */
  public MetricEntry get(List<String> namespace, int version) {
    lock.lock();
    try {
      return resolve(namespace, version);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns every entry at or below {@code namespace}.
   *
   * @throws MetricNotFoundException when the subtree holds no entries
   */
  public List<MetricEntry> fetch(List<String> namespace) {
    lock.lock();
    try {
      return tree.fetch(namespace);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops all versions stored at exactly {@code namespace}. The namespace stays in the
   * enumeration keys unless {@link CatalogConfig#pruneKeysOnRemove()} is set.
   */
  public void remove(List<String> namespace) {
    lock.lock();
    try {
      boolean removed = tree.remove(namespace);
      LOG.debugf("Removed namespace %s (present: %s)", Namespaces.path(namespace), removed);
      if (removed && pruneKeysOnRemove) {
        dropKey(Namespaces.key(namespace));
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Increments the subscription count of the resolved entry.
   *
   * @throws MetricNotFoundException when nothing matches
   */
  public void subscribe(List<String> namespace, int version) {
    lock.lock();
    try {
      MetricEntry entry = resolve(namespace, version);
      entry.subscribe();
      LOG.debugf("Subscribed to %s (count %d)", entry.key(), entry.subscriptionCount());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Decrements the subscription count of the resolved entry.
   *
   * @throws MetricNotFoundException when nothing matches
   * @throws NegativeSubscriptionCountException when the entry has no subscribers
   */
  public void unsubscribe(List<String> namespace, int version) {
    lock.lock();
    try {
      MetricEntry entry = resolve(namespace, version);
      entry.unsubscribe();
      LOG.debugf("Unsubscribed from %s (count %d)", entry.key(), entry.subscriptionCount());
    } finally {
      lock.unlock();
    }
  }

  /** Owning plugin of the resolved entry; null for directly registered entries. */
  public LoadedPlugin getPlugin(List<String> namespace, int version) {
    return get(namespace, version).plugin();
  }

  /**
   * Advances the shared cursor. Returns false and rewinds once every key has been visited.
   *
   * <p>Only one consumer may enumerate at a time; prefer {@link #snapshot()}.
   */
  public boolean next() {
    lock.lock();
    try {
      cursor++;
      if (cursor > keys.size()) {
        cursor = 0;
        return false;
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Key under the cursor and the entries currently stored for it.
   *
   * @throws IllegalStateException when {@link #next()} has not positioned the cursor
   */
  public CatalogItem item() {
    lock.lock();
    try {
      if (cursor == 0) {
        throw new IllegalStateException("next() must be called before item()");
      }
      return itemFor(keys.get(cursor - 1));
    } finally {
      lock.unlock();
    }
  }

  /** Every enumeration key with its current entries, in first-registration order. */
  public List<CatalogItem> snapshot() {
    lock.lock();
    try {
      List<CatalogItem> items = new ArrayList<>(keys.size());
      for (String key : keys) {
        items.add(itemFor(key));
      }
      return Collections.unmodifiableList(items);
    } finally {
      lock.unlock();
    }
  }

  public CatalogStats stats() {
    lock.lock();
    try {
      List<MetricEntry> entries = tree.entries();
      long subscriptions = 0;
      for (MetricEntry entry : entries) {
        subscriptions += entry.subscriptionCount();
      }
      return new CatalogStats(keys.size(), entries.size(), subscriptions);
    } finally {
      lock.unlock();
    }
  }

  private MetricEntry resolve(List<String> namespace, int version) {
    List<MetricEntry> entries = tree.get(namespace);
    if (entries.size() == 1) {
      return entries.get(0);
    }
    if (version >= 0) {
      for (MetricEntry entry : entries) {
        if (pluginVersion(entry) == version) {
          return entry;
        }
      }
      throw new MetricNotFoundException(namespace);
    }
    return latest(entries);
  }

  // Explicit versions select by the owning plugin's version.
  private static int pluginVersion(MetricEntry entry) {
    return entry.plugin() != null ? entry.plugin().version() : entry.version();
  }

  // Ties keep the first entry, i.e. the one indexed under the lowest version.
  private static MetricEntry latest(List<MetricEntry> entries) {
    MetricEntry current = entries.get(0);
    for (MetricEntry entry : entries) {
      if (entry.version() > current.version()) {
        current = entry;
      }
    }
    return current;
  }

  private CatalogItem itemFor(String key) {
    List<String> namespace = namespacesByKey.get(key);
    return new CatalogItem(key, namespace, tree.lookup(namespace));
  }

  private void dropKey(String key) {
    int index = keys.indexOf(key);
    if (index < 0) {
      return;
    }
    keys.remove(index);
    namespacesByKey.remove(key);
    if (index < cursor) {
      cursor--;
    }
  }
}
