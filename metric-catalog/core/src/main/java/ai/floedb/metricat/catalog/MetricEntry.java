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

import ai.floedb.metricat.catalog.MetricCatalogException.NegativeSubscriptionCountException;
import ai.floedb.metricat.catalog.plugin.LoadedPlugin;
import ai.floedb.metricat.catalog.plugin.PolicyProcessor;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One collectible (namespace, version) metric and its subscription state.
 *
 * <p>Entries are not thread-safe on their own. Once an entry is added to a {@link MetricCatalog}
 * its subscription count must only be changed through the catalog, which serializes access.
 */
public final class MetricEntry {
  /** Returned by {@link #version()} when neither the entry nor a plugin provides a version. */
  public static final int UNRESOLVED_VERSION = -1;

  private final LoadedPlugin plugin;
  private final List<String> namespace;
  private final int version;
  private final Instant lastAdvertisedTime;
  private final PolicyProcessor policy;
  private int subscriptions;
  private Map<String, String> config;
  private String source;
  private Instant timestamp;
  private Object data;

  public MetricEntry(List<String> namespace, int version, Instant lastAdvertisedTime) {
    this(namespace, version, lastAdvertisedTime, null, null);
  }

  public MetricEntry(
      List<String> namespace,
      int version,
      Instant lastAdvertisedTime,
      LoadedPlugin plugin,
      PolicyProcessor policy) {
    this.namespace = Namespaces.requireValid(namespace);
    this.version = version;
    this.lastAdvertisedTime = lastAdvertisedTime;
    this.plugin = plugin;
    this.policy = policy;
  }

  /** Owning plugin, or null for entries registered directly. */
  public LoadedPlugin plugin() {
    return plugin;
  }

  public List<String> namespace() {
    return namespace;
  }

  public String namespaceAsString() {
    return Namespaces.path(namespace);
  }

  /** {@code /intel/cpu/load/2}. */
  public String key() {
    return namespaceAsString() + "/" + version();
  }

  /**
   * Resolved version: the entry's own version when positive, otherwise the owning plugin's, or
   * {@link #UNRESOLVED_VERSION} without a plugin.
   */
  public int version() {
    if (version > 0) {
      return version;
    }
    if (plugin == null) {
      return UNRESOLVED_VERSION;
    }
    return plugin.version();
  }

  public Instant lastAdvertisedTime() {
    return lastAdvertisedTime;
  }

  public PolicyProcessor policy() {
    return policy;
  }

  public void subscribe() {
    subscriptions++;
  }

  /**
   * @throws NegativeSubscriptionCountException when the count is already zero
   */
  public void unsubscribe() {
    if (subscriptions == 0) {
      throw new NegativeSubscriptionCountException(key());
    }
    subscriptions--;
  }

  public int subscriptionCount() {
    return subscriptions;
  }

  public Map<String, String> config() {
    return config;
  }

  public void setConfig(Map<String, String> config) {
    this.config = config == null ? null : Map.copyOf(config);
  }

  public String source() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public void setTimestamp(Instant timestamp) {
    this.timestamp = timestamp;
  }

  public Object data() {
    return data;
  }

  public void setData(Object data) {
    this.data = data;
  }

  @Override
  public String toString() {
    return key();
  }
}
