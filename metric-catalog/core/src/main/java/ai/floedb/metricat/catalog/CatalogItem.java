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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The entries registered under one enumeration key.
 *
 * @param key dotted namespace, e.g. {@code intel.cpu.load}
 * @param namespace namespace the key was first registered with
 * @param entries entries currently stored at that namespace, ordered by version; empty when the
 *     namespace was removed after its key was recorded
 */
public record CatalogItem(String key, List<String> namespace, List<MetricEntry> entries) {
  public CatalogItem {
    Objects.requireNonNull(key, "key");
    namespace = List.copyOf(namespace);
    entries = List.copyOf(entries);
  }

  /** Entries keyed by resolved version. */
  public Map<Integer, MetricEntry> versions() {
    Map<Integer, MetricEntry> versions = new LinkedHashMap<>();
    for (MetricEntry entry : entries) {
      versions.put(entry.version(), entry);
    }
    return Collections.unmodifiableMap(versions);
  }
}
