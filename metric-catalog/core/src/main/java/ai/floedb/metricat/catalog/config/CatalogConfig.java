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
package ai.floedb.metricat.catalog.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "metricat.catalog")
public interface CatalogConfig {

  /** Whether the catalog lock grants access in arrival order. */
  @WithDefault("false")
  boolean fairLock();

  /**
   * Whether {@code remove} also drops the namespace from the enumeration keys. Off by default:
   * removed namespaces keep being enumerated with no entries.
   */
  @WithDefault("false")
  boolean pruneKeysOnRemove();

  /** Whether {@code MetricCatalogs.newCatalog} applies service-loaded contributors. */
  @WithDefault("true")
  boolean loadContributors();
}
