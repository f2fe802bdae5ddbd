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

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import java.util.Objects;

/** Builds {@link CatalogConfig} outside of a CDI container. */
public final class CatalogConfigs {
  private static final String EXPLICIT_SOURCE = "metricat-catalog-explicit";
  private static final int EXPLICIT_ORDINAL = 500;

  private CatalogConfigs() {}

  /**
   * Reads system properties, environment variables and {@code
   * META-INF/microprofile-config.properties}.
   */
  public static CatalogConfig load() {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withMapping(CatalogConfig.class)
            .build();
    return config.getConfigMapping(CatalogConfig.class);
  }

  /** Uses only {@code properties}, falling back to the declared defaults. */
  public static CatalogConfig fromMap(Map<String, String> properties) {
    Objects.requireNonNull(properties, "properties");
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .withSources(new PropertiesConfigSource(properties, EXPLICIT_SOURCE, EXPLICIT_ORDINAL))
            .withMapping(CatalogConfig.class)
            .build();
    return config.getConfigMapping(CatalogConfig.class);
  }

  public static CatalogConfig defaults() {
    return fromMap(Map.of());
  }
}
