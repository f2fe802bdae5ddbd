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
package ai.floedb.metricat.catalog.micrometer;

import ai.floedb.metricat.catalog.MetricCatalog;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/** Publishes the size and subscription load of a {@link MetricCatalog} as Micrometer gauges. */
public final class CatalogMeterBinder implements MeterBinder {
  private static final Logger LOG = Logger.getLogger(CatalogMeterBinder.class);

  public static final String NAMESPACES = "metricat.catalog.namespaces";
  public static final String ENTRIES = "metricat.catalog.entries";
  public static final String SUBSCRIPTIONS = "metricat.catalog.subscriptions";

  private final MetricCatalog catalog;
  private final List<Tag> tags;

  public CatalogMeterBinder(MetricCatalog catalog) {
    this(catalog, List.of());
  }

  public CatalogMeterBinder(MetricCatalog catalog, Iterable<Tag> tags) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(tags, "tags");
    List<Tag> copy = new ArrayList<>();
    tags.forEach(copy::add);
    this.tags = List.copyOf(copy);
  }

  @Override
  public void bindTo(MeterRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    // Sampling takes the catalog lock.
    Gauge.builder(NAMESPACES, catalog, c -> c.stats().namespaces())
        .description("Distinct metric namespaces ever registered in the catalog.")
        .tags(tags)
        .strongReference(true)
        .register(registry);
    Gauge.builder(ENTRIES, catalog, c -> c.stats().entries())
        .description("Metric entries currently stored, across all namespaces and versions.")
        .tags(tags)
        .strongReference(true)
        .register(registry);
    Gauge.builder(SUBSCRIPTIONS, catalog, c -> c.stats().subscriptions())
        .description("Sum of subscription counts across all stored metric entries.")
        .tags(tags)
        .strongReference(true)
        .register(registry);
    LOG.debugf("Bound metric catalog gauges with tags %s", tags);
  }
}
