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
package ai.floedb.metricat.catalog.plugin;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Immutable {@link MetricDescriptor} built from a plugin's metric advertisement. */
public record AdvertisedMetric(List<String> namespace, int version, Instant lastAdvertisedTime)
    implements MetricDescriptor {

  public AdvertisedMetric {
    namespace = List.copyOf(Objects.requireNonNull(namespace, "namespace"));
    lastAdvertisedTime = Objects.requireNonNull(lastAdvertisedTime, "lastAdvertisedTime");
  }

  public static AdvertisedMetric of(int version, String... namespace) {
    return new AdvertisedMetric(List.of(namespace), version, Instant.now());
  }
}
