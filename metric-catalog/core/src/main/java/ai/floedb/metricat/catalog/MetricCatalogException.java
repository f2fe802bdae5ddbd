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

import java.util.List;

/** Recoverable failures reported by the metric catalog. Never retried by the catalog itself. */
public class MetricCatalogException extends RuntimeException {
  public MetricCatalogException(String msg) {
    super(msg);
  }

  /** No entry exists at the requested namespace, or none with the requested version. */
  public static class MetricNotFoundException extends MetricCatalogException {
    private final List<String> namespace;

    public MetricNotFoundException(List<String> namespace) {
      super("Metric not found: " + Namespaces.join(namespace));
      this.namespace = List.copyOf(namespace);
    }

    public List<String> namespace() {
      return namespace;
    }
  }

  /** Unsubscribe was requested for an entry nobody is subscribed to. State is left unchanged. */
  public static class NegativeSubscriptionCountException extends MetricCatalogException {
    private final String metricKey;

    public NegativeSubscriptionCountException(String metricKey) {
      super("subscription count cannot be < 0");
      this.metricKey = metricKey;
    }

    public String metricKey() {
      return metricKey;
    }
  }
}
