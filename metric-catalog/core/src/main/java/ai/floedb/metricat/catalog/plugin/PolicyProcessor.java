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

import java.util.List;
import java.util.Map;

/**
 * Applies a configuration policy (defaults, required keys, value rules) to raw configuration.
 *
 * <p>The catalog binds a processor to each metric entry at registration time and never invokes it;
 * task schedulers do when they resolve the configuration of a subscribed metric.
 */
@FunctionalInterface
public interface PolicyProcessor {

  Result process(Map<String, String> values);

  /** Processed configuration together with the rule violations found while processing it. */
  record Result(Map<String, String> values, List<String> errors) {
    public Result {
      values = values == null ? Map.of() : Map.copyOf(values);
      errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
      return !errors.isEmpty();
    }
  }
}
