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

import java.util.Optional;

/**
 * A collector plugin loaded by the plugin manager.
 *
 * <p>The catalog only holds references to plugins; their lifecycle is owned by the plugin manager.
 * Two references denote the same plugin only when they are the same object.
 */
public interface LoadedPlugin {

  String name();

  /** Version of the plugin binary, used when an advertised metric carries no version. */
  int version();

  /** Configuration policy declared by the plugin, empty when the plugin never published one. */
  Optional<ConfigPolicyTree> policyTree();
}
