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
import java.util.Objects;

/** Helpers for metric namespaces expressed as ordered segment lists. */
public final class Namespaces {
  private static final String KEY_DELIMITER = ".";
  private static final String PATH_DELIMITER = "/";

  private Namespaces() {}

  /**
   * Validates and copies a namespace.
   *
   * @throws IllegalArgumentException when the namespace is empty or has a blank segment
   */
  public static List<String> requireValid(List<String> namespace) {
    Objects.requireNonNull(namespace, "namespace");
    if (namespace.isEmpty()) {
      throw new IllegalArgumentException("namespace must not be empty");
    }
    for (String segment : namespace) {
      if (segment == null || segment.isBlank()) {
        throw new IllegalArgumentException("namespace segments must not be blank: " + namespace);
      }
    }
    return List.copyOf(namespace);
  }

  /** Dotted form used as the enumeration key, e.g. {@code intel.cpu.load}. */
  public static String key(List<String> namespace) {
    return String.join(KEY_DELIMITER, namespace);
  }

  /** Slash form used in messages and entry keys, without a leading slash. */
  public static String join(List<String> namespace) {
    return String.join(PATH_DELIMITER, namespace);
  }

  /** Absolute path form, e.g. {@code /intel/cpu/load}. */
  public static String path(List<String> namespace) {
    return PATH_DELIMITER + join(namespace);
  }
}
