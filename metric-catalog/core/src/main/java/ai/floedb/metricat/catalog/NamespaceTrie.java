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

import ai.floedb.metricat.catalog.MetricCatalogException.MetricNotFoundException;
import ai.floedb.metricat.catalog.plugin.LoadedPlugin;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Trie over namespace segments. Each node may carry a leaf collection mapping resolved version to
 * {@link MetricEntry}.
 *
 * <p>Children keep insertion order and leaf collections are ordered by version, so every listing
 * is deterministic. Nodes left without entries and without children are pruned.
 *
 * <p>Not thread-safe; {@link MetricCatalog} owns the only instance and guards it with its lock.
 */
public final class NamespaceTrie {
  private final Node root = new Node();

  /** Inserts {@code entry} under its namespace, replacing any entry with the same version. */
  public void add(MetricEntry entry) {
    Objects.requireNonNull(entry, "entry");
    Node node = root;
    for (String segment : entry.namespace()) {
      node = node.children.computeIfAbsent(segment, s -> new Node());
    }
    if (node.leaf == null) {
      node.leaf = new TreeMap<>();
    }
    node.leaf.put(entry.version(), entry);
  }

  /**
   * Returns every version stored at exactly {@code namespace}, ordered by version.
   *
   * @throws MetricNotFoundException when no entry exists at that path
   */
  public List<MetricEntry> get(List<String> namespace) {
    List<MetricEntry> entries = lookup(namespace);
    if (entries.isEmpty()) {
      throw new MetricNotFoundException(namespace);
    }
    return entries;
  }

  /** Like {@link #get} but returns an empty list instead of failing. */
  public List<MetricEntry> lookup(List<String> namespace) {
    Node node = find(namespace);
    if (node == null || !node.hasEntries()) {
      return List.of();
    }
    return List.copyOf(node.leaf.values());
  }

  /**
   * Returns every entry at {@code namespace} or below it. An empty namespace selects the whole
   * trie.
   *
   * @throws MetricNotFoundException when the subtree holds no entries
   */
  public List<MetricEntry> fetch(List<String> namespace) {
    Node node = find(namespace);
    if (node == null) {
      throw new MetricNotFoundException(namespace);
    }
    List<MetricEntry> out = new ArrayList<>();
    collect(node, out);
    if (out.isEmpty()) {
      throw new MetricNotFoundException(namespace);
    }
    return Collections.unmodifiableList(out);
  }

  /** All entries in the trie, in the same order as {@link #fetch}. */
  public List<MetricEntry> entries() {
    List<MetricEntry> out = new ArrayList<>();
    collect(root, out);
    return Collections.unmodifiableList(out);
  }

  /**
   * Drops the leaf collection at exactly {@code namespace} and prunes emptied ancestors.
   *
   * @return whether a leaf collection existed at that path
   */
  public boolean remove(List<String> namespace) {
    Objects.requireNonNull(namespace, "namespace");
    return remove(root, namespace, 0);
  }

  /**
   * Removes every entry owned by {@code plugin} (reference identity) across the whole trie.
   *
   * @return number of entries removed
   */
  public int deleteByPlugin(LoadedPlugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    return deleteByPlugin(root, plugin);
  }

  public boolean isEmpty() {
    return root.isPrunable();
  }

  private Node find(List<String> namespace) {
    Objects.requireNonNull(namespace, "namespace");
    Node node = root;
    for (String segment : namespace) {
      node = node.children.get(segment);
      if (node == null) {
        return null;
      }
    }
    return node;
  }

  private static void collect(Node node, List<MetricEntry> out) {
    if (node.leaf != null) {
      out.addAll(node.leaf.values());
    }
    for (Node child : node.children.values()) {
      collect(child, out);
    }
  }

  private static boolean remove(Node node, List<String> namespace, int depth) {
    if (depth == namespace.size()) {
      if (node.leaf == null) {
        return false;
      }
      node.leaf = null;
      return true;
    }
    String segment = namespace.get(depth);
    Node child = node.children.get(segment);
    if (child == null) {
      return false;
    }
    boolean removed = remove(child, namespace, depth + 1);
    if (removed && child.isPrunable()) {
      node.children.remove(segment);
    }
    return removed;
  }

  private static int deleteByPlugin(Node node, LoadedPlugin plugin) {
    int removed = 0;
    if (node.leaf != null) {
      int before = node.leaf.size();
      node.leaf.values().removeIf(entry -> entry.plugin() == plugin);
      removed += before - node.leaf.size();
      if (node.leaf.isEmpty()) {
        node.leaf = null;
      }
    }
    Iterator<Node> children = node.children.values().iterator();
    while (children.hasNext()) {
      Node child = children.next();
      removed += deleteByPlugin(child, plugin);
      if (child.isPrunable()) {
        children.remove();
      }
    }
    return removed;
  }

  private static final class Node {
    private final Map<String, Node> children = new LinkedHashMap<>();
    private NavigableMap<Integer, MetricEntry> leaf;

    boolean hasEntries() {
      return leaf != null && !leaf.isEmpty();
    }

    boolean isPrunable() {
      return leaf == null && children.isEmpty();
    }
  }
}
