package ai.floedb.metricat.catalog.plugin;

import java.util.List;

/** Per-namespace configuration policies published by a plugin. */
@FunctionalInterface
public interface ConfigPolicyTree {

  /** Returns the policy governing {@code namespace}, or null if the plugin declares none. */
  PolicyProcessor get(List<String> namespace);
}
