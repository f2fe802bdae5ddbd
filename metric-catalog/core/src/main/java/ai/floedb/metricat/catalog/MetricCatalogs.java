package ai.floedb.metricat.catalog;

import ai.floedb.metricat.catalog.config.CatalogConfig;
import ai.floedb.metricat.catalog.config.CatalogConfigs;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/** Static entry points for building a populated {@link MetricCatalog}. */
public final class MetricCatalogs {
  private static final Logger LOG = Logger.getLogger(MetricCatalogs.class);

  private MetricCatalogs() {}

  /** Builds a catalog from the ambient configuration. */
  public static MetricCatalog newCatalog() {
    return newCatalog(CatalogConfigs.load());
  }

  public static MetricCatalog newCatalog(CatalogConfig config) {
    Objects.requireNonNull(config, "config");
    MetricCatalog catalog = new MetricCatalog(config);
    if (config.loadContributors()) {
      applyContributors(catalog);
    }
    return catalog;
  }

  /** Applies every {@link CatalogContributor} on the class path, ordered by class name. */
  public static void applyContributors(MetricCatalog catalog) {
    Objects.requireNonNull(catalog, "catalog");
    ServiceLoader<CatalogContributor> loader = ServiceLoader.load(CatalogContributor.class);
    List<CatalogContributor> contributors =
        loader.stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(c -> c.getClass().getName()))
            .collect(Collectors.toList());
    for (CatalogContributor contributor : contributors) {
      LOG.debugf("Applying catalog contributor %s", contributor.getClass().getName());
      contributor.contribute(catalog);
    }
  }
}
