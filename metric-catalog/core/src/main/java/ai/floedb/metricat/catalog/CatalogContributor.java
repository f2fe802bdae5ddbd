package ai.floedb.metricat.catalog;

/** Allows modules to register metric entries directly into a {@link MetricCatalog}. */
@FunctionalInterface
public interface CatalogContributor {

  /** Register entries into the provided catalog. */
  void contribute(MetricCatalog catalog);
}
