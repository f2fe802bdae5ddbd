package ai.floedb.metricat.catalog;

/**
 * Point-in-time counters of a {@link MetricCatalog}.
 *
 * @param namespaces number of enumeration keys
 * @param entries number of stored entries across all namespaces and versions
 * @param subscriptions sum of the subscription counts of all stored entries
 */
public record CatalogStats(int namespaces, int entries, long subscriptions) {}
