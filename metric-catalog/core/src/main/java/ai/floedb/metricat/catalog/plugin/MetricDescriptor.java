package ai.floedb.metricat.catalog.plugin;

import java.time.Instant;
import java.util.List;

/** A metric as advertised by a plugin when it is loaded. */
public interface MetricDescriptor {

  List<String> namespace();

  /** Advertised version; zero or negative defers to the plugin version. */
  int version();

  Instant lastAdvertisedTime();
}
