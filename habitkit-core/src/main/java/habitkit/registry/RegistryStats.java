package habitkit.registry;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry summary: total extensions and how many declare each supported type.
 *
 * @param total  number of registered extensions
 * @param byType count per type tag, sorted by tag
 */
public record RegistryStats(int total, Map<String, Integer> byType) {

  public RegistryStats {
    byType = byType == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(byType));
  }
}
