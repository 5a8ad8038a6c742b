package habitkit.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Every write produced by one dispatch for one habit, in application order. A store
 * applies a write set atomically: all of it or none of it.
 *
 * @param habitId  the habit whose integrations are written
 * @param writes   writes in extension registration order
 * @param rejected extensions whose results were dropped, with the reason
 */
public record WriteSet(String habitId, List<IntegrationWrite> writes, Map<String, String> rejected) {

  public WriteSet {
    Objects.requireNonNull(habitId, "habitId");
    writes = List.copyOf(writes);
    rejected = rejected == null || rejected.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
  }

  public static WriteSet empty(String habitId) {
    return new WriteSet(habitId, List.of(), Map.of());
  }

  public boolean isEmpty() {
    return writes.isEmpty();
  }

  /** Names of the namespaces this write set touches, in first-write order. */
  public Set<String> touchedExtensions() {
    Set<String> names = new LinkedHashSet<>();
    for (IntegrationWrite write : writes) {
      names.add(write.extensionName());
    }
    return names;
  }

  public List<IntegrationWrite> writesFor(String extensionName) {
    List<IntegrationWrite> result = new ArrayList<>();
    for (IntegrationWrite write : writes) {
      if (write.extensionName().equals(extensionName)) {
        result.add(write);
      }
    }
    return result;
  }
}
