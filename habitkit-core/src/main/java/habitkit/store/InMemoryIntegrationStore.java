package habitkit.store;

import habitkit.merge.IntegrationDocuments;
import habitkit.merge.WriteSet;
import habitkit.spi.IntegrationStore;
import habitkit.util.JsonValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link IntegrationStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Each apply computes the new state on a copy and swaps it in with a single
 * per-habit {@code compute}, so a failing write set leaves the stored state untouched.
 * Values are deep-copied in and out. Suitable for tests and single-node demos.
 */
public final class InMemoryIntegrationStore implements IntegrationStore {
  private final Map<String, Map<String, Map<String, Object>>> habits = new ConcurrentHashMap<>();

  @Override
  public Map<String, Map<String, Object>> load(String habitId) {
    return copyOut(habits.get(habitId));
  }

  @Override
  public Map<String, Map<String, Object>> apply(WriteSet writeSet) {
    if (writeSet.isEmpty()) {
      return load(writeSet.habitId());
    }
    Map<String, Map<String, Object>> updated = habits.compute(writeSet.habitId(),
        (id, current) -> IntegrationDocuments.apply(current, writeSet));
    return copyOut(updated);
  }

  @Override
  public int removeAll(String habitId) {
    Map<String, Map<String, Object>> removed = habits.remove(habitId);
    return removed == null ? 0 : removed.size();
  }

  /** Number of habits with stored integrations. */
  public int habitCount() {
    return habits.size();
  }

  private static Map<String, Map<String, Object>> copyOut(Map<String, Map<String, Object>> state) {
    if (state == null) {
      return Collections.emptyMap();
    }
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    state.forEach((name, data) -> copy.put(name, JsonValues.mutableCopy(data)));
    return copy;
  }
}
