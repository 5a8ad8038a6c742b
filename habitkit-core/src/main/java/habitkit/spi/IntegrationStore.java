package habitkit.spi;

import habitkit.merge.WriteSet;

import java.util.Map;

/**
 * Persistence of per-habit integration state.
 *
 * <p>Implementations must apply each {@link WriteSet} atomically: either every write of
 * the dispatch is visible afterwards or none is. Writes for the same habit may arrive
 * from several threads; the dispatcher serializes them per habit within one process.
 *
 * @see habitkit.store.InMemoryIntegrationStore
 */
public interface IntegrationStore {

  /**
   * Loads a habit's integrations.
   *
   * @param habitId the habit
   * @return namespaces keyed by extension name, empty if the habit has none
   */
  Map<String, Map<String, Object>> load(String habitId);

  /**
   * Applies all writes of one dispatch atomically.
   *
   * @param writeSet the writes to apply; a no-op when empty
   * @return the habit's integrations after the writes
   */
  Map<String, Map<String, Object>> apply(WriteSet writeSet);

  /**
   * Removes every namespace stored for a habit.
   *
   * @param habitId the habit
   * @return number of namespaces removed
   */
  int removeAll(String habitId);
}
