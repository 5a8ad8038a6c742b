package habitkit;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes one extension's integration namespace so hook bodies never spell
 * out {@code integrations.<name>} paths themselves.
 *
 * <p>Timestamps ({@code createdAt}, {@code lastUpdated}) are ISO-8601 strings taken
 * from the supplied clock.
 */
public final class DataManager {
  public static final String INTEGRATIONS = "integrations";

  private final String extensionName;
  private final Clock clock;

  public DataManager(String extensionName, Clock clock) {
    this.extensionName = Objects.requireNonNull(extensionName, "extensionName");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DataManager(String extensionName) {
    this(extensionName, Clock.systemUTC());
  }

  public String namespace() {
    return extensionName;
  }

  /**
   * Fully qualified path of a field in this namespace, e.g.
   * {@code path("streakData", "currentStreak")} gives
   * {@code integrations.streakTracker.streakData.currentStreak}.
   */
  public String path(String... fields) {
    StringBuilder path = new StringBuilder(INTEGRATIONS).append('.').append(extensionName);
    for (String field : fields) {
      path.append('.').append(field);
    }
    return path.toString();
  }

  /** The extension's current data on a habit, empty if it has none. */
  public Map<String, Object> getData(HabitSnapshot habit) {
    return habit.integration(extensionName);
  }

  /**
   * Seed for a new habit: {@code initial} plus {@code createdAt} and {@code lastUpdated}.
   */
  public HookResult.Seed createInitialData(Map<String, ?> initial) {
    String now = now();
    Map<String, Object> blob = new LinkedHashMap<>();
    if (initial != null) {
      blob.putAll(initial);
    }
    blob.put("createdAt", now);
    blob.put("lastUpdated", now);
    return HookResult.seed(blob);
  }

  /**
   * Seed replacing the namespace with {@code current} overlaid by {@code changes},
   * stamped with {@code lastUpdated}. Keys are merged one level deep only.
   */
  public HookResult.Seed replaceData(Map<String, ?> current, Map<String, ?> changes) {
    Map<String, Object> blob = new LinkedHashMap<>();
    if (current != null) {
      blob.putAll(current);
    }
    if (changes != null) {
      blob.putAll(changes);
    }
    blob.put("lastUpdated", now());
    return HookResult.seed(blob);
  }

  public PatchBuilder patch() {
    return new PatchBuilder();
  }

  private String now() {
    return Instant.now(clock).toString();
  }

  /**
   * Accumulates field-sets for a {@link HookResult.Patch}, qualifying every field with
   * this extension's namespace.
   */
  public final class PatchBuilder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private PatchBuilder() {
    }

    /**
     * Sets a field. Nested fields use dots: {@code set("stats.total", 3)}.
     */
    public PatchBuilder set(String field, Object value) {
      Objects.requireNonNull(field, "field");
      values.put(path(field), value);
      return this;
    }

    /** Sets {@code lastUpdated} to the current time. */
    public PatchBuilder touch() {
      return set("lastUpdated", now());
    }

    public HookResult.Patch build() {
      return HookResult.patch(values);
    }
  }
}
