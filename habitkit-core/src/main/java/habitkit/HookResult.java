package habitkit;

import habitkit.util.JsonValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a hook asks the dispatcher to write into its own integration namespace.
 *
 * <ul>
 *   <li>{@link NoUpdate}: nothing to write. Hooks may also return {@code null}.</li>
 *   <li>{@link Seed}: the blob replaces the whole namespace.</li>
 *   <li>{@link Patch}: each entry is an independent overwrite at a dotted path, either
 *       fully qualified ({@code integrations.<name>.a.b}) or relative to the namespace
 *       ({@code a.b}).</li>
 * </ul>
 *
 * <p>Patches are flat overwrites. A hook that keeps a running counter must read the
 * previous value from the habit snapshot and write the recomputed one.
 */
public sealed interface HookResult permits HookResult.NoUpdate, HookResult.Seed, HookResult.Patch {

  HookResult NO_UPDATE = NoUpdate.INSTANCE;

  static HookResult none() {
    return NO_UPDATE;
  }

  static Seed seed(Map<String, ?> blob) {
    return new Seed(JsonValues.immutableCopy(blob));
  }

  static Patch patch(Map<String, ?> pathValues) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (pathValues != null) {
      copy.putAll(pathValues);
    }
    return new Patch(copy);
  }

  /** Single-path patch. */
  static Patch set(String path, Object value) {
    Map<String, Object> single = new LinkedHashMap<>();
    single.put(path, value);
    return patch(single);
  }

  enum NoUpdate implements HookResult {
    INSTANCE;

    @Override
    public String toString() {
      return "NoUpdate";
    }
  }

  record Seed(Map<String, Object> blob) implements HookResult {
    public Seed {
      blob = JsonValues.immutableCopy(blob);
    }
  }

  record Patch(Map<String, Object> pathValues) implements HookResult {
    public Patch {
      Objects.requireNonNull(pathValues, "pathValues");
      Map<String, Object> copy = new LinkedHashMap<>();
      pathValues.forEach((path, value) ->
          copy.put(Objects.requireNonNull(path, "path"), JsonValues.immutableValue(value)));
      pathValues = Collections.unmodifiableMap(copy);
    }
  }
}
