package habitkit.dispatch;

import habitkit.EventKind;
import habitkit.merge.WriteSet;
import habitkit.util.JsonValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one dispatch.
 *
 * <p>{@code integrations} is the habit's integration state after the dispatch. When the
 * dispatcher has a store it is what the store holds after {@code apply}; without a store
 * it is the event snapshot's state with the write set applied, and the caller persists it.
 *
 * @param eventId      the event's id
 * @param kind         the event kind
 * @param habitId      the habit
 * @param hooks        one outcome per invoked hook, in registration order
 * @param writeSet     merged writes
 * @param applied      whether a store persisted the result
 * @param applyError   store failure message, {@code null} if none
 * @param integrations resulting integration state keyed by extension name
 */
public record DispatchOutcome(
    String eventId,
    EventKind kind,
    String habitId,
    List<HookOutcome> hooks,
    WriteSet writeSet,
    boolean applied,
    String applyError,
    Map<String, Map<String, Object>> integrations
) {

  public DispatchOutcome {
    hooks = List.copyOf(hooks);
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    if (integrations != null) {
      integrations.forEach((name, data) -> copy.put(name, JsonValues.immutableCopy(data)));
    }
    integrations = Collections.unmodifiableMap(copy);
  }

  public Optional<HookOutcome> hook(String extensionName) {
    return hooks.stream().filter(h -> h.extensionName().equals(extensionName)).findFirst();
  }

  public List<String> failedExtensions() {
    return hooks.stream().filter(HookOutcome::failed).map(HookOutcome::extensionName).toList();
  }

  public Map<String, Object> integration(String extensionName) {
    Map<String, Object> data = integrations.get(extensionName);
    return data == null ? Map.of() : data;
  }
}
