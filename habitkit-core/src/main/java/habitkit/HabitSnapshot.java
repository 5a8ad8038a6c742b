package habitkit;

import habitkit.util.JsonValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a habit as it looked right after the owning service committed
 * its mutation.
 *
 * <p>{@code integrations} holds every extension's namespace keyed by extension name.
 * Values are opaque, JSON-shaped maps; the core never interprets them.
 *
 * @param id           habit identifier, never {@code null}
 * @param userId       owning user, may be {@code null}
 * @param type         entity-type tag used for extension scoping ({@code simple}, {@code count}, ...)
 * @param name         display name, may be {@code null}
 * @param targetValue  numeric target for count/time habits, may be {@code null}
 * @param attributes   remaining habit fields, opaque to the core
 * @param integrations per-extension state keyed by extension name
 */
public record HabitSnapshot(
    String id,
    String userId,
    String type,
    String name,
    Double targetValue,
    Map<String, Object> attributes,
    Map<String, Map<String, Object>> integrations
) {

  public HabitSnapshot {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    attributes = JsonValues.immutableCopy(attributes);
    integrations = copyIntegrations(integrations);
  }

  public static Builder builder(String id, String type) {
    return new Builder(id, type);
  }

  /**
   * Returns the namespace of one extension, or an empty map if it has none yet.
   */
  public Map<String, Object> integration(String extensionName) {
    Map<String, Object> data = integrations.get(extensionName);
    return data == null ? Collections.emptyMap() : data;
  }

  public HabitSnapshot withIntegrations(Map<String, ? extends Map<String, ?>> replacement) {
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    if (replacement != null) {
      replacement.forEach((key, value) -> copy.put(key, JsonValues.immutableCopy(value)));
    }
    return new HabitSnapshot(id, userId, type, name, targetValue, attributes, copy);
  }

  private static Map<String, Map<String, Object>> copyIntegrations(
      Map<String, ? extends Map<String, ?>> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> copy.put(
        Objects.requireNonNull(key, "integration key"), JsonValues.immutableCopy(value)));
    return Collections.unmodifiableMap(copy);
  }

  /** Builder for {@link HabitSnapshot}. */
  public static final class Builder {
    private final String id;
    private final String type;
    private String userId;
    private String name;
    private Double targetValue;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> integrations = new LinkedHashMap<>();

    private Builder(String id, String type) {
      this.id = id;
      this.type = type;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder targetValue(Double targetValue) {
      this.targetValue = targetValue;
      return this;
    }

    public Builder attribute(String key, Object value) {
      this.attributes.put(key, value);
      return this;
    }

    public Builder integration(String extensionName, Map<String, ?> data) {
      this.integrations.put(extensionName, JsonValues.mutableCopy(data));
      return this;
    }

    public HabitSnapshot build() {
      return new HabitSnapshot(id, userId, type, name, targetValue, attributes, integrations);
    }
  }
}
