package habitkit;

import habitkit.util.JsonValues;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable contract of one extension: identity, scope, hooks, endpoints and health check.
 *
 * <p>Descriptors can be built by hand or with {@link ExtensionBuilder}; both forms
 * behave the same at dispatch time. Validation of names, versions and hooks happens in
 * {@link habitkit.registry.ExtensionRegistry#register}, not here, so that an invalid
 * descriptor can still be constructed and rejected with a precise error.
 *
 * @param name           unique extension name, also the integration namespace key
 * @param version        extension version
 * @param description    human-readable description, may be empty
 * @param metadata       extra string properties such as {@code author}
 * @param supportedTypes habit types this extension handles; {@code null} or empty means {@code {"all"}}
 * @param hooks          one hook per event kind the extension observes
 * @param config         opaque extension configuration
 * @param endpoints      named extra operations
 * @param healthCheck    optional health check
 */
public record ExtensionDescriptor(
    String name,
    String version,
    String description,
    Map<String, String> metadata,
    Set<String> supportedTypes,
    Map<EventKind, Hook<?>> hooks,
    Map<String, Object> config,
    Map<String, Endpoint> endpoints,
    HealthCheck healthCheck
) {
  /** Type tag matching every habit type. */
  public static final String ALL_TYPES = "all";

  public ExtensionDescriptor {
    description = description == null ? "" : description;
    metadata = metadata == null || metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    supportedTypes = normalizeTypes(supportedTypes);
    hooks = copyHooks(hooks);
    config = JsonValues.immutableCopy(config);
    endpoints = endpoints == null || endpoints.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
  }

  /**
   * Returns the hook for a kind, or {@code null} if this extension does not observe it.
   */
  public Hook<?> hook(EventKind kind) {
    return hooks.get(kind);
  }

  public boolean hasHook(EventKind kind) {
    return hooks.get(kind) != null;
  }

  /**
   * Whether this extension handles habits of the given type.
   */
  public boolean supports(String habitType) {
    return supportedTypes.contains(ALL_TYPES) || supportedTypes.contains(habitType);
  }

  public Endpoint endpoint(String endpointName) {
    return endpoints.get(endpointName);
  }

  static Set<String> normalizeTypes(Collection<String> types) {
    if (types == null || types.isEmpty()) {
      return Set.of(ALL_TYPES);
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(types));
  }

  // EnumMap keeps kind order and tolerates null values, which the registry reports.
  private static Map<EventKind, Hook<?>> copyHooks(Map<EventKind, Hook<?>> hooks) {
    if (hooks == null || hooks.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new EnumMap<>(hooks));
  }
}
