package habitkit;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fluent construction of {@link ExtensionDescriptor}s.
 *
 * <pre>{@code
 * ExtensionBuilder builder = ExtensionBuilder.named("moodTracker");
 * DataManager data = builder.dataManager();
 * ExtensionDescriptor mood = builder
 *     .setMetadata(Map.of("description", "Track mood levels", "author", "Habits Team"))
 *     .onCreated(event -> data.createInitialData(Map.of("moodHistory", List.of())))
 *     .onCompleted(event -> data.patch().set("lastMood", 7).touch().build())
 *     .withHealthCheck(HealthStatus::healthy)
 *     .build();
 * }</pre>
 *
 * <p>Defaults: version {@code 1.0.0}, empty description, types {@code {"all"}}. Hooks are
 * stored as given; the dispatcher is responsible for isolating their failures, so a
 * descriptor built here behaves exactly like an equivalent one built by hand.
 */
public final class ExtensionBuilder {
  public static final String DEFAULT_VERSION = "1.0.0";

  private String name;
  private String version = DEFAULT_VERSION;
  private String description = "";
  private final Map<String, String> metadata = new LinkedHashMap<>();
  private Set<String> supportedTypes = Set.of(ExtensionDescriptor.ALL_TYPES);
  private final Map<EventKind, Hook<?>> hooks = new EnumMap<>(EventKind.class);
  private Map<String, Object> config = Map.of();
  private final Map<String, Endpoint> endpoints = new LinkedHashMap<>();
  private HealthCheck healthCheck;
  private Clock clock = Clock.systemUTC();

  private ExtensionBuilder(String name) {
    this.name = name;
  }

  public static ExtensionBuilder named(String name) {
    return new ExtensionBuilder(name);
  }

  /**
   * Applies metadata. The keys {@code name}, {@code version} and {@code description}
   * set the corresponding descriptor fields; every other key is kept as string metadata.
   */
  public ExtensionBuilder setMetadata(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    values.forEach((key, value) -> {
      String text = value == null ? null : String.valueOf(value);
      switch (key) {
        case "name" -> this.name = text;
        case "version" -> this.version = text;
        case "description" -> this.description = text;
        default -> this.metadata.put(key, text);
      }
    });
    return this;
  }

  public ExtensionBuilder version(String version) {
    this.version = version;
    return this;
  }

  public ExtensionBuilder description(String description) {
    this.description = description;
    return this;
  }

  public ExtensionBuilder forTypes(String... types) {
    return forTypes(Arrays.asList(types));
  }

  public ExtensionBuilder forTypes(Collection<String> types) {
    this.supportedTypes = new LinkedHashSet<>(types);
    return this;
  }

  public ExtensionBuilder withConfig(Map<String, ?> config) {
    this.config = config == null ? Map.of() : new LinkedHashMap<>(config);
    return this;
  }

  public ExtensionBuilder onCreated(Hook<LifecycleEvent.Created> hook) {
    return on(EventKind.CREATED, hook);
  }

  public ExtensionBuilder onCompleted(Hook<LifecycleEvent.Completed> hook) {
    return on(EventKind.COMPLETED, hook);
  }

  public ExtensionBuilder onUpdated(Hook<LifecycleEvent.Updated> hook) {
    return on(EventKind.UPDATED, hook);
  }

  public ExtensionBuilder onDeleted(Hook<LifecycleEvent.Deleted> hook) {
    return on(EventKind.DELETED, hook);
  }

  public ExtensionBuilder onProgressUpdated(Hook<LifecycleEvent.ProgressUpdated> hook) {
    return on(EventKind.PROGRESS_UPDATED, hook);
  }

  public ExtensionBuilder onStreakAchieved(Hook<LifecycleEvent.StreakAchieved> hook) {
    return on(EventKind.STREAK_ACHIEVED, hook);
  }

  public ExtensionBuilder addEndpoint(String endpointName, Endpoint endpoint) {
    Objects.requireNonNull(endpointName, "endpointName");
    endpoints.put(endpointName, endpoint);
    return this;
  }

  public ExtensionBuilder withHealthCheck(HealthCheck healthCheck) {
    this.healthCheck = healthCheck;
    return this;
  }

  /**
   * Clock used by {@link #dataManager()} for {@code createdAt}/{@code lastUpdated}.
   */
  public ExtensionBuilder clock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    return this;
  }

  /**
   * Returns a data manager bound to this extension's namespace.
   *
   * @throws RegistrationException if the builder has no name
   */
  public DataManager dataManager() {
    return new DataManager(requireName(), clock);
  }

  /**
   * Builds the descriptor. Further validation happens on registration.
   *
   * @throws RegistrationException if no name was set
   */
  public ExtensionDescriptor build() {
    return new ExtensionDescriptor(
        requireName(),
        version,
        description,
        metadata,
        supportedTypes,
        hooks,
        config,
        endpoints,
        healthCheck);
  }

  private ExtensionBuilder on(EventKind kind, Hook<?> hook) {
    hooks.put(kind, hook);
    return this;
  }

  private String requireName() {
    if (name == null || name.isBlank()) {
      throw new RegistrationException(null, "Extension name is required");
    }
    return name;
  }
}
