package habitkit.registry;

import habitkit.DuplicateExtensionException;
import habitkit.EventKind;
import habitkit.ExtensionDescriptor;
import habitkit.Hook;
import habitkit.RegistrationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe {@link ExtensionRegistry}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExtensionRegistry registry = new DefaultExtensionRegistry()
 *     .register(streakTracker)
 *     .register(ExtensionBuilder.named("moodTracker")
 *         .onCompleted(event -> recordMood(event))
 *         .build());
 * }</pre>
 *
 * <h2>Validation</h2>
 * <p>A descriptor is rejected when its name is blank or contains {@code '.'} (names are
 * path segments under {@code integrations}), its version is blank, a supported type is
 * blank, or a declared hook or endpoint is {@code null}. A rejected descriptor leaves
 * the registry unchanged.
 *
 * <h2>Thread Safety</h2>
 * <p>Registrations are serialized; lookups never block and return immutable snapshots.
 */
public final class DefaultExtensionRegistry implements ExtensionRegistry {
  private static final Logger logger = Logger.getLogger(DefaultExtensionRegistry.class.getName());
  /** Width of the {@code extension_name} column. */
  static final int MAX_NAME_LENGTH = 128;

  private final Map<String, ExtensionDescriptor> byName = new ConcurrentHashMap<>();
  private volatile List<ExtensionDescriptor> ordered = List.of();

  @Override
  public synchronized DefaultExtensionRegistry register(ExtensionDescriptor descriptor) {
    validate(descriptor);
    if (byName.containsKey(descriptor.name())) {
      throw new DuplicateExtensionException(descriptor.name());
    }
    List<ExtensionDescriptor> next = new ArrayList<>(ordered);
    next.add(descriptor);
    byName.put(descriptor.name(), descriptor);
    ordered = Collections.unmodifiableList(next);
    logger.info("Registered extension " + descriptor.name() + " v" + descriptor.version()
        + " types=" + descriptor.supportedTypes() + " hooks=" + descriptor.hooks().keySet());
    return this;
  }

  @Override
  public List<ExtensionDescriptor> resolve(String habitType) {
    List<ExtensionDescriptor> result = new ArrayList<>();
    for (ExtensionDescriptor descriptor : ordered) {
      if (descriptor.supports(habitType)) {
        result.add(descriptor);
      }
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public Optional<ExtensionDescriptor> get(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
  }

  @Override
  public List<ExtensionDescriptor> all() {
    return ordered;
  }

  @Override
  public int size() {
    return ordered.size();
  }

  @Override
  public RegistryStats stats() {
    List<ExtensionDescriptor> snapshot = ordered;
    Map<String, Integer> byType = new TreeMap<>();
    for (ExtensionDescriptor descriptor : snapshot) {
      for (String type : descriptor.supportedTypes()) {
        byType.merge(type, 1, Integer::sum);
      }
    }
    return new RegistryStats(snapshot.size(), byType);
  }

  private static void validate(ExtensionDescriptor descriptor) {
    if (descriptor == null) {
      throw new RegistrationException(null, "Extension descriptor is required");
    }
    String name = descriptor.name();
    if (name == null || name.isBlank()) {
      throw new RegistrationException(name, "Extension name is required");
    }
    if (name.length() > MAX_NAME_LENGTH) {
      throw new RegistrationException(name, "Extension name must be at most " + MAX_NAME_LENGTH
          + " characters, got " + name.length());
    }
    if (name.indexOf('.') >= 0) {
      throw new RegistrationException(name, "Extension name must not contain '.': " + name);
    }
    if (descriptor.version() == null || descriptor.version().isBlank()) {
      throw new RegistrationException(name, "Extension " + name + " has no version");
    }
    for (String type : descriptor.supportedTypes()) {
      if (type == null || type.isBlank()) {
        throw new RegistrationException(name, "Extension " + name + " declares a blank habit type");
      }
    }
    for (Map.Entry<EventKind, Hook<?>> hook : descriptor.hooks().entrySet()) {
      if (hook.getValue() == null) {
        throw new RegistrationException(name,
            "Extension " + name + " hook " + hook.getKey().hookName() + " is not callable");
      }
    }
    descriptor.endpoints().forEach((endpointName, endpoint) -> {
      if (endpointName == null || endpointName.isBlank() || endpoint == null) {
        throw new RegistrationException(name,
            "Extension " + name + " endpoint " + endpointName + " is not callable");
      }
    });
  }
}
