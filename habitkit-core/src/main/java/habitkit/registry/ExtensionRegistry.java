package habitkit.registry;

import habitkit.Endpoint;
import habitkit.ExtensionDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Append-only catalog of registered extensions.
 *
 * <p>Built once at startup and handed to the dispatcher, the health aggregator and any
 * HTTP layer. There is no removal.
 *
 * @see DefaultExtensionRegistry
 */
public interface ExtensionRegistry {

  /**
   * Registers a descriptor.
   *
   * @param descriptor the extension to add
   * @return this registry for chaining
   * @throws habitkit.DuplicateExtensionException if the name is already registered
   * @throws habitkit.RegistrationException if the descriptor is invalid
   */
  ExtensionRegistry register(ExtensionDescriptor descriptor);

  /**
   * Returns every extension that handles habits of the given type, that is, whose
   * supported types contain {@code "all"} or {@code habitType}.
   *
   * @param habitType the habit's type tag
   * @return immutable list in registration order, may be empty
   */
  List<ExtensionDescriptor> resolve(String habitType);

  Optional<ExtensionDescriptor> get(String name);

  /** Immutable snapshot of all extensions in registration order. */
  List<ExtensionDescriptor> all();

  int size();

  RegistryStats stats();

  /**
   * Looks up a named endpoint of a named extension.
   *
   * @return the endpoint, or empty if either name is unknown
   */
  default Optional<Endpoint> endpoint(String extensionName, String endpointName) {
    return get(extensionName).map(descriptor -> descriptor.endpoint(endpointName));
  }
}
