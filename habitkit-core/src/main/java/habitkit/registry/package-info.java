/**
 * Extension catalog.
 *
 * <p>{@link habitkit.registry.ExtensionRegistry} resolves extensions by habit type in
 * registration order. Registration is append-only and happens at startup.
 *
 * @see habitkit.registry.DefaultExtensionRegistry
 */
package habitkit.registry;
