package habitkit;

/**
 * Supplies one extension descriptor. Extensions packaged as classes implement this so a
 * container can discover and register them.
 */
@FunctionalInterface
public interface ExtensionProvider {

  ExtensionDescriptor descriptor();
}
