package habitkit;

/**
 * Thrown when an extension name is registered twice.
 */
public final class DuplicateExtensionException extends RegistrationException {

  public DuplicateExtensionException(String extensionName) {
    super(extensionName, "Extension already registered: " + extensionName);
  }
}
