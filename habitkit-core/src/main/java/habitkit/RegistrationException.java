package habitkit;

/**
 * Thrown when a descriptor cannot be built or registered. Fatal at startup.
 */
public class RegistrationException extends ExtensionException {
  private final String extensionName;

  public RegistrationException(String extensionName, String message) {
    super(message);
    this.extensionName = extensionName;
  }

  /** Name of the offending extension, or {@code null} if it had none. */
  public String extensionName() {
    return extensionName;
  }
}
