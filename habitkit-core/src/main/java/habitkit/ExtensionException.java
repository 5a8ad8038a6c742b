package habitkit;

/**
 * Base class of every failure raised by the extension subsystem.
 */
public class ExtensionException extends RuntimeException {

  public ExtensionException(String message) {
    super(message);
  }

  public ExtensionException(String message, Throwable cause) {
    super(message, cause);
  }
}
