package habitkit.merge;

import habitkit.ExtensionException;

/**
 * Thrown when one extension's result cannot be turned into writes against its own
 * namespace. Only that extension's writes are dropped.
 */
public final class MergeException extends ExtensionException {
  private final String extensionName;

  public MergeException(String extensionName, String message) {
    super(message);
    this.extensionName = extensionName;
  }

  public MergeException(String extensionName, String message, Throwable cause) {
    super(message, cause);
    this.extensionName = extensionName;
  }

  public String extensionName() {
    return extensionName;
  }
}
