package habitkit.health;

import habitkit.ExtensionException;

/**
 * Failure of one extension's health check. Reported only as an unhealthy status.
 */
public final class HealthCheckException extends ExtensionException {
  private final String extensionName;

  public HealthCheckException(String extensionName, String message, Throwable cause) {
    super(message, cause);
    this.extensionName = extensionName;
  }

  public String extensionName() {
    return extensionName;
  }
}
