package habitkit.jdbc;

import habitkit.ExtensionException;

/**
 * Unchecked exception wrapping JDBC and encoding errors raised by the JDBC integration
 * stores. The dispatcher reports it in the dispatch outcome instead of failing the caller.
 */
public final class IntegrationStoreException extends ExtensionException {
  public IntegrationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
