package habitkit.dispatch;

import habitkit.EventKind;
import habitkit.ExtensionException;

/**
 * Failure of one hook invocation, either thrown by the hook or raised because the hook
 * overran its deadline. Never propagated to the dispatch caller.
 */
public final class HookExecutionException extends ExtensionException {
  private final String extensionName;
  private final EventKind kind;

  public HookExecutionException(String extensionName, EventKind kind, String message, Throwable cause) {
    super(message, cause);
    this.extensionName = extensionName;
    this.kind = kind;
  }

  public String extensionName() {
    return extensionName;
  }

  public EventKind kind() {
    return kind;
  }
}
