package habitkit.merge;

import habitkit.HookResult;

import java.util.Objects;

/**
 * A hook result tagged with the extension that produced it.
 */
public record ExtensionResult(String extensionName, HookResult result) {

  public ExtensionResult {
    Objects.requireNonNull(extensionName, "extensionName");
    result = result == null ? HookResult.NO_UPDATE : result;
  }
}
