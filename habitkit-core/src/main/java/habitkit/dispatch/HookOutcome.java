package habitkit.dispatch;

import habitkit.HookResult;

import java.util.Objects;

/**
 * What happened to one hook during a dispatch.
 *
 * @param extensionName the extension
 * @param status        how the invocation ended
 * @param result        the returned result; {@link HookResult#NO_UPDATE} unless {@code SUCCESS}
 * @param failure       the failure for {@code FAILED} and {@code TIMED_OUT}, otherwise {@code null}
 * @param durationMs    time spent in the hook, or until the deadline for timeouts
 */
public record HookOutcome(
    String extensionName,
    Status status,
    HookResult result,
    HookExecutionException failure,
    long durationMs
) {

  public enum Status {
    /** Returned a Seed or Patch. */
    SUCCESS,
    /** Returned no update. */
    NO_UPDATE,
    FAILED,
    TIMED_OUT
  }

  public HookOutcome {
    Objects.requireNonNull(extensionName, "extensionName");
    Objects.requireNonNull(status, "status");
    result = result == null ? HookResult.NO_UPDATE : result;
  }

  public String error() {
    if (failure == null) {
      return null;
    }
    Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
  }

  public boolean failed() {
    return status == Status.FAILED || status == Status.TIMED_OUT;
  }
}
