package habitkit;

import java.util.Objects;

/**
 * Lifecycle event kinds an extension can hook into.
 *
 * <p>Each kind has a stable hook name (e.g. {@code onHabitCompleted}) used in logs,
 * metrics tags and registry listings.
 */
public enum EventKind {
  CREATED("onHabitCreated"),
  COMPLETED("onHabitCompleted"),
  UPDATED("onHabitUpdated"),
  DELETED("onHabitDeleted"),
  PROGRESS_UPDATED("onProgressUpdated"),
  STREAK_ACHIEVED("onStreakAchieved");

  private final String hookName;

  EventKind(String hookName) {
    this.hookName = hookName;
  }

  public String hookName() {
    return hookName;
  }

  /**
   * Looks up a kind by its hook name.
   *
   * @param hookName hook name such as {@code onHabitCreated}
   * @return the matching kind
   * @throws IllegalArgumentException if no kind uses that hook name
   */
  public static EventKind fromHookName(String hookName) {
    Objects.requireNonNull(hookName, "hookName");
    for (EventKind kind : values()) {
      if (kind.hookName.equals(hookName)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown hook name: " + hookName);
  }
}
