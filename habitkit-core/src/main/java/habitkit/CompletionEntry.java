package habitkit;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day's tracking entry for a habit.
 *
 * @param date         the tracked day
 * @param completed    whether the habit counts as done for that day
 * @param currentValue progress value for count/time habits, may be {@code null}
 */
public record CompletionEntry(LocalDate date, boolean completed, Double currentValue) {

  public CompletionEntry {
    Objects.requireNonNull(date, "date");
  }

  public static CompletionEntry completed(LocalDate date) {
    return new CompletionEntry(date, true, null);
  }

  public static CompletionEntry progress(LocalDate date, double currentValue, boolean completed) {
    return new CompletionEntry(date, completed, currentValue);
  }
}
