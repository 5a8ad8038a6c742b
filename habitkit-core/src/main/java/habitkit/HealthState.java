package habitkit;

import java.util.Locale;

/**
 * Health states ordered by severity.
 */
public enum HealthState {
  HEALTHY,
  DEGRADED,
  UNHEALTHY;

  /** Lowercase name used in health reports. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static HealthState worst(HealthState a, HealthState b) {
    return a.ordinal() >= b.ordinal() ? a : b;
  }

  /**
   * Parses a state case-insensitively.
   *
   * @throws IllegalArgumentException for an unknown label
   */
  public static HealthState fromLabel(String label) {
    return valueOf(label.trim().toUpperCase(Locale.ROOT));
  }
}
