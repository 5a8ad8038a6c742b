package habitkit.health;

import habitkit.HealthState;
import habitkit.util.JsonValues;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Health of one extension at one point in time.
 *
 * @param state     the state
 * @param error     error message, {@code null} when none
 * @param checkedAt when the check finished
 * @param details   diagnostic values returned by the check
 */
public record ExtensionHealth(HealthState state, String error, Instant checkedAt, Map<String, Object> details) {

  public ExtensionHealth {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(checkedAt, "checkedAt");
    details = JsonValues.immutableCopy(details);
  }

  static ExtensionHealth unhealthy(String error, Instant checkedAt) {
    return new ExtensionHealth(HealthState.UNHEALTHY, error, checkedAt, Map.of());
  }
}
