package habitkit;

import habitkit.util.JsonValues;

import java.util.Map;
import java.util.Objects;

/**
 * Result of a {@link HealthCheck}.
 *
 * @param state   reported state
 * @param error   error message, {@code null} when healthy
 * @param details extra diagnostic values
 */
public record HealthStatus(HealthState state, String error, Map<String, Object> details) {

  public HealthStatus {
    Objects.requireNonNull(state, "state");
    details = JsonValues.immutableCopy(details);
  }

  public static HealthStatus healthy() {
    return new HealthStatus(HealthState.HEALTHY, null, Map.of());
  }

  public static HealthStatus healthy(Map<String, ?> details) {
    return new HealthStatus(HealthState.HEALTHY, null, JsonValues.immutableCopy(details));
  }

  public static HealthStatus degraded(String error) {
    return new HealthStatus(HealthState.DEGRADED, error, Map.of());
  }

  public static HealthStatus unhealthy(String error) {
    return new HealthStatus(HealthState.UNHEALTHY, error, Map.of());
  }
}
