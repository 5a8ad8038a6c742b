package habitkit.health;

import habitkit.HealthState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated health of all registered extensions.
 *
 * @param overall    worst state across all extensions, {@code HEALTHY} when there are none
 * @param extensions per-extension health in registration order
 * @param checkedAt  when aggregation finished
 */
public record HealthReport(HealthState overall, Map<String, ExtensionHealth> extensions, Instant checkedAt) {

  public HealthReport {
    Objects.requireNonNull(overall, "overall");
    Objects.requireNonNull(checkedAt, "checkedAt");
    extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  /**
   * Renders the report in its external form:
   * {@code {overall, checkedAt, extensions: {name: {status, error?, checkedAt, details?}}}}
   * with lowercase status labels and ISO-8601 timestamps.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> perExtension = new LinkedHashMap<>();
    extensions.forEach((name, health) -> {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("status", health.state().label());
      if (health.error() != null) {
        entry.put("error", health.error());
      }
      entry.put("checkedAt", health.checkedAt().toString());
      if (!health.details().isEmpty()) {
        entry.put("details", health.details());
      }
      perExtension.put(name, entry);
    });
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("overall", overall.label());
    map.put("checkedAt", checkedAt.toString());
    map.put("extensions", perExtension);
    return map;
  }
}
