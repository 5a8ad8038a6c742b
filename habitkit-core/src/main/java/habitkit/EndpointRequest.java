package habitkit;

import habitkit.util.JsonValues;

import java.util.Map;

/**
 * Arguments passed to an {@link Endpoint}.
 *
 * @param habitId target habit, may be {@code null}
 * @param userId  calling user, may be {@code null}
 * @param params  free-form parameters
 */
public record EndpointRequest(String habitId, String userId, Map<String, Object> params) {

  public EndpointRequest {
    params = JsonValues.immutableCopy(params);
  }

  public static EndpointRequest of(String habitId, String userId) {
    return new EndpointRequest(habitId, userId, Map.of());
  }

  public Object param(String name) {
    return params.get(name);
  }
}
