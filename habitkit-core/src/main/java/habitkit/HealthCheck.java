package habitkit;

/**
 * Liveness check of one extension. Throwing, returning {@code null} or overrunning the
 * aggregator's timeout all count as {@link HealthState#UNHEALTHY}.
 */
@FunctionalInterface
public interface HealthCheck {

  HealthStatus check() throws Exception;
}
