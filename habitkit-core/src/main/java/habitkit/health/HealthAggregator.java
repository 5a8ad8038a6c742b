package habitkit.health;

import habitkit.ExtensionDescriptor;
import habitkit.HealthCheck;
import habitkit.HealthState;
import habitkit.HealthStatus;
import habitkit.registry.ExtensionRegistry;
import habitkit.spi.MetricsExporter;
import habitkit.util.TimedCall;
import habitkit.util.WorkerPools;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every extension's {@link HealthCheck} concurrently and aggregates the results.
 *
 * <p>An extension without a check is healthy. A check that throws, returns {@code null}
 * or runs longer than the timeout makes that extension unhealthy and leaves the others
 * unaffected. Every check starts immediately and its timeout counts from its own start,
 * so a slow check never eats into another one's allowance. The overall state is the
 * worst one observed.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class HealthAggregator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthAggregator.class.getName());

  private final ExtensionRegistry registry;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long timeoutMs;
  private final ExecutorService workers;

  private HealthAggregator(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0");
    }
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    this.timeoutMs = builder.timeoutMs;
    this.workers = WorkerPools.elastic(builder.workerCount, "habitkit-health-");
  }

  public static Builder builder() {
    return new Builder();
  }

  public HealthReport checkAll() {
    Map<String, TimedCall<HealthStatus>> pending = new LinkedHashMap<>();
    Map<String, ExtensionHealth> results = new LinkedHashMap<>();
    for (ExtensionDescriptor descriptor : registry.all()) {
      HealthCheck check = descriptor.healthCheck();
      if (check != null) {
        pending.put(descriptor.name(), TimedCall.submit(workers, check::check));
      }
      results.put(descriptor.name(), null);
    }

    HealthState overall = HealthState.HEALTHY;
    for (Map.Entry<String, ExtensionHealth> entry : results.entrySet()) {
      String name = entry.getKey();
      TimedCall<HealthStatus> call = pending.get(name);
      ExtensionHealth health = call == null
          ? new ExtensionHealth(HealthState.HEALTHY, null, Instant.now(clock), Map.of())
          : await(name, call);
      entry.setValue(health);
      metrics.recordExtensionHealth(name, health.state());
      overall = HealthState.worst(overall, health.state());
    }
    return new HealthReport(overall, results, Instant.now(clock));
  }

  /**
   * Checks a single extension.
   *
   * @return its health, or empty if no extension has that name
   */
  public Optional<ExtensionHealth> check(String extensionName) {
    return registry.get(extensionName).map(descriptor -> {
      HealthCheck check = descriptor.healthCheck();
      ExtensionHealth health = check == null
          ? new ExtensionHealth(HealthState.HEALTHY, null, Instant.now(clock), Map.of())
          : await(extensionName, TimedCall.submit(workers, check::check));
      metrics.recordExtensionHealth(extensionName, health.state());
      return health;
    });
  }

  private ExtensionHealth await(String name, TimedCall<HealthStatus> call) {
    try {
      HealthStatus status = call.await(timeoutMs);
      if (status == null) {
        return ExtensionHealth.unhealthy("Health check returned no status", Instant.now(clock));
      }
      return new ExtensionHealth(status.state(), status.error(), Instant.now(clock), status.details());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
      logger.log(Level.WARNING, "Health check of extension " + name + " failed",
          new HealthCheckException(name, message, cause));
      return ExtensionHealth.unhealthy(message, Instant.now(clock));
    } catch (TimeoutException e) {
      call.cancel();
      logger.log(Level.WARNING, "Health check of extension " + name + " timed out after " + timeoutMs + " ms");
      return ExtensionHealth.unhealthy("Health check timed out after " + timeoutMs + " ms", Instant.now(clock));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel();
      return ExtensionHealth.unhealthy("Health check interrupted", Instant.now(clock));
    }
  }

  @Override
  public void close() {
    workers.shutdownNow();
  }

  /** Builder for {@link HealthAggregator}. */
  public static final class Builder {
    private ExtensionRegistry registry;
    private MetricsExporter metrics;
    private Clock clock;
    private long timeoutMs = 2000;
    private int workerCount = 2;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder registry(ExtensionRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * How long each check may run, counted from its own start. Defaults to {@code 2000}.
     */
    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    /** Check threads kept alive while idle; the pool grows past this. Defaults to {@code 2}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public HealthAggregator build() {
      return new HealthAggregator(this);
    }
  }
}
