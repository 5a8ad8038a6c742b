package habitkit.micrometer;

import habitkit.EventKind;
import habitkit.HealthState;
import habitkit.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are tagged with {@code kind} (the event's hook name) or {@code extension}
 * and registered lazily the first time a tag value is seen.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code habitkit.dispatch.total}: dispatched events, by kind</li>
 *   <li>{@code habitkit.hook.success}: hooks that returned normally, by extension</li>
 *   <li>{@code habitkit.hook.failure}: hooks that threw, by extension</li>
 *   <li>{@code habitkit.hook.timeout}: hooks cancelled at the deadline, by extension</li>
 *   <li>{@code habitkit.merge.rejected}: results dropped by the merger, by extension</li>
 *   <li>{@code habitkit.apply.failure}: write sets the store failed to apply</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code habitkit.dispatch.duration}: whole dispatch, by kind</li>
 *   <li>{@code habitkit.hook.duration}: single hook, by extension</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code habitkit.extension.health}: latest health per extension:
 *       0 healthy, 1 degraded, 2 unhealthy</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter applyFailure;
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> healthValues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "habitkit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "habitkit");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "coach.habitkit"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.applyFailure = Counter.builder(namePrefix + ".apply.failure")
        .description("Write sets the integration store failed to apply")
        .register(registry);
  }

  @Override
  public void incrementDispatch(EventKind kind) {
    if (closed) return;
    counter("dispatch.total", "kind", kind.hookName(), "Dispatched lifecycle events").increment();
  }

  @Override
  public void incrementHookSuccess(String extensionName) {
    if (closed) return;
    counter("hook.success", "extension", extensionName, "Hooks that returned normally").increment();
  }

  @Override
  public void incrementHookFailure(String extensionName) {
    if (closed) return;
    counter("hook.failure", "extension", extensionName, "Hooks that threw").increment();
  }

  @Override
  public void incrementHookTimeout(String extensionName) {
    if (closed) return;
    counter("hook.timeout", "extension", extensionName, "Hooks cancelled at the deadline").increment();
  }

  @Override
  public void incrementMergeRejected(String extensionName) {
    if (closed) return;
    counter("merge.rejected", "extension", extensionName, "Hook results dropped by the merger").increment();
  }

  @Override
  public void incrementApplyFailure() {
    if (closed) return;
    applyFailure.increment();
  }

  @Override
  public void recordDispatchDurationMs(EventKind kind, long durationMs) {
    if (closed) return;
    timer("dispatch.duration", "kind", kind.hookName(), "Dispatch wall time")
        .record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordHookDurationMs(String extensionName, long durationMs) {
    if (closed) return;
    timer("hook.duration", "extension", extensionName, "Hook execution time")
        .record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordExtensionHealth(String extensionName, HealthState state) {
    if (closed) return;
    AtomicInteger value = healthValues.computeIfAbsent(extensionName, name -> {
      AtomicInteger holder = new AtomicInteger();
      Gauge gauge = Gauge.builder(namePrefix + ".extension.health", holder, AtomicInteger::get)
          .description("Latest health per extension: 0 healthy, 1 degraded, 2 unhealthy")
          .tag("extension", name)
          .register(registry);
      meters.put("extension.health|" + name, gauge);
      return holder;
    });
    value.set(healthCode(state));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the dispatcher is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> all = new ArrayList<>(meters.values());
    all.add(applyFailure);
    RuntimeException first = null;
    for (Meter meter : all) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    healthValues.clear();
    if (first != null) throw first;
  }

  private Counter counter(String name, String tagKey, String tagValue, String description) {
    return (Counter) meters.computeIfAbsent(name + "|" + tagValue, k -> Counter.builder(namePrefix + "." + name)
        .description(description)
        .tag(tagKey, tagValue)
        .register(registry));
  }

  private Timer timer(String name, String tagKey, String tagValue, String description) {
    return (Timer) meters.computeIfAbsent(name + "|" + tagValue, k -> Timer.builder(namePrefix + "." + name)
        .description(description)
        .tag(tagKey, tagValue)
        .register(registry));
  }

  private static int healthCode(HealthState state) {
    return switch (state) {
      case HEALTHY -> 0;
      case DEGRADED -> 1;
      case UNHEALTHY -> 2;
    };
  }
}
