package habitkit.dispatch;

import habitkit.EventKind;
import habitkit.ExtensionDescriptor;
import habitkit.HabitSnapshot;
import habitkit.Hook;
import habitkit.HookResult;
import habitkit.LifecycleEvent;
import habitkit.merge.ExtensionResult;
import habitkit.merge.IntegrationDocuments;
import habitkit.merge.IntegrationMerger;
import habitkit.merge.WriteSet;
import habitkit.registry.ExtensionRegistry;
import habitkit.spi.IntegrationStore;
import habitkit.spi.MetricsExporter;
import habitkit.util.TimedCall;
import habitkit.util.WorkerPools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous fan-out/fan-in of lifecycle events to registered extensions.
 *
 * <p>For each {@link #dispatch(LifecycleEvent)}:
 * <ol>
 *   <li>the per-habit lock is taken, so dispatches for one habit never interleave;</li>
 *   <li>the habit's integrations are reloaded from the store, if there is one;</li>
 *   <li>every extension that supports the habit's type and has a hook for the event's
 *       kind is invoked concurrently on the worker pool, which starts every hook
 *       immediately and never queues;</li>
 *   <li>each hook may run for {@code hookTimeoutMs}, counted from when it starts. Time
 *       spent waiting for the habit lock is not charged to any hook. A hook that throws
 *       or runs too long is logged and treated as returning no update; a late hook is
 *       interrupted;</li>
 *   <li>results are merged in registration order and applied to the store in one
 *       atomic step. For {@code DELETED} events the habit's records are removed instead.</li>
 * </ol>
 *
 * <p>Extension faults and store failures never propagate to the caller; they are
 * reported in the returned {@link DispatchOutcome}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for shutdown with a configurable drain timeout.
 *
 * @see EventDispatcher.Builder
 * @see habitkit.HabitEventPublisher
 */
public final class EventDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private final ExtensionRegistry registry;
  private final IntegrationMerger merger;
  private final IntegrationStore store;
  private final MetricsExporter metrics;
  private final List<DispatchInterceptor> interceptors;
  private final EntityLocks locks;
  private final ExecutorService workers;
  private final long hookTimeoutMs;
  private final long drainTimeoutMs;
  private final boolean removeOnDelete;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private EventDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.merger = builder.merger != null ? builder.merger : new IntegrationMerger();
    this.store = builder.store;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.locks = builder.locks != null ? builder.locks : new EntityLocks();
    this.removeOnDelete = builder.removeOnDelete;

    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.hookTimeoutMs <= 0) {
      throw new IllegalArgumentException("hookTimeoutMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.hookTimeoutMs = builder.hookTimeoutMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = WorkerPools.elastic(builder.workerCount, "habitkit-hook-");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches one event and blocks until every hook finished or hit the deadline and
   * the merged writes were applied.
   *
   * @param event the committed lifecycle event
   * @return what happened
   * @throws IllegalStateException if the dispatcher is closed
   */
  public DispatchOutcome dispatch(LifecycleEvent event) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      throw new IllegalStateException("Dispatcher is closed");
    }
    EventKind kind = event.kind();
    long start = System.nanoTime();
    metrics.incrementDispatch(kind);
    try (EntityLocks.Permit ignored = locks.acquire(event.habit().id())) {
      LifecycleEvent current = refresh(event);
      int completedBefore = runBeforeDispatch(current);
      DispatchOutcome outcome = null;
      RuntimeException error = null;
      try {
        outcome = dispatchLocked(current);
        return outcome;
      } catch (RuntimeException e) {
        error = e;
        throw e;
      } finally {
        runAfterDispatch(current, outcome, error, completedBefore);
      }
    } finally {
      metrics.recordDispatchDurationMs(kind, elapsedMs(start));
    }
  }

  /**
   * Dispatches events one after another, in list order.
   */
  public List<DispatchOutcome> dispatchAll(List<? extends LifecycleEvent> events) {
    List<DispatchOutcome> outcomes = new ArrayList<>(events.size());
    for (LifecycleEvent event : events) {
      outcomes.add(dispatch(event));
    }
    return outcomes;
  }

  private LifecycleEvent refresh(LifecycleEvent event) {
    if (store == null) {
      return event;
    }
    HabitSnapshot habit = event.habit();
    try {
      return event.withHabit(habit.withIntegrations(store.load(habit.id())));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to load integrations for habit " + habit.id()
          + "; hooks see the event snapshot", e);
      return event;
    }
  }

  private DispatchOutcome dispatchLocked(LifecycleEvent event) {
    HabitSnapshot habit = event.habit();
    EventKind kind = event.kind();

    List<Invocation> invocations = new ArrayList<>();
    for (ExtensionDescriptor descriptor : registry.resolve(habit.type())) {
      Hook<?> hook = descriptor.hook(kind);
      if (hook != null) {
        Hook<LifecycleEvent> typed = castHook(hook);
        invocations.add(new Invocation(descriptor.name(),
            TimedCall.submit(workers, () -> typed.handle(event))));
      }
    }

    List<HookOutcome> hookOutcomes = new ArrayList<>(invocations.size());
    List<ExtensionResult> results = new ArrayList<>();
    for (Invocation invocation : invocations) {
      HookOutcome outcome = await(invocation, kind, habit.id());
      hookOutcomes.add(outcome);
      if (outcome.status() == HookOutcome.Status.SUCCESS) {
        results.add(new ExtensionResult(invocation.extensionName, outcome.result()));
      }
    }

    WriteSet writeSet = merger.merge(habit.id(), results);
    for (String rejected : writeSet.rejected().keySet()) {
      metrics.incrementMergeRejected(rejected);
    }

    boolean applied = false;
    String applyError = null;
    Map<String, Map<String, Object>> integrations;
    if (kind == EventKind.DELETED && removeOnDelete) {
      integrations = Map.of();
      if (store != null) {
        try {
          store.removeAll(habit.id());
          applied = true;
        } catch (RuntimeException e) {
          applyError = describe(e);
          metrics.incrementApplyFailure();
          logger.log(Level.SEVERE, "Failed to remove integrations of deleted habit " + habit.id(), e);
        }
      }
    } else if (store != null) {
      try {
        integrations = store.apply(writeSet);
        applied = true;
      } catch (RuntimeException e) {
        integrations = habit.integrations();
        applyError = describe(e);
        metrics.incrementApplyFailure();
        logger.log(Level.SEVERE, "Failed to apply " + writeSet.writes().size()
            + " integration writes for habit " + habit.id() + ", event " + event.eventId(), e);
      }
    } else {
      integrations = IntegrationDocuments.apply(habit.integrations(), writeSet);
    }

    return new DispatchOutcome(event.eventId(), kind, habit.id(), hookOutcomes, writeSet,
        applied, applyError, integrations);
  }

  private HookOutcome await(Invocation invocation, EventKind kind, String habitId) {
    String name = invocation.extensionName;
    TimedCall<HookResult> call = invocation.call;
    try {
      HookResult result = call.await(hookTimeoutMs);
      long durationMs = call.durationMs();
      metrics.incrementHookSuccess(name);
      metrics.recordHookDurationMs(name, durationMs);
      if (result == null || result == HookResult.NO_UPDATE) {
        return new HookOutcome(name, HookOutcome.Status.NO_UPDATE, HookResult.NO_UPDATE, null, durationMs);
      }
      return new HookOutcome(name, HookOutcome.Status.SUCCESS, result, null, durationMs);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      HookExecutionException failure = new HookExecutionException(name, kind,
          "Hook " + kind.hookName() + " of extension " + name + " failed: " + cause, cause);
      logger.log(Level.WARNING, "Extension " + name + " failed on " + kind.hookName()
          + " for habit " + habitId, failure);
      long durationMs = call.durationMs();
      metrics.incrementHookFailure(name);
      metrics.recordHookDurationMs(name, durationMs);
      return new HookOutcome(name, HookOutcome.Status.FAILED, HookResult.NO_UPDATE, failure, durationMs);
    } catch (TimeoutException e) {
      long durationMs = call.runningMs();
      call.cancel();
      HookExecutionException failure = new HookExecutionException(name, kind,
          "Hook " + kind.hookName() + " of extension " + name + " timed out after " + hookTimeoutMs + " ms", e);
      logger.log(Level.WARNING, "Extension " + name + " timed out on " + kind.hookName()
          + " for habit " + habitId + " after " + hookTimeoutMs + " ms");
      metrics.incrementHookTimeout(name);
      return new HookOutcome(name, HookOutcome.Status.TIMED_OUT, HookResult.NO_UPDATE, failure, durationMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      long durationMs = call.runningMs();
      call.cancel();
      HookExecutionException failure = new HookExecutionException(name, kind,
          "Dispatch interrupted while waiting for extension " + name, e);
      metrics.incrementHookFailure(name);
      return new HookOutcome(name, HookOutcome.Status.FAILED, HookResult.NO_UPDATE, failure, durationMs);
    }
  }

  private int runBeforeDispatch(LifecycleEvent event) {
    int completed = 0;
    for (DispatchInterceptor interceptor : interceptors) {
      try {
        interceptor.beforeDispatch(event);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Interceptor beforeDispatch failed", e);
      }
      completed++;
    }
    return completed;
  }

  private void runAfterDispatch(LifecycleEvent event, DispatchOutcome outcome, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(event, outcome, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static Hook<LifecycleEvent> castHook(Hook<?> hook) {
    // hooks are keyed by kind, and each kind has exactly one event record type
    return (Hook<LifecycleEvent>) hook;
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  /**
   * Stops accepting events, waits up to the drain timeout for running hooks, then
   * interrupts whatever is left.
   */
  @Override
  public void close() {
    accepting.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting running hooks");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Invocation(String extensionName, TimedCall<HookResult> call) {}

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private ExtensionRegistry registry;
    private IntegrationMerger merger;
    private IntegrationStore store;
    private MetricsExporter metrics;
    private EntityLocks locks;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();
    private int workerCount = 4;
    private long hookTimeoutMs = 5000;
    private long drainTimeoutMs = 5000;
    private boolean removeOnDelete = true;

    private Builder() {}

    /**
     * Sets the registry that resolves extensions by habit type.
     *
     * <p><b>Required.</b>
     *
     * @param registry the extension registry
     * @return this builder
     */
    public Builder registry(ExtensionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the merger. Optional. Defaults to {@link IntegrationMerger}.
     */
    public Builder merger(IntegrationMerger merger) {
      this.merger = merger;
      return this;
    }

    /**
     * Sets the store that integrations are loaded from and written to.
     *
     * <p>Optional. Without a store, hooks see the integrations carried by the event and
     * the caller persists {@link DispatchOutcome#integrations()} itself.
     *
     * @param store the integration store
     * @return this builder
     */
    public Builder store(IntegrationStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Shares a lock table with other components. Optional. Defaults to a private one.
     */
    public Builder locks(EntityLocks locks) {
      this.locks = locks;
      return this;
    }

    /**
     * Adds an interceptor. Interceptors run in the order added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<DispatchInterceptor> interceptors) {
      for (DispatchInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the number of hook threads kept alive while idle.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1. The pool grows beyond this
     * when more hooks run at once, so hooks never wait for a free thread.
     *
     * @param workerCount number of idle hook threads kept
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long each hook may run, counted from when it starts.
     *
     * <p>Optional. Defaults to {@code 5000}. Must be &gt; 0.
     *
     * @param hookTimeoutMs deadline in milliseconds
     * @return this builder
     */
    public Builder hookTimeoutMs(long hookTimeoutMs) {
      this.hookTimeoutMs = hookTimeoutMs;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for running hooks.
     *
     * <p>Optional. Defaults to {@code 5000}. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Whether a {@code DELETED} event removes all stored integrations of the habit.
     *
     * <p>Optional. Defaults to {@code true}. When {@code false}, writes returned by
     * deletion hooks are applied like any other.
     *
     * @param removeOnDelete remove records on deletion
     * @return this builder
     */
    public Builder removeOnDelete(boolean removeOnDelete) {
      this.removeOnDelete = removeOnDelete;
      return this;
    }

    /**
     * Builds the dispatcher and starts its worker pool.
     *
     * @return the dispatcher
     * @throws NullPointerException if no registry was set
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
