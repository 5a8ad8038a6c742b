package habitkit.util;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A task whose timeout runs from the moment a worker picks it up, not from submission.
 *
 * <p>Time spent waiting for a worker or for a lock held by the submitter is never
 * charged to the task. A task that is never picked up gets the same allowance counted
 * from submission, so {@link #await(long)} always returns.
 *
 * @param <T> the result type
 */
public final class TimedCall<T> implements Callable<T> {
  private final Callable<T> delegate;
  private final long submittedNanos;
  private volatile long startedNanos;
  private volatile boolean started;
  private volatile long durationMs;
  private Future<T> future;

  private TimedCall(Callable<T> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.submittedNanos = System.nanoTime();
  }

  /**
   * Submits {@code task} to {@code executor}.
   *
   * @return the handle to await the result with
   */
  public static <T> TimedCall<T> submit(ExecutorService executor, Callable<T> task) {
    TimedCall<T> call = new TimedCall<>(task);
    call.future = executor.submit(call);
    return call;
  }

  @Override
  public T call() throws Exception {
    startedNanos = System.nanoTime();
    started = true;
    try {
      return delegate.call();
    } finally {
      durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
  }

  /**
   * Waits until the task finishes or has run for {@code timeoutMs}.
   *
   * @throws TimeoutException if it ran too long; the task is not cancelled
   */
  public T await(long timeoutMs) throws InterruptedException, ExecutionException, TimeoutException {
    long budget = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (true) {
      boolean running = started;
      long from = running ? startedNanos : submittedNanos;
      try {
        return future.get(Math.max(0L, from + budget - System.nanoTime()), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        if (running || !started) {
          throw e;
        }
        // picked up while we waited; its allowance starts now
      }
    }
  }

  /** Interrupts the task if it is running. */
  public void cancel() {
    future.cancel(true);
  }

  /** How long the task ran, once it finished. */
  public long durationMs() {
    return durationMs;
  }

  /** How long the task has been running so far, or {@code 0} if it never started. */
  public long runningMs() {
    return started ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos) : 0L;
  }
}
