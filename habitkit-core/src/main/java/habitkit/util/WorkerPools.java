package habitkit.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** Executors for the hook and health-check pools. */
public final class WorkerPools {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 60;

  private WorkerPools() {}

  /**
   * A pool that never queues: every task starts immediately, on an idle thread or a
   * new one. {@code coreThreads} threads stay alive when idle, extra threads retire
   * after a minute without work. A task that ignores interruption only pins its own
   * thread.
   *
   * @param coreThreads threads kept alive when idle, at least 1
   * @param prefix thread name prefix
   */
  public static ExecutorService elastic(int coreThreads, String prefix) {
    if (coreThreads < 1) {
      throw new IllegalArgumentException("coreThreads must be >= 1");
    }
    return new ThreadPoolExecutor(coreThreads, Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
        new SynchronousQueue<>(), new NamedThreadFactory(prefix));
  }
}
