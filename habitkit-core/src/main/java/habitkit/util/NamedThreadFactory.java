package habitkit.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the hook and health-check pools.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc., are daemons so a
 * forgotten dispatcher never keeps the JVM alive, and log anything that escapes a task.
 */
public final class NamedThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(NamedThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public NamedThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception on " + t.getName(), e));
    return thread;
  }
}
