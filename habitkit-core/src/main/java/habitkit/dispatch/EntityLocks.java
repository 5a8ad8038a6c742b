package habitkit.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutual exclusion with reference-counted entries.
 *
 * <p>Dispatches for the same habit id are serialized; different ids never contend.
 * An entry is evicted as soon as its last holder or waiter releases it, so the map
 * only ever contains keys with active dispatches.
 *
 * <pre>{@code
 * try (EntityLocks.Permit permit = locks.acquire(habitId)) {
 *   // exclusive for habitId
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class EntityLocks {
  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  /**
   * Blocks until the lock for {@code key} is held by the calling thread.
   *
   * @param key the entity key
   * @return a permit that releases the lock when closed
   */
  public Permit acquire(String key) {
    Objects.requireNonNull(key, "key");
    Entry entry = entries.compute(key, (k, existing) -> {
      Entry e = existing != null ? existing : new Entry();
      e.references++;
      return e;
    });
    entry.lock.lock();
    return new Permit(key, entry);
  }

  /** Number of keys currently held or awaited. */
  public int activeKeys() {
    return entries.size();
  }

  private void release(String key, Entry entry) {
    entry.lock.unlock();
    // references is only mutated inside compute, which is atomic per key
    entries.compute(key, (k, existing) -> --existing.references == 0 ? null : existing);
  }

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int references;
  }

  /** Held lock for one key. Closing it more than once has no effect. */
  public final class Permit implements AutoCloseable {
    private final String key;
    private final Entry entry;
    private boolean released;

    private Permit(String key, Entry entry) {
      this.key = key;
      this.entry = entry;
    }

    public String key() {
      return key;
    }

    @Override
    public void close() {
      if (released) {
        return;
      }
      released = true;
      release(key, entry);
    }
  }
}
