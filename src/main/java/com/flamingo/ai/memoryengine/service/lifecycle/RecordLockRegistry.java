package com.flamingo.ai.memoryengine.service.lifecycle;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Per-record mutual exclusion for writers inside this process. Locks are reference counted and
 * removed once no thread holds or waits for them, so the registry only grows with the number of
 * records being written concurrently.
 *
 * <p>Cross-process exclusion is the store's job (create-if-absent and compare-and-set); these
 * locks only keep local writers from burning retries against each other.
 */
@Component
public class RecordLockRegistry {

  private final ConcurrentMap<String, RefCountedLock> locks = new ConcurrentHashMap<>();

  /** Runs {@code action} while holding the lock of {@code id}. */
  public <T> T withLock(String id, Supplier<T> action) {
    RefCountedLock lock = acquire(id);
    lock.lock.lock();
    try {
      return action.get();
    } finally {
      lock.lock.unlock();
      release(id);
    }
  }

  /**
   * Runs {@code action} while holding the locks of both identifiers, taken in lexicographic order
   * so that two merges of the same pair cannot deadlock.
   */
  public <T> T withLocks(String first, String second, Supplier<T> action) {
    if (first.equals(second)) {
      return withLock(first, action);
    }
    String lower = first.compareTo(second) < 0 ? first : second;
    String upper = lower.equals(first) ? second : first;
    return withLock(lower, () -> withLock(upper, action));
  }

  /** Number of identifiers currently locked or waited on. */
  public int activeLocks() {
    return locks.size();
  }

  private RefCountedLock acquire(String id) {
    return locks.compute(
        id,
        (key, existing) -> {
          RefCountedLock lock = existing != null ? existing : new RefCountedLock();
          lock.references++;
          return lock;
        });
  }

  private void release(String id) {
    locks.computeIfPresent(id, (key, lock) -> --lock.references == 0 ? null : lock);
  }

  private static final class RefCountedLock {
    private final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    private int references;
  }
}
