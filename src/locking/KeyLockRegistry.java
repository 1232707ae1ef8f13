package locking;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.log4j.Logger;

/**
 * One mutual-exclusion lock per resource key, created the first time the key is seen. Holders of
 * the same key exclude each other, including a second acquisition by the thread that already
 * holds it; different keys never block each other. Locks are kept for the life of the registry,
 * so the key space should be a bounded set of resources.
 *
 * @param <K> The type of the resource keys.
 */
public class KeyLockRegistry<K> {
  private static final Logger logger = Logger.getLogger(KeyLockRegistry.class);
  private final ConcurrentHashMap<K, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Block until the lock for key is held or timeout elapses.
   *
   * @param key The resource to lock.
   * @param timeout How long to wait.
   * @param unit The unit of timeout.
   * @return A guard that releases the lock when closed.
   * @throws LockTimeoutException if the lock could not be acquired in time, or if the calling
   *     thread already holds it.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  public KeyLock<K> acquire(final K key, final long timeout, final TimeUnit unit)
      throws LockTimeoutException, InterruptedException {
    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
    if (lock.isHeldByCurrentThread()) {
      logger.warn("Refusing nested acquisition of " + key + " by its holder");
      throw new LockTimeoutException("\"" + key + "\" is already held by this thread");
    }
    if (!lock.tryLock(timeout, unit)) {
      logger.warn("Timed out after " + timeout + " " + unit + " waiting for lock on " + key);
      throw new LockTimeoutException(
          "could not lock \"" + key + "\" within " + timeout + " " + unit.toString().toLowerCase());
    }
    logger.debug("Locked " + key);
    return new KeyLock<>(key, lock);
  }

  /**
   * Release a guard returned by acquire. Same as closing it.
   *
   * @param keyLock The guard to release.
   */
  public void release(final KeyLock<K> keyLock) {
    keyLock.close();
    logger.debug("Released " + keyLock.getKey());
  }

  /**
   * @param key The resource to check.
   * @return true iff some thread currently holds the lock for key.
   */
  public boolean isLocked(final K key) {
    ReentrantLock lock = locks.get(key);
    return lock != null && lock.isLocked();
  }

  /** @return The number of keys a lock has been created for. */
  public int size() {
    return locks.size();
  }
}
