package locking;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A held lock on one resource key. Closing it releases the lock; use it with try-with-resources
 * so every exit path releases. Must be closed by the thread that acquired it.
 *
 * @param <K> The type of the resource key.
 */
public final class KeyLock<K> implements AutoCloseable {
  private final K key;
  private final ReentrantLock lock;
  private boolean released = false;

  KeyLock(final K key, final ReentrantLock lock) {
    this.key = key;
    this.lock = lock;
  }

  public K getKey() {
    return key;
  }

  /** @return true iff this guard has not been released yet. */
  public boolean isHeld() {
    return !released;
  }

  /**
   * Release the lock. Releasing an already released guard does nothing.
   *
   * @throws IllegalStateException if called by a thread other than the one that acquired it. The
   *     lock stays held and the guard can still be closed by its owner.
   */
  @Override
  public void close() {
    if (released) {
      return;
    }
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException(
          "Lock on " + key + " can only be released by the thread that acquired it");
    }
    lock.unlock();
    released = true;
  }
}
