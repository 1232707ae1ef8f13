package cache.eviction;

/**
 * Base for eviction policies with a fixed capacity.
 *
 * @param <K> The type of the keys in the store.
 * @param <V> The type of values in the store.
 */
public abstract class BoundedEvictionPolicy<K, V> implements EvictionPolicy<K, V> {
  private final int capacity;

  /**
   * Set the capacity of the store.
   *
   * @param capacity The maximum number of elements the store can hold. Zero is allowed: every
   *     insert is then evicted immediately.
   * @throws IllegalArgumentException if capacity is negative.
   */
  protected BoundedEvictionPolicy(final int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Capacity must be >= 0. Given: " + capacity + ".");
    }
    this.capacity = capacity;
  }

  @Override
  public final int getCapacity() {
    return capacity;
  }

  /** @return true iff inserting one more key requires an eviction first. */
  protected final boolean isFull() {
    return size() >= capacity;
  }
}
