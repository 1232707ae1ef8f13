package cache.eviction;

public class EvictionPolicyFactory<K, V> {
  /**
   * Return the specified EvictionPolicy implementation.
   *
   * @param capacity The maximum number of elements the policy can hold.
   * @param strategy Specifies an implementation of EvictionPolicy.
   * @return An EvictionPolicy implementation corresponding to strategy.
   */
  public EvictionPolicy<K, V> getPolicy(final int capacity, final EvictionStrategy strategy) {
    switch (strategy) {
      case LRU:
        return new LRUEvictionPolicy<>(capacity);
      case FIFO:
        return new FIFOEvictionPolicy<>(capacity);
      default: // LFU
        return new LFUEvictionPolicy<>(capacity);
    }
  }
}
