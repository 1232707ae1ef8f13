package cache;

import cache.eviction.EvictedEntry;

/**
 * Observes entries that a TieredCache gives up for good because every allowed tier is full.
 *
 * @param <K> The type of the keys in the cache.
 * @param <V> The type of values in the cache.
 */
@FunctionalInterface
public interface EvictionListener<K, V> {

  /**
   * Called once per dropped entry, on the thread performing the write that caused the drop.
   *
   * @param entry The entry that is no longer held by any tier.
   */
  void onDrop(final EvictedEntry<K, V> entry);
}
