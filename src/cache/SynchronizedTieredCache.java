package cache;

import cache.eviction.EvictionStrategy;
import cache.tier.CacheTier;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A TieredCache guarded by one coarse lock: each read, write, delete, clear and snapshot runs to
 * completion, cascade and promotion included, before the next one starts. Eviction listeners are
 * called while the lock is held.
 *
 * @param <K> The type of the keys in the cache.
 * @param <V> The type of values in the cache.
 */
public class SynchronizedTieredCache<K, V> extends TieredCache<K, V> {

  public SynchronizedTieredCache(final int maxLevels, final List<Integer> capacities) {
    super(maxLevels, capacities);
  }

  public SynchronizedTieredCache(
      final int maxLevels, final List<Integer> capacities, final EvictionStrategy strategy) {
    super(maxLevels, capacities, strategy);
  }

  public SynchronizedTieredCache(
      final TieredCacheConfig config, final EvictionListener<K, V> evictionListener) {
    super(config, evictionListener);
  }

  @Override
  public synchronized Optional<V> read(final K key) {
    return super.read(key);
  }

  @Override
  public synchronized void write(final K key, final V value) {
    super.write(key, value);
  }

  @Override
  public synchronized void delete(final K key) {
    super.delete(key);
  }

  @Override
  public synchronized void clear() {
    super.clear();
  }

  @Override
  public synchronized List<Map<K, V>> snapshot() {
    return super.snapshot();
  }

  /**
   * The returned tier is live and is not guarded by this cache's lock; use it for inspection
   * only, while no other thread is using the cache.
   */
  @Override
  public synchronized CacheTier<K, V> getTier(final int level) {
    return super.getTier(level);
  }

  @Override
  public synchronized int getTierCount() {
    return super.getTierCount();
  }

  @Override
  public synchronized long getDroppedCount() {
    return super.getDroppedCount();
  }

  @Override
  public synchronized String toString() {
    return super.toString();
  }
}
