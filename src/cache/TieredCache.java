package cache;

import cache.eviction.EvictedEntry;
import cache.eviction.EvictionPolicyFactory;
import cache.eviction.EvictionStrategy;
import cache.tier.CacheTier;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.log4j.Logger;

/**
 * A multi-level cache. Tier 0 is the smallest and fastest; entries evicted from one tier cascade
 * into the next, and entries found in a slower tier are promoted back through tier 0. Tiers are
 * created on demand up to maxLevels and never removed. Not thread-safe, see
 * SynchronizedTieredCache.
 *
 * @param <K> The type of the keys in the cache.
 * @param <V> The type of values in the cache.
 */
public class TieredCache<K, V> {
  private static final Logger logger = Logger.getLogger(TieredCache.class);
  private final TieredCacheConfig config;
  private final EvictionPolicyFactory<K, V> policyFactory = new EvictionPolicyFactory<>();
  private final List<CacheTier<K, V>> tiers = new ArrayList<>();
  private final EvictionListener<K, V> evictionListener;
  private long droppedCount = 0;

  /** Create an LFU cache. */
  public TieredCache(final int maxLevels, final List<Integer> capacities) {
    this(maxLevels, capacities, EvictionStrategy.LFU);
  }

  public TieredCache(
      final int maxLevels, final List<Integer> capacities, final EvictionStrategy strategy) {
    this(new TieredCacheConfig(maxLevels, capacities, strategy), null);
  }

  /**
   * @param config The tier layout and eviction strategy.
   * @param evictionListener Notified of entries dropped from the last tier; may be null.
   */
  public TieredCache(
      final TieredCacheConfig config, final EvictionListener<K, V> evictionListener) {
    this.config = Objects.requireNonNull(config, "config");
    this.evictionListener = evictionListener;
    if (config.getCapacities().size() < config.getMaxLevels()) {
      logger.warn(
          "Only "
              + config.getCapacities().size()
              + " capacities given for "
              + config.getMaxLevels()
              + " levels; growing past them will fail.");
    }
    addTier();
  }

  /**
   * Look key up from the fastest tier to the slowest. A hit below tier 0 is written back through
   * tier 0; the copy in the slower tier is left for that tier's own eviction or a delete.
   *
   * @param key The key to look up.
   * @return The value for key, or empty on a miss.
   */
  public Optional<V> read(final K key) {
    for (CacheTier<K, V> tier : tiers) {
      Optional<V> value = tier.get(key);
      if (value.isPresent()) {
        if (tier.getLevel() != 0) {
          logger.debug("Promoting " + key + " from L" + (tier.getLevel() + 1));
          write(key, value.get());
        }
        return value;
      }
    }
    logger.debug("Miss for " + key);
    return Optional.empty();
  }

  /**
   * Write key into tier 0, cascading whatever each tier evicts into the next one. When the last
   * allowed tier evicts, that entry is dropped and reported to the eviction listener.
   *
   * @param key The key for the mapping.
   * @param value The value for the mapping.
   * @throws InvalidConfigurationException if a new tier is needed but has no configured capacity.
   */
  public void write(final K key, final V value) {
    EvictedEntry<K, V> pending = new EvictedEntry<>(key, value);
    int level = 0;
    while (true) {
      if (level == tiers.size()) {
        if (tiers.size() >= config.getMaxLevels()) {
          drop(pending);
          return;
        }
        addTier();
      }
      Optional<EvictedEntry<K, V>> evicted =
          tiers.get(level).put(pending.getKey(), pending.getValue());
      if (!evicted.isPresent()) {
        return;
      }
      pending = evicted.get();
      level++;
      logger.debug("Cascading " + pending + " into L" + (level + 1));
    }
  }

  /**
   * Remove key from every tier.
   *
   * @param key The key to remove.
   */
  public void delete(final K key) {
    for (CacheTier<K, V> tier : tiers) {
      tier.delete(key);
    }
  }

  /** Empty every tier. Tiers already created are kept. */
  public void clear() {
    for (CacheTier<K, V> tier : tiers) {
      tier.purge();
    }
    logger.info("Cleared " + tiers.size() + " tiers");
  }

  /** @return The contents of each tier, ordered by tier index. */
  public List<Map<K, V>> snapshot() {
    ImmutableList.Builder<Map<K, V>> snapshot = ImmutableList.builder();
    for (CacheTier<K, V> tier : tiers) {
      snapshot.add(tier.snapshot());
    }
    return snapshot.build();
  }

  /**
   * Inspection access to one tier. The tier is live: writing to it directly bypasses cascading,
   * and for a shared cache it bypasses locking too, so only use it single-threaded.
   *
   * @param level The tier index.
   * @return The tier at level.
   * @throws IndexOutOfBoundsException if that tier has not been created.
   */
  public CacheTier<K, V> getTier(final int level) {
    return tiers.get(level);
  }

  public int getTierCount() {
    return tiers.size();
  }

  public int getMaxLevels() {
    return config.getMaxLevels();
  }

  public TieredCacheConfig getConfig() {
    return config;
  }

  /** @return How many entries have been dropped because every allowed tier was full. */
  public long getDroppedCount() {
    return droppedCount;
  }

  private void addTier() {
    int level = tiers.size();
    int capacity = config.getCapacity(level);
    tiers.add(new CacheTier<>(level, policyFactory.getPolicy(capacity, config.getStrategy())));
    logger.info(
        "Created L"
            + (level + 1)
            + " with capacity "
            + capacity
            + " ("
            + config.getStrategy()
            + ")");
  }

  private void drop(final EvictedEntry<K, V> entry) {
    droppedCount++;
    logger.warn("All " + tiers.size() + " levels are full, dropping " + entry);
    if (evictionListener != null) {
      evictionListener.onDrop(entry);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (CacheTier<K, V> tier : tiers) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append('L').append(tier.getLevel() + 1).append(": ").append(tier);
    }
    return sb.toString();
  }
}
