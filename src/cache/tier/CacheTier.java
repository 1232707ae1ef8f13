package cache.tier;

import cache.eviction.EvictedEntry;
import cache.eviction.EvictionPolicy;
import java.util.Map;
import java.util.Optional;
import org.apache.log4j.Logger;

/**
 * One level of a tiered cache. Every operation is delegated to the tier's own eviction policy.
 *
 * @param <K> The type of the keys in the tier.
 * @param <V> The type of values in the tier.
 */
public class CacheTier<K, V> {
  private static final Logger logger = Logger.getLogger(CacheTier.class);
  private final int level;
  private final EvictionPolicy<K, V> policy;

  /**
   * @param level The index of this tier, 0 being the fastest.
   * @param policy The policy that stores this tier's entries.
   */
  public CacheTier(final int level, final EvictionPolicy<K, V> policy) {
    this.level = level;
    this.policy = policy;
  }

  public Optional<V> get(final K key) {
    return policy.get(key);
  }

  /**
   * Put the key-value pair into the tier.
   *
   * @return The entry this tier gave up to fit key, or empty.
   */
  public Optional<EvictedEntry<K, V>> put(final K key, final V value) {
    Optional<EvictedEntry<K, V>> evicted = policy.put(key, value);
    evicted.ifPresent(entry -> logger.debug("L" + (level + 1) + " evicted " + entry));
    return evicted;
  }

  public void delete(final K key) {
    policy.delete(key);
  }

  public boolean containsKey(final K key) {
    return policy.containsKey(key);
  }

  public void purge() {
    policy.purge();
  }

  public int getLevel() {
    return level;
  }

  public int getCapacity() {
    return policy.getCapacity();
  }

  public int size() {
    return policy.size();
  }

  /** @return The tier's current contents in storage order. */
  public Map<K, V> snapshot() {
    return policy.snapshot();
  }

  /** @return The policy backing this tier. */
  public EvictionPolicy<K, V> getPolicy() {
    return policy;
  }

  @Override
  public String toString() {
    return policy.snapshot().toString();
  }
}
