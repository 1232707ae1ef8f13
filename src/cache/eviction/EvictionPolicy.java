package cache.eviction;

import java.util.Map;
import java.util.Optional;

/**
 * A bounded in-memory key-value store that decides which entry to give up when it is full. The
 * choice of victim is up to the implementation. Implementations are not thread-safe.
 *
 * @param <K> The type of the keys in the store.
 * @param <V> The type of values in the store.
 */
public interface EvictionPolicy<K, V> {

  /**
   * Retrieve the value for key and record the access.
   *
   * @param key The key to look up.
   * @return The value for key, or empty if key is not present. A miss has no side effects.
   */
  Optional<V> get(final K key);

  /**
   * Create or overwrite the mapping from key to value. Overwriting counts as an access.
   *
   * @param key The key for the mapping.
   * @param value The value for the mapping.
   * @return The entry given up to make room for key, or empty if nothing was evicted.
   */
  Optional<EvictedEntry<K, V>> put(final K key, final V value);

  /**
   * Remove the mapping for key if it exists.
   *
   * @param key The key for the mapping.
   */
  void delete(final K key);

  /**
   * Return true iff key is a key in the store. Does not count as an access.
   *
   * @param key The key to look for.
   * @return true iff key is a key in the store.
   */
  boolean containsKey(final K key);

  /** @return The number of mappings currently held. */
  int size();

  /** @return The maximum number of mappings the store can hold. */
  int getCapacity();

  /** @return An immutable copy of the current mappings in storage order. */
  Map<K, V> snapshot();

  /** Remove every mapping and all access bookkeeping. */
  void purge();
}
