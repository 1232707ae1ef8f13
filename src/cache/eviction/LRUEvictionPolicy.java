package cache.eviction;

import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Least-recently-used eviction. Reads and overwrites move a key to the most recent position.
 *
 * @param <K> The type of the keys in the store.
 * @param <V> The type of values in the store.
 */
public class LRUEvictionPolicy<K, V> extends BoundedEvictionPolicy<K, V> {
  private final LinkedHashMap<K, V> lruStore;

  public LRUEvictionPolicy(final int capacity) {
    super(capacity);
    lruStore = new LinkedHashMap<>(16, 0.75f, true);
  }

  @Override
  public Optional<V> get(final K key) {
    return Optional.ofNullable(lruStore.get(key));
  }

  @Override
  public Optional<EvictedEntry<K, V>> put(final K key, final V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (lruStore.containsKey(key)) {
      lruStore.put(key, value);
      return Optional.empty();
    }
    if (getCapacity() == 0) {
      return Optional.of(new EvictedEntry<>(key, value));
    }
    EvictedEntry<K, V> evicted = null;
    if (isFull()) {
      Iterator<Map.Entry<K, V>> eldest = lruStore.entrySet().iterator();
      Map.Entry<K, V> victim = eldest.next();
      evicted = new EvictedEntry<>(victim.getKey(), victim.getValue());
      eldest.remove();
    }
    lruStore.put(key, value);
    return Optional.ofNullable(evicted);
  }

  @Override
  public void delete(final K key) {
    lruStore.remove(key);
  }

  @Override
  public boolean containsKey(final K key) {
    return lruStore.containsKey(key);
  }

  @Override
  public int size() {
    return lruStore.size();
  }

  @Override
  public Map<K, V> snapshot() {
    return ImmutableMap.copyOf(lruStore);
  }

  @Override
  public void purge() {
    lruStore.clear();
  }
}
