package cache.eviction;

import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * First-in-first-out eviction. Accesses never reorder keys; the oldest insert is evicted first.
 *
 * @param <K> The type of the keys in the store.
 * @param <V> The type of values in the store.
 */
public class FIFOEvictionPolicy<K, V> extends BoundedEvictionPolicy<K, V> {
  private final LinkedHashMap<K, V> fifoStore = new LinkedHashMap<>();

  public FIFOEvictionPolicy(final int capacity) {
    super(capacity);
  }

  @Override
  public Optional<V> get(final K key) {
    return Optional.ofNullable(fifoStore.get(key));
  }

  @Override
  public Optional<EvictedEntry<K, V>> put(final K key, final V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (fifoStore.containsKey(key)) {
      fifoStore.put(key, value);
      return Optional.empty();
    }
    if (getCapacity() == 0) {
      return Optional.of(new EvictedEntry<>(key, value));
    }
    EvictedEntry<K, V> evicted = null;
    if (isFull()) {
      Iterator<Map.Entry<K, V>> eldest = fifoStore.entrySet().iterator();
      Map.Entry<K, V> victim = eldest.next();
      evicted = new EvictedEntry<>(victim.getKey(), victim.getValue());
      eldest.remove();
    }
    fifoStore.put(key, value);
    return Optional.ofNullable(evicted);
  }

  @Override
  public void delete(final K key) {
    fifoStore.remove(key);
  }

  @Override
  public boolean containsKey(final K key) {
    return fifoStore.containsKey(key);
  }

  @Override
  public int size() {
    return fifoStore.size();
  }

  @Override
  public Map<K, V> snapshot() {
    return ImmutableMap.copyOf(fifoStore);
  }

  @Override
  public void purge() {
    fifoStore.clear();
  }
}
