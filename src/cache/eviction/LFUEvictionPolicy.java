package cache.eviction;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.log4j.Logger;

/**
 * Least-frequently-used eviction with O(1) get() and put(), based on http://dhruvbird.com/lfu.pdf.
 * Keys with the same access count are kept in a bucket ordered by when they entered it, so ties
 * are broken by evicting the key that has waited longest at the lowest frequency.
 *
 * @param <K> The type of the keys in the store.
 * @param <V> The type of values in the store.
 */
public class LFUEvictionPolicy<K, V> extends BoundedEvictionPolicy<K, V> {
  private static final Logger logger = Logger.getLogger(LFUEvictionPolicy.class);

  private final Map<K, V> values = new LinkedHashMap<>();
  private final Map<K, Integer> frequencies = new HashMap<>();
  private final Map<Integer, LinkedHashSet<K>> buckets = new HashMap<>();
  private int minFrequency = 0;

  public LFUEvictionPolicy(final int capacity) {
    super(capacity);
  }

  @Override
  public Optional<V> get(final K key) {
    if (!values.containsKey(key)) {
      return Optional.empty();
    }
    touch(key);
    return Optional.of(values.get(key));
  }

  @Override
  public Optional<EvictedEntry<K, V>> put(final K key, final V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (values.containsKey(key)) {
      values.put(key, value);
      touch(key);
      return Optional.empty();
    }
    if (getCapacity() == 0) {
      return Optional.of(new EvictedEntry<>(key, value));
    }

    EvictedEntry<K, V> evicted = null;
    if (isFull()) {
      evicted = evictLeastFrequent();
    }
    values.put(key, value);
    frequencies.put(key, 1);
    buckets.computeIfAbsent(1, f -> new LinkedHashSet<>()).add(key);
    minFrequency = 1;
    return Optional.ofNullable(evicted);
  }

  @Override
  public void delete(final K key) {
    if (!values.containsKey(key)) {
      return;
    }
    int frequency = frequencies.remove(key);
    values.remove(key);
    if (removeFromBucket(key, frequency) && frequency == minFrequency) {
      minFrequency = buckets.isEmpty() ? 0 : Collections.min(buckets.keySet());
    }
  }

  @Override
  public boolean containsKey(final K key) {
    return values.containsKey(key);
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public Map<K, V> snapshot() {
    return ImmutableMap.copyOf(values);
  }

  @Override
  public void purge() {
    values.clear();
    frequencies.clear();
    buckets.clear();
    minFrequency = 0;
  }

  /**
   * @param key The key to look for.
   * @return The access count of key, or 0 if key is not present.
   */
  public int getFrequency(final K key) {
    return frequencies.getOrDefault(key, 0);
  }

  /** @return The lowest access count among present keys, or 0 if the store is empty. */
  public int getMinFrequency() {
    return minFrequency;
  }

  private void touch(final K key) {
    int frequency = frequencies.get(key);
    // Counts only grow by one, so the next minimum is frequency + 1, which key is about to fill.
    if (removeFromBucket(key, frequency) && frequency == minFrequency) {
      minFrequency++;
    }
    frequencies.put(key, frequency + 1);
    buckets.computeIfAbsent(frequency + 1, f -> new LinkedHashSet<>()).add(key);
  }

  private EvictedEntry<K, V> evictLeastFrequent() {
    Iterator<K> oldest = buckets.get(minFrequency).iterator();
    K victim = oldest.next();
    oldest.remove();
    if (!oldest.hasNext()) {
      buckets.remove(minFrequency);
    }
    frequencies.remove(victim);
    V value = values.remove(victim);
    logger.debug("Evicting " + victim + " at frequency " + minFrequency);
    return new EvictedEntry<>(victim, value);
  }

  /** @return true iff removing key emptied (and so deleted) its bucket. */
  private boolean removeFromBucket(final K key, final int frequency) {
    LinkedHashSet<K> bucket = buckets.get(frequency);
    bucket.remove(key);
    if (bucket.isEmpty()) {
      buckets.remove(frequency);
      return true;
    }
    return false;
  }
}
