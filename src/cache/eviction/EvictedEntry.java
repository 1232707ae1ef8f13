package cache.eviction;

import java.util.Objects;

/**
 * A key-value pair that left a cache tier, either to cascade into the next tier or to be dropped.
 *
 * @param <K> The type of the key.
 * @param <V> The type of the value.
 */
public final class EvictedEntry<K, V> {
  private final K key;
  private final V value;

  public EvictedEntry(final K key, final V value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
  }

  public K getKey() {
    return key;
  }

  public V getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EvictedEntry)) {
      return false;
    }
    EvictedEntry<?, ?> other = (EvictedEntry<?, ?>) o;
    return key.equals(other.key) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return "(" + key + ", " + value + ")";
  }
}
