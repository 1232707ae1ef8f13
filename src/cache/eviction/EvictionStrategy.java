package cache.eviction;

/** Correspond to distinct implementations of cache.eviction.EvictionPolicy */
public enum EvictionStrategy {
  LFU,
  LRU,
  FIFO,
}
