package testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import cache.SynchronizedTieredCache;
import cache.TieredCacheConfig;
import cache.eviction.EvictionStrategy;
import cache.eviction.LRUEvictionPolicy;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class SynchronizedTieredCacheTest {
  private static final int THREADS = 8;
  private static final int KEYS_PER_THREAD = 50;

  @Test(timeout = 10000)
  public void testConcurrentWritersKeepBookkeepingConsistent() throws Exception {
    AtomicInteger dropped = new AtomicInteger();
    SynchronizedTieredCache<String, String> cache =
        new SynchronizedTieredCache<>(
            new TieredCacheConfig(2, Arrays.asList(50, 100), EvictionStrategy.LFU),
            entry -> dropped.incrementAndGet());

    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> results = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      final int thread = t;
      results.add(
          executor.submit(
              () -> {
                start.await();
                for (int i = 0; i < KEYS_PER_THREAD; i++) {
                  String key = thread + "-" + i;
                  cache.write(key, key);
                  cache.read(key);
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> result : results) {
      result.get();
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(2, cache.getTierCount());
    assertEquals(dropped.get(), cache.getDroppedCount());
    List<Map<String, String>> snapshot = cache.snapshot();
    assertEquals(50, snapshot.get(0).size());
    assertTrue(snapshot.get(1).size() <= 100);

    Set<String> resident = new HashSet<>();
    for (Map<String, String> tier : snapshot) {
      for (Map.Entry<String, String> entry : tier.entrySet()) {
        assertEquals(entry.getKey(), entry.getValue());
        resident.add(entry.getKey());
      }
    }
    for (String key : snapshot.get(0).keySet()) {
      assertEquals(Optional.of(key), cache.read(key));
    }
    assertTrue(resident.size() <= 150);
  }

  @Test(timeout = 10000)
  public void testDistinctWritesAccountForEveryEntry() throws Exception {
    SynchronizedTieredCache<String, String> cache =
        new SynchronizedTieredCache<>(2, Arrays.asList(50, 100));
    Thread[] writers = new Thread[THREADS];
    for (int t = 0; t < THREADS; t++) {
      final int thread = t;
      writers[t] =
          new Thread(
              () -> {
                for (int i = 0; i < KEYS_PER_THREAD; i++) {
                  cache.write(thread + "-" + i, "v");
                }
              },
              "writer-" + t);
      writers[t].start();
    }
    for (Thread writer : writers) {
      writer.join();
    }

    int held = 0;
    for (Map<String, String> tier : cache.snapshot()) {
      held += tier.size();
    }
    assertEquals(150, held);
    assertEquals(THREADS * KEYS_PER_THREAD - 150, cache.getDroppedCount());
  }

  @Test
  public void testStrategyConstructorBuildsLruTiers() {
    SynchronizedTieredCache<String, String> cache =
        new SynchronizedTieredCache<>(2, Arrays.asList(2, 2), EvictionStrategy.LRU);
    cache.write("a", "1");
    cache.write("b", "2");
    cache.read("a");
    cache.write("c", "3");

    assertTrue(cache.getTier(0).getPolicy() instanceof LRUEvictionPolicy);
    assertEquals(EvictionStrategy.LRU, cache.getConfig().getStrategy());
    assertEquals(ImmutableMap.of("b", "2"), cache.snapshot().get(1));
  }

  @Test(timeout = 10000)
  public void testGetTierWaitsForRunningOperation() throws Exception {
    CountDownLatch inListener = new CountDownLatch(1);
    CountDownLatch finish = new CountDownLatch(1);
    SynchronizedTieredCache<String, String> cache =
        new SynchronizedTieredCache<>(
            new TieredCacheConfig(1, Arrays.asList(1), EvictionStrategy.LFU),
            entry -> {
              inListener.countDown();
              try {
                finish.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    cache.write("a", "1");

    ExecutorService executor = Executors.newFixedThreadPool(2);
    Future<?> writer = executor.submit(() -> cache.write("b", "2"));
    inListener.await();
    Future<Integer> inspector = executor.submit(() -> cache.getTier(0).size());
    Thread.sleep(50);
    assertFalse(inspector.isDone());

    finish.countDown();
    writer.get();
    assertEquals(Integer.valueOf(1), inspector.get());
    executor.shutdown();
  }
}
