package testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import cache.InvalidConfigurationException;
import cache.TieredCache;
import cache.TieredCacheConfig;
import cache.eviction.EvictedEntry;
import cache.eviction.EvictionStrategy;
import cache.eviction.LFUEvictionPolicy;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;

public class TieredCacheTest {
  private List<EvictedEntry<String, String>> dropped;

  @Before
  public void setUp() {
    dropped = new ArrayList<>();
  }

  private TieredCache<String, String> newCache(int maxLevels, Integer... capacities) {
    return new TieredCache<>(
        new TieredCacheConfig(maxLevels, Arrays.asList(capacities), EvictionStrategy.LFU),
        dropped::add);
  }

  @Test
  public void testStartsWithOneTier() {
    TieredCache<String, String> cache = newCache(3, 2, 3, 4);
    assertEquals(1, cache.getTierCount());
    assertEquals(3, cache.getMaxLevels());
    assertEquals(2, cache.getTier(0).getCapacity());
  }

  @Test
  public void testWriteThenRead() {
    TieredCache<String, String> cache = newCache(2, 2, 2);
    cache.write("a", "1");
    cache.write("a", "2");

    assertEquals(Optional.of("2"), cache.read("a"));
    assertEquals(Optional.empty(), cache.read("ghost"));
    assertEquals(1, cache.getTierCount());
  }

  @Test
  public void testEvictionCascadesIntoNewTier() {
    TieredCache<String, String> cache = newCache(2, 1, 1);
    cache.write("a", "1");
    cache.write("b", "2");

    assertEquals(2, cache.getTierCount());
    assertEquals(ImmutableMap.of("b", "2"), cache.snapshot().get(0));
    assertEquals(ImmutableMap.of("a", "1"), cache.snapshot().get(1));
    assertTrue(dropped.isEmpty());
  }

  @Test
  public void testFullStackDropsLastTierVictim() {
    TieredCache<String, String> cache = newCache(2, 1, 1);
    cache.write("a", "1");
    cache.write("b", "2");

    cache.write("c", "3");

    assertEquals(Collections.singletonList(new EvictedEntry<>("a", "1")), dropped);
    assertEquals(1, cache.getDroppedCount());
    assertEquals(2, cache.getTierCount());
    assertEquals(ImmutableMap.of("c", "3"), cache.snapshot().get(0));
    assertEquals(ImmutableMap.of("b", "2"), cache.snapshot().get(1));
    assertEquals(Optional.empty(), cache.read("a"));
  }

  @Test
  public void testDropWithoutListener() {
    TieredCache<String, String> cache = new TieredCache<>(1, Collections.singletonList(1));
    cache.write("a", "1");
    cache.write("b", "2");
    assertEquals(1, cache.getDroppedCount());
    assertEquals(Optional.of("2"), cache.read("b"));
  }

  @Test
  public void testTierCountBoundedByMaxLevels() {
    TieredCache<String, String> cache = newCache(3, 1, 1, 1, 1);
    for (int i = 0; i < 10; i++) {
      cache.write("key" + i, "value" + i);
    }
    assertEquals(3, cache.getTierCount());
    assertEquals(7, cache.getDroppedCount());
    assertEquals(7, dropped.size());
  }

  @Test
  public void testReadFromFirstTierDoesNotMove() {
    TieredCache<String, String> cache = newCache(2, 2, 2);
    cache.write("a", "1");
    cache.write("b", "2");
    List<Map<String, String>> before = cache.snapshot();

    assertEquals(Optional.of("1"), cache.read("a"));
    assertEquals(before, cache.snapshot());
    assertEquals(1, cache.getTierCount());
  }

  @Test
  public void testReadPromotesAndLeavesStaleCopy() {
    TieredCache<String, String> cache = newCache(2, 1, 2);
    cache.write("a", "1");
    cache.write("b", "2");
    assertFalse(cache.getTier(0).containsKey("a"));

    assertEquals(Optional.of("1"), cache.read("a"));

    assertEquals(ImmutableMap.of("a", "1"), cache.snapshot().get(0));
    // the lower copy is only removed by that tier's own eviction or by delete
    assertTrue(cache.getTier(1).containsKey("a"));
    assertTrue(cache.getTier(1).containsKey("b"));
    assertTrue(dropped.isEmpty());
  }

  @Test
  public void testStaleCopyIsEvictedByItsTier() {
    TieredCache<String, String> cache = newCache(2, 1, 1);
    cache.write("a", "1");
    cache.write("b", "2");

    // a is promoted, b cascades into L2 and pushes the stale a out of the stack
    assertEquals(Optional.of("1"), cache.read("a"));

    assertEquals(ImmutableMap.of("a", "1"), cache.snapshot().get(0));
    assertEquals(ImmutableMap.of("b", "2"), cache.snapshot().get(1));
    assertEquals(Collections.singletonList(new EvictedEntry<>("a", "1")), dropped);
  }

  @Test
  public void testDeleteRemovesEveryCopy() {
    TieredCache<String, String> cache = newCache(2, 1, 2);
    cache.write("a", "1");
    cache.write("b", "2");
    cache.read("a");

    cache.delete("a");

    for (int level = 0; level < cache.getTierCount(); level++) {
      assertFalse(cache.getTier(level).containsKey("a"));
    }
    assertEquals(Optional.empty(), cache.read("a"));
    assertEquals(Optional.of("2"), cache.read("b"));
    cache.delete("ghost");
  }

  @Test
  public void testWriteAfterDeleteIsFreshInsert() {
    TieredCache<String, String> cache = newCache(1, 2);
    cache.write("a", "1");
    cache.read("a");
    cache.read("a");
    cache.delete("a");

    cache.write("a", "2");

    LFUEvictionPolicy<String, String> l1 =
        (LFUEvictionPolicy<String, String>) cache.getTier(0).getPolicy();
    assertEquals(1, l1.getFrequency("a"));
    assertEquals(Optional.of("2"), cache.read("a"));
  }

  @Test
  public void testMissingCapacityIsReported() {
    TieredCache<String, String> cache = newCache(3, 1);
    cache.write("a", "1");
    try {
      cache.write("b", "2");
      fail("Expected InvalidConfigurationException");
    } catch (InvalidConfigurationException e) {
      assertTrue(e.getMessage().contains("level 2"));
    }
    assertEquals(1, cache.getTierCount());
  }

  @Test
  public void testZeroCapacityTierPassesEntriesDown() {
    TieredCache<String, String> cache = newCache(2, 0, 2);
    cache.write("a", "1");

    assertEquals(2, cache.getTierCount());
    assertTrue(cache.snapshot().get(0).isEmpty());
    assertEquals(ImmutableMap.of("a", "1"), cache.snapshot().get(1));
    assertEquals(Optional.of("1"), cache.read("a"));
    assertTrue(dropped.isEmpty());
  }

  @Test
  public void testToStringListsLevels() {
    TieredCache<String, String> cache = newCache(3, 2, 3, 4);
    cache.write("a", "1");
    cache.write("b", "2");
    cache.write("c", "3");
    assertEquals("L1: {b=2, c=3}\nL2: {a=1}", cache.toString());

    assertEquals(Optional.of("2"), cache.read("b"));
    cache.delete("a");
    assertEquals("L1: {b=2, c=3}\nL2: {}", cache.toString());
  }

  @Test
  public void testClearKeepsTiers() {
    TieredCache<String, String> cache = newCache(2, 1, 1);
    cache.write("a", "1");
    cache.write("b", "2");
    cache.clear();

    assertEquals(2, cache.getTierCount());
    assertEquals(Optional.empty(), cache.read("a"));
    assertEquals(Optional.empty(), cache.read("b"));
  }

  @Test
  public void testLruTiersCascadeLeastRecentlyUsed() {
    TieredCache<String, String> cache =
        new TieredCache<>(2, Arrays.asList(2, 2), EvictionStrategy.LRU);
    cache.write("a", "1");
    cache.write("b", "2");
    cache.read("a");
    cache.write("c", "3");

    assertEquals(ImmutableMap.of("b", "2"), cache.snapshot().get(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroMaxLevelsRejected() {
    newCache(0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyCapacitiesRejected() {
    new TieredCache<String, String>(1, Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeCapacityRejected() {
    newCache(2, 1, -1);
  }
}
