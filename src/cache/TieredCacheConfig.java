package cache;

import cache.eviction.EvictionStrategy;
import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** The shape of a TieredCache: how many tiers it may grow to, their sizes and their policy. */
public final class TieredCacheConfig {
  private final int maxLevels;
  private final ImmutableList<Integer> capacities;
  private final EvictionStrategy strategy;

  /**
   * @param maxLevels The maximum number of tiers the cache may create, at least 1.
   * @param capacities Capacity of each tier by level index. Only capacities[0] is required up
   *     front; a missing entry is reported when that tier is first needed.
   * @param strategy The eviction policy used by every tier.
   * @throws IllegalArgumentException if maxLevels < 1, capacities is empty or has a negative
   *     entry.
   */
  public TieredCacheConfig(
      final int maxLevels, final List<Integer> capacities, final EvictionStrategy strategy) {
    if (maxLevels < 1) {
      throw new IllegalArgumentException("maxLevels must be >= 1. Given: " + maxLevels + ".");
    }
    if (capacities == null || capacities.isEmpty()) {
      throw new IllegalArgumentException("At least one capacity is required.");
    }
    for (Integer capacity : capacities) {
      if (capacity == null || capacity < 0) {
        throw new IllegalArgumentException("Capacities must be >= 0. Given: " + capacities + ".");
      }
    }
    if (strategy == null) {
      throw new IllegalArgumentException("An eviction strategy is required.");
    }
    this.maxLevels = maxLevels;
    this.capacities = ImmutableList.copyOf(capacities);
    this.strategy = strategy;
  }

  /**
   * Read a config file made of "name value..." lines, e.g.
   *
   * <pre>
   * maxLevels 3
   * strategy LFU
   * capacities 2 3 4
   * </pre>
   *
   * Blank lines and lines starting with # are ignored. strategy defaults to LFU.
   *
   * @param filepath Path of the config file.
   * @return The parsed config.
   * @throws IllegalArgumentException if the file content is invalid.
   * @throws IOException if the file cannot be read.
   */
  public static TieredCacheConfig parseConfigFile(String filepath)
      throws IllegalArgumentException, IOException {
    Integer maxLevels = null;
    List<Integer> capacities = new ArrayList<>();
    EvictionStrategy strategy = EvictionStrategy.LFU;
    try (BufferedReader configReader =
        new BufferedReader(new FileReader(filepath, StandardCharsets.UTF_8))) {
      String currentLine;
      while ((currentLine = configReader.readLine()) != null) {
        currentLine = currentLine.trim();
        if (currentLine.isEmpty() || currentLine.startsWith("#")) {
          continue;
        }
        String[] tokens = currentLine.split("\\s+");
        if (tokens.length < 2) {
          throw new IllegalArgumentException("Config file is invalid: " + currentLine);
        }
        switch (tokens[0]) {
          case "maxLevels":
            maxLevels = parseInteger(tokens[1], "maxLevels");
            break;
          case "strategy":
            strategy = parseStrategy(tokens[1]);
            break;
          case "capacities":
            for (int i = 1; i < tokens.length; i++) {
              capacities.add(parseInteger(tokens[i], "capacities"));
            }
            break;
          default:
            throw new IllegalArgumentException("Unknown config entry: " + tokens[0]);
        }
      }
    }
    if (maxLevels == null) {
      throw new IllegalArgumentException("Config file is missing maxLevels.");
    }
    return new TieredCacheConfig(maxLevels, capacities, strategy);
  }

  public static int parseInteger(String token, String name) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer. Given: " + token + ".");
    }
  }

  public static EvictionStrategy parseStrategy(String token) {
    try {
      return EvictionStrategy.valueOf(token.toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "strategy must be one of \"LFU\", \"LRU\" and \"FIFO\". Given: \"" + token + "\".");
    }
  }

  public int getMaxLevels() {
    return maxLevels;
  }

  public ImmutableList<Integer> getCapacities() {
    return capacities;
  }

  public EvictionStrategy getStrategy() {
    return strategy;
  }

  /**
   * @param level The tier index.
   * @return The configured capacity for level.
   * @throws InvalidConfigurationException if no capacity was given for level.
   */
  public int getCapacity(final int level) {
    if (level >= capacities.size()) {
      throw new InvalidConfigurationException(
          "no capacity configured for level "
              + (level + 1)
              + " (capacities "
              + capacities
              + ", maxLevels "
              + maxLevels
              + ")");
    }
    return capacities.get(level);
  }

  @Override
  public String toString() {
    return "maxLevels=" + maxLevels + ", capacities=" + capacities + ", strategy=" + strategy;
  }
}
