package app_cacheCLI;

import cache.InvalidConfigurationException;
import cache.SynchronizedTieredCache;
import cache.TieredCache;
import cache.TieredCacheConfig;
import cache.eviction.EvictionStrategy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import logger.LogSetup;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

public class CacheCLI {
  private static final Logger logger = Logger.getLogger(CacheCLI.class);
  private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
  private final TieredCache<String, String> cache;
  private boolean stop = false;

  public CacheCLI(final TieredCacheConfig config) {
    this.cache =
        new SynchronizedTieredCache<>(
            config,
            entry ->
                CLICacheUtils.printMessage(
                    "DROPPED<" + entry.getKey() + ", " + entry.getValue() + ">"));
  }

  /**
   * Main entry point for the tiered cache shell.
   *
   * @param args expected to be equal to [<max-levels>, <eviction-strategy>, <capacity>...] or
   *     [-config, <config-file>]
   */
  public static void main(String[] args) {
    TieredCacheConfig config;
    try {
      config = parseArguments(args);
    } catch (IllegalArgumentException e) {
      System.exit(1);
      return;
    }
    try {
      new LogSetup("logs/cache.log", Level.INFO, false);
    } catch (IOException e) {
      System.out.println("Error! Unable to initialize logger!");
      e.printStackTrace();
      System.exit(1);
    }
    logger.info("Starting tiered cache shell with " + config);
    new CacheCLI(config).run();
  }

  /**
   * Build the cache configuration from the command line.
   *
   * @param args [<max-levels>, <eviction-strategy>, <capacity>...] or [-config, <config-file>]
   * @return The validated configuration.
   * @throws IllegalArgumentException if the arguments are invalid. Usage is printed first.
   */
  public static TieredCacheConfig parseArguments(final String[] args) {
    if (args.length == 2 && args[0].equals("-config")) {
      try {
        return TieredCacheConfig.parseConfigFile(args[1]);
      } catch (IOException e) {
        exitWithErrorMessage("Unable to read config file " + args[1] + ": " + e.getMessage());
      } catch (IllegalArgumentException e) {
        exitWithErrorMessage(e.getMessage());
      }
    }
    if (args.length < 3) {
      exitWithErrorMessage("At least 3 arguments required. " + args.length + " provided.");
    }

    List<Integer> capacities = new ArrayList<>();
    try {
      int maxLevels = TieredCacheConfig.parseInteger(args[0], "<max-levels>");
      EvictionStrategy strategy = TieredCacheConfig.parseStrategy(args[1]);
      for (String capacity : Arrays.copyOfRange(args, 2, args.length)) {
        capacities.add(TieredCacheConfig.parseInteger(capacity, "<capacity>"));
      }
      return new TieredCacheConfig(maxLevels, capacities, strategy);
    } catch (IllegalArgumentException e) {
      exitWithErrorMessage(e.getMessage());
      return null;
    }
  }

  private static void exitWithErrorMessage(String errorMessage) {
    System.out.println("Error! Invalid arguments: " + errorMessage + "\n");
    System.out.println(
        "Usage: Cache <max-levels> <eviction-strategy> <capacity> [<capacity> ...]"
            + " | -config <config-file>");
    System.out.format(
        "%-32s%32s%n", "\t<max-levels>", "The maximum number of levels the cache may grow to.");
    System.out.format(
        "%-32s%32s%n",
        "\t<eviction-strategy>",
        "The eviction policy of every level. Options are: \"LFU\", \"LRU\" and \"FIFO\".");
    System.out.format(
        "%-32s%32s%n",
        "\t<capacity>",
        "The capacity of each level, from L1 downwards. One per level is expected.");
    throw new IllegalArgumentException(errorMessage);
  }

  public void run() {
    BufferedReader stdin =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    while (!stop) {
      CLICacheUtils.printPrompt();
      try {
        String cmdLine = stdin.readLine();
        handleCommand(cmdLine);
      } catch (IOException e) {
        stop = true;
        logger.error("CLI does not respond - Application terminated ");
      }
    }
  }

  public void handleCommand(String cmdLine) {
    final String[] tokens = CLICacheUtils.tokenize(cmdLine);

    switch (tokens[0]) {
      case "":
        break;
      case "quit":
        stop = true;
        CLICacheUtils.printMessage("Application exit!");
        break;
      case "write":
        handleWriteCommand(tokens);
        break;
      case "read":
        handleReadCommand(tokens);
        break;
      case "delete":
        handleDeleteCommand(tokens);
        break;
      case "print":
        System.out.println(cache);
        break;
      case "dump":
        handleDumpCommand();
        break;
      case "stats":
        handleStatsCommand();
        break;
      case "clear":
        cache.clear();
        CLICacheUtils.printMessage("All levels cleared.");
        break;
      case "logLevel":
        handleLogLevelCommand(tokens);
        break;
      case "help":
        CLICacheUtils.printHelp();
        break;
      default:
        CLICacheUtils.printMessage("Unknown command: " + tokens[0]);
        CLICacheUtils.printHelp();
    }
  }

  public boolean isStopped() {
    return stop;
  }

  public TieredCache<String, String> getCache() {
    return cache;
  }

  private void handleWriteCommand(String[] tokens) {
    if (tokens.length < 3) {
      CLICacheUtils.printMessage("Incorrect number of args!");
      return;
    }
    String key = tokens[1];
    String value = String.join(" ", Arrays.copyOfRange(tokens, 2, tokens.length));
    try {
      cache.write(key, value);
      CLICacheUtils.printMessage("WRITE_SUCCESS<" + key + ", " + value + ">");
    } catch (InvalidConfigurationException e) {
      CLICacheUtils.printError(e.getMessage());
      logger.error("Error during WRITE of " + key, e);
    }
  }

  private void handleReadCommand(String[] tokens) {
    if (tokens.length != 2) {
      CLICacheUtils.printMessage("Incorrect number of args!");
      return;
    }
    String key = tokens[1];
    try {
      Optional<String> value = cache.read(key);
      if (value.isPresent()) {
        CLICacheUtils.printMessage("READ_SUCCESS<" + key + ", " + value.get() + ">");
      } else {
        CLICacheUtils.printMessage("READ_MISS<" + key + ">");
      }
    } catch (InvalidConfigurationException e) {
      CLICacheUtils.printError(e.getMessage());
      logger.error("Error during READ of " + key, e);
    }
  }

  private void handleDeleteCommand(String[] tokens) {
    if (tokens.length != 2) {
      CLICacheUtils.printMessage("Incorrect number of args!");
      return;
    }
    cache.delete(tokens[1]);
    CLICacheUtils.printMessage("DELETE_SUCCESS<" + tokens[1] + ">");
  }

  private void handleDumpCommand() {
    Map<String, Map<String, String>> levels = new LinkedHashMap<>();
    List<Map<String, String>> snapshot = cache.snapshot();
    for (int i = 0; i < snapshot.size(); i++) {
      levels.put("L" + (i + 1), new LinkedHashMap<>(snapshot.get(i)));
    }
    System.out.println(gson.toJson(levels));
  }

  private void handleStatsCommand() {
    List<Map<String, String>> snapshot = cache.snapshot();
    for (int i = 0; i < snapshot.size(); i++) {
      CLICacheUtils.printMessage(
          "L"
              + (i + 1)
              + ": "
              + snapshot.get(i).size()
              + "/"
              + cache.getConfig().getCapacity(i)
              + " entries");
    }
    CLICacheUtils.printMessage(
        "Levels: "
            + cache.getTierCount()
            + "/"
            + cache.getMaxLevels()
            + ", dropped entries: "
            + cache.getDroppedCount());
  }

  private void handleLogLevelCommand(String[] tokens) {
    if (tokens.length != 2) {
      CLICacheUtils.printMessage("Invalid number of parameters!");
      return;
    }
    String level = LogSetup.setLevel(tokens[1]);
    if (level.equals(LogSetup.UNKNOWN_LEVEL)) {
      CLICacheUtils.printMessage("No valid log level!");
      CLICacheUtils.printPossibleLogLevels();
    } else {
      CLICacheUtils.printMessage("Log level changed to level " + level);
    }
  }
}
