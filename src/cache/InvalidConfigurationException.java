package cache;

/** Thrown when a cache is asked to grow a tier that its configuration has no capacity for. */
public class InvalidConfigurationException extends RuntimeException {
  public InvalidConfigurationException(String message) {
    super("Invalid configuration: " + message);
  }
}
