package logger;

import java.io.IOException;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/** Configures the root Log4J logger for the cache CLI. */
public class LogSetup {

  public static final String UNKNOWN_LEVEL = "UnknownLevel";
  public static final String PATTERN = "%-5p | %d{ISO8601} | [%t] | %l --> %m%n";
  private static final Logger logger = Logger.getRootLogger();
  private final String logdir;
  private final boolean logToStdout;

  /**
   * Replaces the root logger's appenders with a file appender and, optionally, a console
   * appender.
   *
   * @param logdir the destination (i.e. directory + filename) for the persistent logging
   *     information.
   * @param level the initial root level.
   * @param logToStdout also print log lines to the console.
   * @throws IOException if the log destination could not be found.
   */
  public LogSetup(String logdir, Level level, boolean logToStdout) throws IOException {
    this.logdir = logdir;
    this.logToStdout = logToStdout;
    initialize(level);
  }

  private void initialize(Level level) throws IOException {
    PatternLayout layout = new PatternLayout(PATTERN);
    FileAppender fileAppender = new FileAppender(layout, logdir, false);

    logger.removeAllAppenders();
    if (logToStdout) {
      logger.addAppender(new ConsoleAppender(layout));
    }
    logger.addAppender(fileAppender);
    logger.setLevel(level);
  }

  /**
   * Change the root level.
   *
   * @param levelString one of ALL | DEBUG | INFO | WARN | ERROR | FATAL | OFF.
   * @return the new level's name, or UNKNOWN_LEVEL if levelString is not a level.
   */
  public static String setLevel(String levelString) {
    Level level = Level.toLevel(levelString, null);
    if (level == null) {
      return UNKNOWN_LEVEL;
    }
    logger.setLevel(level);
    return level.toString();
  }
}
