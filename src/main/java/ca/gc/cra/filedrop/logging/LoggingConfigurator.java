package ca.gc.cra.filedrop.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Bridges the {@code --verbose} CLI flag to the Logback root logger.
 *
 * <p>Other SLF4J bindings keep their configured level; a warning names the backend.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG so protocol steps of every session become visible.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level when Logback is the active backend.
   *
   * @param level new root level
   * @return {@code true} when the level was applied
   */
  static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic updates",
        level, factory.getClass().getName());
    return false;
  }
}
