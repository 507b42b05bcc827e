package ca.gc.cra.ctscan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback levels from CLI flags.
 * <p><strong>Why:</strong> {@code --verbose} raises logging to DEBUG without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Call once during CLI start-up.</p>
 *
 * @implNote Only Logback supports the change; other SLF4J backends log a warning and keep their levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String APP_LOGGER = "ca.gc.cra.ctscan";

  private LoggingConfigurator() {}

  /**
   * Raises the root and application loggers to DEBUG.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      Logger app = context.getLogger(APP_LOGGER);
      if (app.getLevel() != null && app.getLevel().isGreaterOrEqual(Level.INFO)) {
        app.setLevel(Level.DEBUG);
      }
      log.debug("Verbose logging enabled");
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
