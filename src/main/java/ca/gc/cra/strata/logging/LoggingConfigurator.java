package ca.gc.cra.strata.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts strata log verbosity from command-line flags.
 * <p><strong>Why:</strong> Merge reports are INFO by default; operators may want every leaf set (DEBUG) or only
 * warnings when scripting the tool.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend does not support dynamic levels.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BASE_LOGGER = "ca.gc.cra.strata";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root and strata logger levels to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
    setLevel(BASE_LOGGER, Level.DEBUG);
  }

  /**
   * Restricts strata loggers to warnings and errors.
   */
  public static void enableQuietLogging() {
    setLevel(BASE_LOGGER, Level.WARN);
  }

  private static void setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
