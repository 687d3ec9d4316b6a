package ca.gc.cra.chipper.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the verbosity of the library's own diagnostics channel.
 * <p><strong>Why:</strong> Handler failures, trace degradation and sink lifecycle events are reported through SLF4J;
 * operators raise the level with {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String LIBRARY_LOGGER = "ca.gc.cra.chipper";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the library logger threshold to DEBUG.
   */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  /**
   * Raises the library logger threshold to ERROR, silencing isolated handler failures.
   */
  public static void enableQuietLogging() {
    setLevel(Level.ERROR);
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(LIBRARY_LOGGER);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
