package ca.gc.cra.chipper;

import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.config.TagLoggerFactory;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide access point for the shared {@link TagLogger}.
 *
 * <p>Applications either call {@link #initialize(TagLogger)} once at startup or let the first {@link #log()} install
 * the default logger, which writes every emission to standard output.</p>
 *
 * <pre>{@code
 * Chipper.initialize(TagLoggerFactory.load(Path.of("chipper.yaml")));
 * Chipper.log().log("Connected", "sql", "warning");
 * Chipper.log().invoke("general_info", "Started");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Chipper {
  private static final AtomicReference<TagLogger> INSTANCE = new AtomicReference<>();

  private Chipper() {
    // Utility
  }

  /**
   * Installs the shared logger.
   *
   * @param logger logger to share; must not be {@code null}
   * @throws IllegalStateException if a logger was already installed or lazily created
   */
  public static void initialize(TagLogger logger) {
    Objects.requireNonNull(logger, "logger");
    if (!INSTANCE.compareAndSet(null, logger)) {
      throw new IllegalStateException("Chipper logger already initialized");
    }
  }

  /**
   * Returns the shared logger, installing the default one on first use.
   *
   * @return shared logger
   */
  public static TagLogger log() {
    TagLogger current = INSTANCE.get();
    if (current != null) {
      return current;
    }
    INSTANCE.compareAndSet(null, TagLoggerFactory.defaultLogger());
    return INSTANCE.get();
  }

  public static boolean isInitialized() {
    return INSTANCE.get() != null;
  }

  static void resetForTesting() {
    INSTANCE.set(null);
  }
}
