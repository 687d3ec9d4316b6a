package ca.gc.cra.chipper.application.routing;

import java.util.Locale;

/**
 * Decides when the default handler receives an emission in addition to the subscribed handlers.
 *
 * @since 0.1.0
 */
public enum DefaultRouting {
  /** Every emission reaches the default handler with all of its tags. */
  ALWAYS,
  /** Only tags that no handler claimed reach the default handler; skipped when every tag was claimed. */
  UNMATCHED,
  /** The default handler is never invoked. */
  DISABLED;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code always}, {@code unmatched} or {@code disabled} (case-insensitive); blank means {@link #ALWAYS}
   * @return routing mode
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static DefaultRouting from(String raw) {
    if (raw == null || raw.isBlank()) {
      return ALWAYS;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "always" -> ALWAYS;
      case "unmatched" -> UNMATCHED;
      case "disabled", "none" -> DISABLED;
      default -> throw new IllegalArgumentException(
          "routing must be one of always, unmatched, disabled (was '" + raw + "')");
    };
  }
}
