package ca.gc.cra.chipper.domain.format;

import java.util.Locale;

/**
 * Per-tag transform applied before the tag template.
 * <p>Invoked synchronously once per rendered tag; implementations must be side-effect free and thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TagTransform {
  /**
   * Transforms one normalized tag.
   *
   * @param tag lowercase tag token
   * @return text handed to the tag template; {@code null} renders as an empty string
   */
  String apply(String tag);

  /** Upper-cases and trims the tag. */
  TagTransform UPPER_TRIMMED = tag -> tag.toUpperCase(Locale.ROOT).trim();

  /** Lower-cases and trims the tag. */
  TagTransform LOWER_TRIMMED = tag -> tag.toLowerCase(Locale.ROOT).trim();

  /** Leaves the tag untouched. */
  TagTransform IDENTITY = tag -> tag;

  /**
   * Resolves a transform by configuration name.
   *
   * @param name one of {@code upper}, {@code lower} or {@code none} (case-insensitive)
   * @return matching transform
   * @throws IllegalArgumentException if the name is not recognized
   */
  static TagTransform named(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("tag_formatter must not be blank");
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "upper" -> UPPER_TRIMMED;
      case "lower" -> LOWER_TRIMMED;
      case "none", "identity" -> IDENTITY;
      default -> throw new IllegalArgumentException(
          "tag_formatter must be one of upper, lower, none (was '" + name + "')");
    };
  }
}
