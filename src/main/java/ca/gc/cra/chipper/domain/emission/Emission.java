package ca.gc.cra.chipper.domain.emission;

import ca.gc.cra.chipper.domain.tag.TagSet;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * <strong>What:</strong> One logging event: message, tags, timestamp and optional trace details.
 * <p><strong>Role:</strong> Domain value handed from the logger to every matching handler.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across handlers.</p>
 *
 * @param message message text appended after the rendered prefix; never {@code null}
 * @param tags normalized tags of the emission; never empty once dispatched
 * @param timestamp wall-clock reading captured once per emission
 * @param trace trace details, or {@code null} when the emission is not traced
 * @since 0.1.0
 */
public record Emission(String message, TagSet tags, ZonedDateTime timestamp, TraceInfo trace) {

  public Emission {
    message = message == null ? "" : message;
    Objects.requireNonNull(tags, "tags");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Returns a copy with a different tag set, used when a handler renders only the tags it matched.
   *
   * @param renderedTags tags to carry; must not be {@code null}
   * @return new emission sharing message, timestamp and trace
   */
  public Emission withTags(TagSet renderedTags) {
    return new Emission(message, renderedTags, timestamp, trace);
  }
}
