package ca.gc.cra.chipper.application.port;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * <strong>What:</strong> Port supplying the wall-clock reading stamped on each emission.
 * <p><strong>Why:</strong> Rendering must be reproducible in tests, so the logger never reads the system clock
 * directly.</p>
 * <p><strong>Role:</strong> Application port consumed by the logger once per emission.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; emissions may arrive from many threads.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.chipper.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current time in the zone used for rendering.
   *
   * @return current zoned time; never {@code null}
   */
  ZonedDateTime now();

  /**
   * Default {@link ClockPort} reading the system clock in the system default zone.
   */
  ClockPort SYSTEM = ZonedDateTime::now;

  /**
   * Returns a clock that always reports {@code instant}; used by tests and the render CLI.
   *
   * @param instant fixed reading; must not be {@code null}
   * @return fixed clock
   */
  static ClockPort fixed(ZonedDateTime instant) {
    Objects.requireNonNull(instant, "instant");
    return () -> instant;
  }
}
