package ca.gc.cra.chipper.infrastructure.time;

import ca.gc.cra.chipper.application.port.ClockPort;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates a system clock adapter in the system default zone.
   */
  public SystemClockAdapter() {
    this(Clock.systemDefaultZone());
  }

  /**
   * Creates a system clock adapter rendering in {@code zone}.
   *
   * @param zone rendering zone; must not be {@code null}
   */
  public SystemClockAdapter(ZoneId zone) {
    this(Clock.system(Objects.requireNonNull(zone, "zone")));
  }

  SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current time.
   *
   * @return current zoned time
   * @implNote Delegates to {@link ZonedDateTime#now(Clock)} without smoothing.
   */
  @Override
  public ZonedDateTime now() {
    return ZonedDateTime.now(clock);
  }

  public ZoneId zone() {
    return clock.getZone();
  }
}
