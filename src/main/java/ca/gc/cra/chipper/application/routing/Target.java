package ca.gc.cra.chipper.application.routing;

import ca.gc.cra.chipper.application.port.LineSink;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Fans one rendered line out to every configured sink.
 * <p>A target without sinks is a silent no-op. Every sink is attempted even when an earlier one fails; failures are
 * reported together as a {@link SinkWriteException}.</p>
 * <p>Thread-safe: sinks serialize their own writes.</p>
 *
 * @since 0.1.0
 */
public final class Target {
  private static final Target NONE = new Target(List.of());

  private final List<LineSink> sinks;

  /**
   * Creates a target over the supplied sinks.
   *
   * @param sinks destinations in write order; must not be {@code null}
   */
  public Target(List<LineSink> sinks) {
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
  }

  public static Target of(LineSink... sinks) {
    return new Target(List.of(sinks));
  }

  /**
   * Returns a target that discards every line.
   *
   * @return shared no-op target
   */
  public static Target none() {
    return NONE;
  }

  /**
   * Writes {@code line} to every sink.
   *
   * @param line rendered line including its trailing newline
   * @throws SinkWriteException if at least one sink failed; remaining sinks were still written
   */
  public void write(String line) throws SinkWriteException {
    List<IOException> failures = null;
    List<String> failed = null;
    for (LineSink sink : sinks) {
      try {
        sink.write(line);
      } catch (IOException ex) {
        if (failures == null) {
          failures = new ArrayList<>(2);
          failed = new ArrayList<>(2);
        }
        failures.add(ex);
        failed.add(sink.describe());
      }
    }
    if (failures != null) {
      SinkWriteException error = new SinkWriteException(
          "failed to write to " + String.join(", ", failed), failures.get(0));
      for (int i = 1; i < failures.size(); i++) {
        error.addSuppressed(failures.get(i));
      }
      throw error;
    }
  }

  public boolean isEmpty() {
    return sinks.isEmpty();
  }

  public List<LineSink> sinks() {
    return sinks;
  }

  /**
   * Describes the sinks for diagnostics.
   *
   * @return comma separated sink descriptions, or {@code none}
   */
  public String describe() {
    if (sinks.isEmpty()) {
      return "none";
    }
    StringJoiner joiner = new StringJoiner(", ");
    for (LineSink sink : sinks) {
      joiner.add(sink.describe());
    }
    return joiner.toString();
  }

  @Override
  public String toString() {
    return "Target[" + describe() + "]";
  }
}
