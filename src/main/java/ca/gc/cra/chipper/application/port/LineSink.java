package ca.gc.cra.chipper.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Outbound port for one writable destination (a file, stdout or stderr).
 * <p><strong>Why:</strong> Keeps routing and formatting independent from how bytes reach the destination.</p>
 * <p><strong>Thread-safety:</strong> Implementations must serialize {@link #write(String)} so concurrent emissions
 * never interleave bytes within one line.</p>
 * <p><strong>Performance:</strong> Writes are expected to be fast local I/O; a blocked sink blocks the caller.</p>
 *
 * @since 0.1.0
 */
public interface LineSink extends AutoCloseable {
  /**
   * Appends one fully rendered line, including its trailing newline, and flushes it.
   *
   * @param line text to append; never {@code null}
   * @throws IOException if the destination cannot be written
   */
  void write(String line) throws IOException;

  /**
   * Returns a short description for diagnostics (e.g., {@code stdout} or a file path).
   *
   * @return sink description
   */
  String describe();

  @Override
  default void close() throws IOException {}
}
