package ca.gc.cra.chipper.infrastructure.target;

import ca.gc.cra.chipper.application.port.LineSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-wide registry of shared sinks.
 * <p><strong>Why:</strong> Writes are serialized per sink instance, so every handler writing to the same destination
 * must receive the same instance.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose singleton stdout and stderr sinks.</li>
 *   <li>Intern file sinks by normalized absolute path.</li>
 *   <li>Close every file sink at shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by a concurrent map; safe for concurrent lookups.</p>
 *
 * @since 0.1.0
 */
public final class LineSinks {
  private static final Logger log = LoggerFactory.getLogger(LineSinks.class);
  private static final StreamLineSink STDOUT = new StreamLineSink("stdout", () -> System.out);
  private static final StreamLineSink STDERR = new StreamLineSink("stderr", () -> System.err);
  private static final ConcurrentMap<Path, FileLineSink> FILES = new ConcurrentHashMap<>();

  private LineSinks() {
    // Utility
  }

  public static LineSink stdout() {
    return STDOUT;
  }

  public static LineSink stderr() {
    return STDERR;
  }

  /**
   * Returns the shared sink for {@code path}.
   *
   * @param path destination file; relative paths resolve against the working directory
   * @return sink shared by every caller naming the same file
   */
  public static LineSink file(Path path) {
    Objects.requireNonNull(path, "path");
    Path key = path.toAbsolutePath().normalize();
    return FILES.computeIfAbsent(key, FileLineSink::new);
  }

  /**
   * Closes every interned file sink. Sinks reopen on their next write.
   */
  public static void closeFiles() {
    for (FileLineSink sink : FILES.values()) {
      try {
        sink.close();
      } catch (IOException ex) {
        log.warn("Failed to close log file {}", sink.path(), ex);
      }
    }
  }
}
