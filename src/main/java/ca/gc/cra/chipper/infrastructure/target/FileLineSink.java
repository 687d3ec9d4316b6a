package ca.gc.cra.chipper.infrastructure.target;

import ca.gc.cra.chipper.application.port.LineSink;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends lines to a UTF-8 file.
 * <p>The file is opened lazily on the first write, so an unwritable path surfaces as a write failure of the owning
 * handler rather than a startup error. After a failed write the writer is discarded and reopened on the next
 * attempt.</p>
 * <p>Synchronized to avoid interleaving lines when several emissions arrive concurrently.</p>
 *
 * @since 0.1.0
 */
public final class FileLineSink implements LineSink {
  private static final Logger log = LoggerFactory.getLogger(FileLineSink.class);

  private final Path path;
  private Writer writer;

  /**
   * Creates a file sink. Prefer {@link LineSinks#file(Path)} so handlers sharing a path share a lock.
   *
   * @param path destination file; parent directories are created on first write
   */
  public FileLineSink(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public synchronized void write(String line) throws IOException {
    try {
      Writer out = open();
      out.write(line);
      out.flush();
    } catch (IOException ex) {
      discard();
      throw ex;
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer != null) {
      Writer current = writer;
      writer = null;
      current.close();
    }
  }

  @Override
  public String describe() {
    return path.toString();
  }

  public Path path() {
    return path;
  }

  private Writer open() throws IOException {
    if (writer == null) {
      Path parent = path.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(
          path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
      log.debug("Opened log file {}", path);
    }
    return writer;
  }

  private void discard() {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException closeEx) {
      log.debug("Ignoring close failure for {} after write error", path, closeEx);
    }
    writer = null;
  }

  @Override
  public String toString() {
    return "FileLineSink[" + path + "]";
  }
}
