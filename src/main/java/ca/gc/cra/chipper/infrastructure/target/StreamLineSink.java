package ca.gc.cra.chipper.infrastructure.target;

import ca.gc.cra.chipper.application.port.LineSink;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Writes lines to a process stream such as stdout or stderr.
 * <p>The stream is resolved on every write so {@link System#setOut(PrintStream)} redirections are honored.
 * Writes are synchronized on this sink; use the shared instances from {@link LineSinks} so every handler writing to
 * the same stream shares one lock.</p>
 *
 * @since 0.1.0
 */
public final class StreamLineSink implements LineSink {
  private final String name;
  private final Supplier<PrintStream> stream;

  /**
   * Creates a stream sink.
   *
   * @param name description used in diagnostics (e.g., {@code stdout})
   * @param stream supplier resolving the current stream
   */
  public StreamLineSink(String name, Supplier<PrintStream> stream) {
    this.name = Objects.requireNonNull(name, "name");
    this.stream = Objects.requireNonNull(stream, "stream");
  }

  @Override
  public synchronized void write(String line) throws IOException {
    PrintStream out = stream.get();
    if (out == null) {
      throw new IOException(name + " is not available");
    }
    out.print(line);
    out.flush();
    if (out.checkError()) {
      throw new IOException("error writing to " + name);
    }
  }

  @Override
  public String describe() {
    return name;
  }

  @Override
  public String toString() {
    return "StreamLineSink[" + name + "]";
  }
}
