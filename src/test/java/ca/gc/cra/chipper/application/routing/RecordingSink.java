package ca.gc.cra.chipper.application.routing;

import ca.gc.cra.chipper.application.port.LineSink;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** In-memory sink; optionally fails every write. */
final class RecordingSink implements LineSink {
  private final String name;
  private final boolean failing;
  private final List<String> lines = new ArrayList<>();

  private RecordingSink(String name, boolean failing) {
    this.name = name;
    this.failing = failing;
  }

  static RecordingSink named(String name) {
    return new RecordingSink(name, false);
  }

  static RecordingSink failing(String name) {
    return new RecordingSink(name, true);
  }

  @Override
  public synchronized void write(String line) throws IOException {
    if (failing) {
      throw new IOException(name + " is read-only");
    }
    lines.add(line);
  }

  @Override
  public String describe() {
    return name;
  }

  synchronized List<String> lines() {
    return List.copyOf(lines);
  }
}
