package ca.gc.cra.chipper.config;

/**
 * Declared destinations of a handler. Several may be set at once; the same line is written to each.
 *
 * @param filename path of a file to append to; empty when no file is configured
 * @param stdout whether lines go to standard output
 * @param stderr whether lines go to standard error
 * @since 0.1.0
 */
public record TargetDefinition(String filename, boolean stdout, boolean stderr) {
  private static final TargetDefinition STDOUT = new TargetDefinition("", true, false);

  public TargetDefinition {
    filename = filename == null ? "" : filename.trim();
  }

  /**
   * Returns a definition writing to standard output only.
   *
   * @return stdout definition
   */
  public static TargetDefinition stdoutOnly() {
    return STDOUT;
  }

  public static TargetDefinition file(String filename) {
    return new TargetDefinition(filename, false, false);
  }

  /**
   * Indicates whether no destination is configured; such a handler discards its lines.
   *
   * @return {@code true} when nothing is configured
   */
  public boolean isEmpty() {
    return filename.isEmpty() && !stdout && !stderr;
  }
}
