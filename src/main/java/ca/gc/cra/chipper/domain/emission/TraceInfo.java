package ca.gc.cra.chipper.domain.emission;

/**
 * Call-site and exception details attached to emissions tagged {@code trace}.
 *
 * @param file source file name without directories; empty when unknown
 * @param line line number; {@code -1} when unknown
 * @param module enclosing routine rendered as {@code SimpleClass.method}; empty when unknown
 * @param exception formatted stack trace of a caller-supplied throwable; empty when absent
 * @since 0.1.0
 */
public record TraceInfo(String file, int line, String module, String exception) {
  private static final TraceInfo UNKNOWN = new TraceInfo("", -1, "", "");

  public TraceInfo {
    file = file == null ? "" : file;
    module = module == null ? "" : module;
    exception = exception == null ? "" : exception;
    line = line < 0 ? -1 : line;
  }

  /**
   * Returns trace info with every field unknown.
   *
   * @return shared empty instance
   */
  public static TraceInfo unknown() {
    return UNKNOWN;
  }

  /**
   * Returns a copy carrying the supplied exception text.
   *
   * @param exceptionText formatted stack trace; {@code null} clears it
   * @return new trace info
   */
  public TraceInfo withException(String exceptionText) {
    return new TraceInfo(file, line, module, exceptionText);
  }

  /**
   * Renders the line number, or an empty string when unknown.
   *
   * @return line as text
   */
  public String lineText() {
    return line < 0 ? "" : Integer.toString(line);
  }

  public boolean hasException() {
    return !exception.isEmpty();
  }
}
