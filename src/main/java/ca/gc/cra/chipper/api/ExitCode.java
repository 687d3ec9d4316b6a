package ca.gc.cra.chipper.api;

/**
 * Process exit statuses returned by the {@code chipper} commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** {@code render} named a handler whose subscription does not overlap the supplied tags. */
  NOT_MATCHED(1),
  /** Arguments were missing, duplicated or malformed, including invalid tags. */
  INVALID_ARGS(2),
  /** The definition file could not be read. */
  IO_ERROR(3),
  /** The definition file parsed but describes an invalid logger. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
