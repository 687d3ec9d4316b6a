package ca.gc.cra.chipper.application.port;

/**
 * Raised by a {@link TraceSource} that cannot introspect the caller. Never propagates out of an emission.
 *
 * @since 0.1.0
 */
public final class TraceCaptureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public TraceCaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
