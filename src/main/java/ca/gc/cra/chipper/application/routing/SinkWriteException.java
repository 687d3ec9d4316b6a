package ca.gc.cra.chipper.application.routing;

import java.io.IOException;

/**
 * Raised when one or more sinks of a {@link Target} could not be written.
 * <p>Individual sink failures are attached as suppressed exceptions.</p>
 *
 * @since 0.1.0
 */
public final class SinkWriteException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the failed destinations.
   *
   * @param message summary naming the failed sinks
   * @param cause first sink failure
   */
  public SinkWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
