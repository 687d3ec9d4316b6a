package ca.gc.cra.chipper.domain.format;

/**
 * Raised for malformed templates, unknown placeholders and unsupported strftime directives.
 * <p>Thrown at handler construction for static misconfiguration; at emission time the owning handler's
 * write is skipped and other handlers proceed.</p>
 *
 * @since 0.1.0
 */
public final class TemplateException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the supplied detail message.
   *
   * @param message description including the offending template text
   */
  public TemplateException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping a lower-level failure.
   *
   * @param message description including the offending template text
   * @param cause underlying failure
   */
  public TemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}
