package ca.gc.cra.chipper.domain.tag;

/**
 * Raised when a tag token is null, empty, or contains whitespace or control characters.
 *
 * @since 0.1.0
 */
public final class InvalidTagException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String token;

  /**
   * Creates an exception describing the rejected token.
   *
   * @param token offending token as supplied by the caller; may be {@code null}
   * @param reason short description of the violated rule
   */
  public InvalidTagException(String token, String reason) {
    super("invalid tag '" + token + "': " + reason);
    this.token = token;
  }

  /**
   * Returns the token that failed validation.
   *
   * @return raw token; may be {@code null}
   */
  public String token() {
    return token;
  }
}
