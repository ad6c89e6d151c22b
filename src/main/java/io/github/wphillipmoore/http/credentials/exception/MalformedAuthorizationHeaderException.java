package io.github.wphillipmoore.http.credentials.exception;

import java.util.Objects;

/**
 * Thrown when an {@code Authorization} header names a supported scheme but its payload does not
 * conform to that scheme.
 *
 * <p>For HTTP Basic Authentication the payload must be base64 encoded UTF-8 containing a {@code :}
 * separator.
 */
public final class MalformedAuthorizationHeaderException extends CredentialsException {

  private static final long serialVersionUID = 1L;

  private final String scheme;

  /**
   * Creates a malformed header exception.
   *
   * @param message description of the violation
   * @param scheme the authentication scheme named by the header
   */
  public MalformedAuthorizationHeaderException(String message, String scheme) {
    super(message);
    this.scheme = Objects.requireNonNull(scheme, "scheme");
  }

  /**
   * Creates a malformed header exception with a cause.
   *
   * @param message description of the violation
   * @param scheme the authentication scheme named by the header
   * @param cause the underlying decoding failure
   */
  public MalformedAuthorizationHeaderException(String message, String scheme, Throwable cause) {
    super(message, cause);
    this.scheme = Objects.requireNonNull(scheme, "scheme");
  }

  /** Returns the authentication scheme named by the offending header. */
  public String getScheme() {
    return scheme;
  }
}
