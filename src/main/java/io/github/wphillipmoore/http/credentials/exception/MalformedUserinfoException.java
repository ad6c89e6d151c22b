package io.github.wphillipmoore.http.credentials.exception;

import java.util.Objects;

/**
 * Thrown when the userinfo of a URL cannot be percent-decoded.
 *
 * <p>The {@code component} identifies which half of the userinfo failed, either {@code "username"}
 * or {@code "password"}. The offending text itself is not retained.
 */
public final class MalformedUserinfoException extends CredentialsException {

  private static final long serialVersionUID = 1L;

  private final String component;

  /**
   * Creates a malformed userinfo exception.
   *
   * @param message description of the decoding failure
   * @param component the userinfo component that failed to decode
   */
  public MalformedUserinfoException(String message, String component) {
    super(message);
    this.component = Objects.requireNonNull(component, "component");
  }

  /**
   * Creates a malformed userinfo exception with a cause.
   *
   * @param message description of the decoding failure
   * @param component the userinfo component that failed to decode
   * @param cause the underlying decoding failure
   */
  public MalformedUserinfoException(String message, String component, Throwable cause) {
    super(message, cause);
    this.component = Objects.requireNonNull(component, "component");
  }

  /** Returns the userinfo component that failed to decode. */
  public String getComponent() {
    return component;
  }
}
