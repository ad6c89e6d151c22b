package io.github.wphillipmoore.http.credentials.exception;

/**
 * Base exception for malformed credential material.
 *
 * <p>This is an unchecked exception hierarchy. A missing credential is never reported with an
 * exception; these are raised only when credential material is present but violates its encoding
 * rules. Messages never contain usernames, passwords or header values.
 */
public sealed class CredentialsException extends RuntimeException
    permits MalformedAuthorizationHeaderException, MalformedUserinfoException {

  /** Creates an exception with the given message. */
  public CredentialsException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public CredentialsException(String message, Throwable cause) {
    super(message, cause);
  }
}
