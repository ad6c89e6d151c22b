package io.github.wphillipmoore.http.credentials.request;

import java.util.Objects;

/**
 * Immutable HTTP header value with a sensitivity flag.
 *
 * <p>Sensitive values are rendered as {@code ██} by {@link #toString()} and by {@link
 * RequestHeaders#toString()}, keeping secrets out of logs and exception messages. Equality compares
 * the value only; the flag affects rendering, not identity.
 */
public final class HeaderValue {

  static final String REDACTED = "██";

  private final String value;
  private final boolean sensitive;

  private HeaderValue(String value, boolean sensitive) {
    this.value = validate(value);
    this.sensitive = sensitive;
  }

  /**
   * Creates a non-sensitive header value.
   *
   * @param value the header value, never null
   * @return the header value
   * @throws IllegalArgumentException if the value contains CR, LF or NUL
   */
  public static HeaderValue of(String value) {
    return new HeaderValue(value, false);
  }

  /**
   * Creates a sensitive header value.
   *
   * @param value the header value, never null
   * @return the header value
   * @throws IllegalArgumentException if the value contains CR, LF or NUL
   */
  public static HeaderValue sensitive(String value) {
    return new HeaderValue(value, true);
  }

  /** Returns a copy of this value with the given sensitivity. */
  public HeaderValue withSensitive(boolean sensitive) {
    return sensitive == this.sensitive ? this : new HeaderValue(value, sensitive);
  }

  /** Returns the raw header value. */
  public String value() {
    return value;
  }

  /** Returns whether the value must be excluded from diagnostic output. */
  public boolean isSensitive() {
    return sensitive;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof HeaderValue that && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return sensitive ? REDACTED : value;
  }

  private static String validate(String value) {
    Objects.requireNonNull(value, "value");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\r' || c == '\n' || c == '\0') {
        throw new IllegalArgumentException(
            "Unexpected char 0x" + Integer.toHexString(c) + " at " + i + " in header value");
      }
    }
    return value;
  }
}
