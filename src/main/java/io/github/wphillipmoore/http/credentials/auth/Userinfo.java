package io.github.wphillipmoore.http.credentials.auth;

import io.github.wphillipmoore.http.credentials.exception.MalformedUserinfoException;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * The raw, still percent-encoded userinfo of a URI.
 *
 * @param username text before the first {@code :}, empty if the URI has no userinfo
 * @param password text after the first {@code :}, or {@code null} if there is no separator
 */
record Userinfo(String username, @Nullable String password) {

  static final String USERNAME = "username";
  static final String PASSWORD = "password";

  /**
   * Splits the raw userinfo of the URI at the first {@code :}.
   *
   * <p>Authorities whose host is not a valid server name (an {@code _} in the host, for example)
   * are parsed by {@link URI} as registry-based and expose no userinfo; for those the userinfo is
   * the text before the last {@code @} of the raw authority.
   */
  static Userinfo of(URI uri) {
    String raw = uri.getRawUserInfo();
    if (raw == null) {
      String authority = uri.getRawAuthority();
      int at = authority == null ? -1 : authority.lastIndexOf('@');
      if (at < 0) {
        return new Userinfo("", null);
      }
      raw = authority.substring(0, at);
    }
    int colon = raw.indexOf(':');
    if (colon < 0) {
      return new Userinfo(raw, null);
    }
    return new Userinfo(raw.substring(0, colon), raw.substring(colon + 1));
  }

  /**
   * Returns the lower-cased host of the URI.
   *
   * <p>Registry-based authorities are handled like in {@link #of(URI)}: the host is the text after
   * the last {@code @}, without a trailing port.
   *
   * @return the host, or {@code null} if the URI has none
   */
  static @Nullable String host(URI uri) {
    String host = uri.getHost();
    if (host == null) {
      String authority = uri.getRawAuthority();
      if (authority == null) {
        return null;
      }
      host = authority.substring(authority.lastIndexOf('@') + 1);
      int portColon = host.lastIndexOf(':');
      if (portColon > host.lastIndexOf(']')) {
        host = host.substring(0, portColon);
      }
    }
    return host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
  }

  /** Returns whether neither a username nor a password separator is present. */
  boolean isEmpty() {
    return username.isEmpty() && password == null;
  }

  /**
   * Percent-decodes a userinfo component as UTF-8.
   *
   * <p>{@code +} is taken literally. Malformed escapes and invalid UTF-8 are rejected.
   *
   * @param encoded the percent-encoded text
   * @param component {@link #USERNAME} or {@link #PASSWORD}, used for error reporting
   * @return the decoded text
   * @throws MalformedUserinfoException if the text cannot be decoded
   */
  static String decode(String encoded, String component) {
    if (encoded.indexOf('%') < 0) {
      return encoded;
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(encoded.length());
    int i = 0;
    while (i < encoded.length()) {
      char c = encoded.charAt(i);
      if (c != '%') {
        int end = i + 1;
        while (end < encoded.length() && encoded.charAt(end) != '%') {
          end++;
        }
        bytes.writeBytes(encoded.substring(i, end).getBytes(StandardCharsets.UTF_8));
        i = end;
        continue;
      }
      if (i + 2 >= encoded.length()) {
        throw new MalformedUserinfoException("Truncated percent-escape in " + component, component);
      }
      int hi = Character.digit(encoded.charAt(i + 1), 16);
      int lo = Character.digit(encoded.charAt(i + 2), 16);
      if (hi < 0 || lo < 0) {
        throw new MalformedUserinfoException("Invalid percent-escape in " + component, component);
      }
      bytes.write((hi << 4) | lo);
      i += 3;
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes.toByteArray()))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedUserinfoException(
          "Percent-decoded " + component + " is not valid UTF-8", component, e);
    }
  }
}
