package io.github.wphillipmoore.http.credentials.auth;

import io.github.wphillipmoore.http.credentials.exception.MalformedAuthorizationHeaderException;
import io.github.wphillipmoore.http.credentials.request.HeaderValue;
import io.github.wphillipmoore.http.credentials.request.OutgoingRequest;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP Basic Authentication credentials.
 *
 * <p>Credentials are read from a URL's userinfo, a parsed netrc table or an {@code Authorization}
 * header, and written back as an {@code Authorization: Basic} header. The static factories return
 * {@code null} when the source carries no credentials, and throw a {@link
 * io.github.wphillipmoore.http.credentials.exception.CredentialsException} when it carries
 * credentials that are malformed.
 *
 * <p>An empty username is always stored as {@code null}. An empty password is a distinct, valid
 * password and is kept as is.
 *
 * @param username the username, or {@code null} if absent; never empty
 * @param password the password, or {@code null} if absent
 */
public record Credentials(@Nullable String username, @Nullable String password) {

  /** Name of the request header carrying credentials. */
  public static final String AUTHORIZATION = "Authorization";

  /** Scheme prefix of an HTTP Basic {@code Authorization} header value. */
  public static final String BASIC_PREFIX = "Basic ";

  private static final String BASIC_SCHEME = "Basic";
  private static final Logger LOG = LoggerFactory.getLogger(Credentials.class);

  /** Normalizes an empty username to {@code null}. */
  public Credentials {
    if (username != null && username.isEmpty()) {
      username = null;
    }
  }

  /** Returns whether neither a username nor a password is present. */
  public boolean isEmpty() {
    return username == null && password == null;
  }

  /**
   * Looks up credentials for a URL's host in a netrc table.
   *
   * <p>Hosts are compared lower-cased. The exact host entry is preferred over the {@code default}
   * entry. If {@code
   * expectedUsername} is given it must equal the matched entry's login.
   *
   * @param netrc the parsed netrc table
   * @param url the URL whose host is looked up
   * @param expectedUsername the username the caller requires, or {@code null} to accept any login
   * @return the matching credentials, or {@code null} if the URL has no host, no entry matches, or
   *     the login differs from {@code expectedUsername}
   */
  public static @Nullable Credentials fromNetrc(
      Netrc netrc, URI url, @Nullable String expectedUsername) {
    Objects.requireNonNull(netrc, "netrc");
    Objects.requireNonNull(url, "url");
    String host = Userinfo.host(url);
    if (host == null) {
      return null;
    }
    NetrcEntry entry = netrc.entry(host);
    if (entry == null) {
      LOG.debug("No netrc entry for host {}", host);
      return null;
    }
    if (expectedUsername != null && !expectedUsername.equals(entry.login())) {
      LOG.debug("Netrc login for host {} does not match the requested username", host);
      return null;
    }
    return new Credentials(entry.login(), entry.password());
  }

  /**
   * Parses credentials from the userinfo of a URL.
   *
   * <p>Both components are percent-decoded as UTF-8.
   *
   * @param url the URL
   * @return the credentials, or {@code null} if the URL has neither a username nor a password
   * @throws io.github.wphillipmoore.http.credentials.exception.MalformedUserinfoException if a
   *     component cannot be percent-decoded
   */
  public static @Nullable Credentials fromUrl(URI url) {
    Objects.requireNonNull(url, "url");
    Userinfo userinfo = Userinfo.of(url);
    if (userinfo.isEmpty()) {
      return null;
    }
    String username = Userinfo.decode(userinfo.username(), Userinfo.USERNAME);
    String rawPassword = userinfo.password();
    String password = rawPassword == null ? null : Userinfo.decode(rawPassword, Userinfo.PASSWORD);
    return new Credentials(username, password);
  }

  /**
   * Parses credentials from a request.
   *
   * <p>Credentials embedded in the request URL take priority over the {@code Authorization} header.
   *
   * @param request the request
   * @return the credentials, or {@code null} if neither source carries any
   */
  public static @Nullable Credentials fromRequest(OutgoingRequest request) {
    Objects.requireNonNull(request, "request");
    Credentials credentials = fromUrl(request.uri());
    if (credentials != null) {
      LOG.debug("Using credentials from the URL for host {}", Userinfo.host(request.uri()));
      return credentials;
    }
    HeaderValue header = request.headers().get(AUTHORIZATION);
    if (header == null) {
      return null;
    }
    credentials = fromHeaderValue(header);
    if (credentials != null) {
      LOG.debug(
          "Using credentials from the Authorization header for host {}",
          Userinfo.host(request.uri()));
    }
    return credentials;
  }

  /**
   * Parses credentials from an {@code Authorization} header value.
   *
   * <p>Only HTTP Basic Authentication is supported. After splitting at the first {@code :}, an
   * empty username or an empty password is treated as absent.
   *
   * @param header the header value
   * @return the credentials, or {@code null} if the header uses another scheme
   * @throws MalformedAuthorizationHeaderException if the payload is not base64 encoded UTF-8 or
   *     lacks a {@code :} separator
   */
  public static @Nullable Credentials fromHeaderValue(HeaderValue header) {
    Objects.requireNonNull(header, "header");
    String value = header.value();
    if (!value.startsWith(BASIC_PREFIX)) {
      LOG.debug("Ignoring Authorization header without the Basic scheme");
      return null;
    }
    String decoded = decodeBasicPayload(value.substring(BASIC_PREFIX.length()));
    int colon = decoded.indexOf(':');
    if (colon < 0) {
      throw new MalformedAuthorizationHeaderException(
          "HTTP Basic Authentication should include a `:` separator", BASIC_SCHEME);
    }
    String username = decoded.substring(0, colon);
    String password = decoded.substring(colon + 1);
    return new Credentials(
        username.isEmpty() ? null : username, password.isEmpty() ? null : password);
  }

  /**
   * Creates an HTTP Basic Authentication header value for these credentials.
   *
   * <p>An absent username or password is encoded as the empty string. The value is flagged
   * sensitive.
   *
   * @return the header value
   */
  public HeaderValue toHeaderValue() {
    String userPass = (username == null ? "" : username) + ":" + (password == null ? "" : password);
    String encoded = Base64.getEncoder().encodeToString(userPass.getBytes(StandardCharsets.UTF_8));
    return HeaderValue.sensitive(BASIC_PREFIX + encoded);
  }

  /**
   * Attaches these credentials to a request.
   *
   * <p>Every existing {@code Authorization} value is replaced.
   *
   * @param request the request to modify
   */
  public void authenticate(OutgoingRequest request) {
    Objects.requireNonNull(request, "request");
    request.headers().set(AUTHORIZATION, toHeaderValue());
  }

  /** Renders the username and whether a password is present; the password is never included. */
  @Override
  public String toString() {
    return "Credentials[username="
        + username
        + ", password="
        + (password == null ? "null" : "****")
        + "]";
  }

  private static String decodeBasicPayload(String payload) {
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(payload);
    } catch (IllegalArgumentException e) {
      throw new MalformedAuthorizationHeaderException(
          "HTTP Basic Authentication should be base64 encoded", BASIC_SCHEME, e);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedAuthorizationHeaderException(
          "HTTP Basic Authentication should encode UTF-8 text", BASIC_SCHEME, e);
    }
  }
}
