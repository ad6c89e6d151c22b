package io.github.wphillipmoore.http.credentials.request;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Locale;
import java.util.Objects;

/**
 * An HTTP request under construction, before it is handed to a transport.
 *
 * <p>Unlike {@link HttpRequest}, the headers remain mutable so credentials can be attached or
 * replaced. Use {@link #toHttpRequest()} or {@link #applyTo(HttpRequest.Builder)} to hand the
 * request to the JDK client. Instances are not thread-safe.
 */
public final class OutgoingRequest {

  private final String method;
  private final URI uri;
  private final RequestHeaders headers = new RequestHeaders();

  /**
   * Creates a request with no headers.
   *
   * @param method the HTTP method, upper-cased on construction
   * @param uri the target URI, which may carry userinfo
   */
  public OutgoingRequest(String method, URI uri) {
    Objects.requireNonNull(method, "method");
    if (method.isBlank()) {
      throw new IllegalArgumentException("method is blank");
    }
    this.method = method.toUpperCase(Locale.ROOT);
    this.uri = Objects.requireNonNull(uri, "uri");
  }

  /** Creates a {@code GET} request for the URI. */
  public static OutgoingRequest get(URI uri) {
    return new OutgoingRequest("GET", uri);
  }

  /** Returns the HTTP method. */
  public String method() {
    return method;
  }

  /** Returns the target URI. */
  public URI uri() {
    return uri;
  }

  /** Returns the live, mutable header collection. */
  public RequestHeaders headers() {
    return headers;
  }

  /**
   * Copies every header value onto the builder, preserving repeated values.
   *
   * @param builder the JDK request builder
   * @return the same builder
   */
  public HttpRequest.Builder applyTo(HttpRequest.Builder builder) {
    Objects.requireNonNull(builder, "builder");
    for (String name : headers.names()) {
      for (HeaderValue value : headers.values(name)) {
        builder.header(name, value.value());
      }
    }
    return builder;
  }

  /** Builds a bodyless JDK {@link HttpRequest} carrying this request's method, URI and headers. */
  public HttpRequest toHttpRequest() {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder().uri(uri).method(method, HttpRequest.BodyPublishers.noBody());
    return applyTo(builder).build();
  }

  /** Renders the method and URI with any userinfo redacted. */
  @Override
  public String toString() {
    return method + " " + redactedUri();
  }

  private String redactedUri() {
    String authority = uri.getRawAuthority();
    int at = authority == null ? -1 : authority.lastIndexOf('@');
    if (at < 0) {
      return uri.toString();
    }
    StringBuilder sb = new StringBuilder();
    sb.append(uri.getScheme()).append("://").append(HeaderValue.REDACTED);
    sb.append(authority.substring(at));
    if (uri.getRawPath() != null) {
      sb.append(uri.getRawPath());
    }
    if (uri.getRawQuery() != null) {
      sb.append('?').append(uri.getRawQuery());
    }
    if (uri.getRawFragment() != null) {
      sb.append('#').append(uri.getRawFragment());
    }
    return sb.toString();
  }
}
