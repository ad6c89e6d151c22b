package io.github.wphillipmoore.http.credentials.auth;

import java.util.Objects;

/**
 * A single {@code machine} (or {@code default}) entry of a parsed netrc file.
 *
 * @param login the login name, never null
 * @param password the password, never null, possibly empty
 */
public record NetrcEntry(String login, String password) {

  /** Validates that login and password are non-null. */
  public NetrcEntry {
    Objects.requireNonNull(login, "login");
    Objects.requireNonNull(password, "password");
  }

  /** Renders the login only; the password is never included. */
  @Override
  public String toString() {
    return "NetrcEntry[login=" + login + ", password=****]";
  }
}
