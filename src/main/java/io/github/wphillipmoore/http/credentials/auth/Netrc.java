package io.github.wphillipmoore.http.credentials.auth;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A parsed netrc host table.
 *
 * <p>Reading and tokenizing the netrc file is the caller's concern; this type only holds the
 * result, keyed by machine name. The conventional {@code default} entry is stored under {@link
 * #DEFAULT_HOST}. The host map is defensively copied to guarantee unmodifiability.
 *
 * @param hosts entries keyed by host name, never null, unmodifiable
 */
public record Netrc(Map<String, NetrcEntry> hosts) {

  /** Key of the fallback entry used when no machine entry matches. */
  public static final String DEFAULT_HOST = "default";

  /** Validates and defensively copies the host map. */
  public Netrc {
    hosts = Map.copyOf(Objects.requireNonNull(hosts, "hosts"));
  }

  /**
   * Returns the entry for a host, falling back to the {@code default} entry.
   *
   * @param host the host name to look up
   * @return the matching entry, the default entry, or {@code null} if neither exists
   */
  public @Nullable NetrcEntry entry(String host) {
    Objects.requireNonNull(host, "host");
    NetrcEntry entry = hosts.get(host);
    return entry != null ? entry : hosts.get(DEFAULT_HOST);
  }
}
