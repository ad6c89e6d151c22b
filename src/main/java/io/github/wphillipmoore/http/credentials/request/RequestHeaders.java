package io.github.wphillipmoore.http.credentials.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Mutable, case-insensitive, multi-valued collection of request headers.
 *
 * <p>Header names keep the casing they were first added with. {@link #toString()} redacts values
 * that are flagged sensitive as well as the values of well-known credential-bearing headers.
 *
 * <p>Instances are not thread-safe.
 */
public final class RequestHeaders {

  private static final Set<String> SENSITIVE_NAMES =
      Set.of("authorization", "proxy-authorization", "cookie", "set-cookie");

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /** Creates an empty header collection. */
  public RequestHeaders() {}

  /**
   * Appends a value, keeping any values already present for the name.
   *
   * @param name the header name
   * @param value the value to append
   * @return this collection
   */
  public RequestHeaders add(String name, HeaderValue value) {
    Objects.requireNonNull(value, "value");
    entries.computeIfAbsent(key(name), k -> new Entry(name)).values.add(value);
    return this;
  }

  /** Appends a non-sensitive value. */
  public RequestHeaders add(String name, String value) {
    return add(name, HeaderValue.of(value));
  }

  /**
   * Replaces every value for the name with a single value.
   *
   * @param name the header name
   * @param value the replacement value
   * @return this collection
   */
  public RequestHeaders set(String name, HeaderValue value) {
    Objects.requireNonNull(value, "value");
    Entry entry = new Entry(name);
    entry.values.add(value);
    entries.put(key(name), entry);
    return this;
  }

  /** Replaces every value for the name with a single non-sensitive value. */
  public RequestHeaders set(String name, String value) {
    return set(name, HeaderValue.of(value));
  }

  /**
   * Returns the first value for the name.
   *
   * @param name the header name, matched case-insensitively
   * @return the first value, or {@code null} if the header is absent
   */
  public @Nullable HeaderValue get(String name) {
    Entry entry = entries.get(key(name));
    return entry == null ? null : entry.values.get(0);
  }

  /** Returns every value for the name in insertion order, or an empty list. */
  public List<HeaderValue> values(String name) {
    Entry entry = entries.get(key(name));
    return entry == null ? List.of() : Collections.unmodifiableList(entry.values);
  }

  /** Returns whether at least one value is present for the name. */
  public boolean contains(String name) {
    return entries.containsKey(key(name));
  }

  /**
   * Removes every value for the name.
   *
   * @return whether any value was removed
   */
  public boolean remove(String name) {
    return entries.remove(key(name)) != null;
  }

  /** Returns the header names in insertion order, with their original casing. */
  public List<String> names() {
    List<String> names = new ArrayList<>(entries.size());
    entries.values().forEach(entry -> names.add(entry.name));
    return Collections.unmodifiableList(names);
  }

  /** Returns the number of distinct header names. */
  public int size() {
    return entries.size();
  }

  /**
   * Flattens the headers to a single value per name per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}. The returned map
   * holds raw values, including sensitive ones.
   *
   * @return an unmodifiable name-to-value map in insertion order
   */
  public Map<String, String> toMap() {
    Map<String, String> result = new LinkedHashMap<>();
    for (Entry entry : entries.values()) {
      List<String> raw = new ArrayList<>(entry.values.size());
      entry.values.forEach(value -> raw.add(value.value()));
      result.put(entry.name, String.join(", ", raw));
    }
    return Collections.unmodifiableMap(result);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries.values()) {
      boolean sensitiveName = SENSITIVE_NAMES.contains(key(entry.name));
      for (HeaderValue value : entry.values) {
        sb.append(entry.name).append(": ");
        sb.append(sensitiveName ? HeaderValue.REDACTED : value.toString());
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private static String key(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("header name is empty");
    }
    return name.toLowerCase(Locale.ROOT);
  }

  private static final class Entry {
    private final String name;
    private final List<HeaderValue> values = new ArrayList<>(1);

    private Entry(String name) {
      this.name = name;
    }
  }
}
