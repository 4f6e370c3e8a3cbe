package io.github.wphillipmoore.edgegrid;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Immutable description of one API call, built by an endpoint method and handed to {@link
 * EdgeGridSession#exec}.
 *
 * <p>{@code path} is relative to the session base URL and already escaped. Query values keep their
 * insertion order per key; {@link #canonicalQuery()} produces the sorted, escaped form that is
 * signed and sent. Headers set here are explicit and win over context headers and defaults.
 *
 * @param method the HTTP method
 * @param path the request path, starting with {@code /}
 * @param query query parameters, unmodifiable
 * @param headers explicit request headers, unmodifiable
 */
public record ApiRequest(
    String method, String path, Map<String, List<String>> query, Map<String, String> headers) {

  /** Validates non-null fields and defensively copies query and headers. */
  public ApiRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(headers, "headers");
    Map<String, List<String>> queryCopy = new LinkedHashMap<>();
    query.forEach((name, values) -> queryCopy.put(name, List.copyOf(values)));
    query = Collections.unmodifiableMap(queryCopy);
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  /** Creates a request with no query parameters or headers. */
  public static ApiRequest of(String method, String path) {
    return new ApiRequest(method, path, Map.of(), Map.of());
  }

  /** Creates a {@code GET} request. */
  public static ApiRequest get(String path) {
    return of("GET", path);
  }

  /** Creates a {@code POST} request. */
  public static ApiRequest post(String path) {
    return of("POST", path);
  }

  /** Creates a {@code PUT} request. */
  public static ApiRequest put(String path) {
    return of("PUT", path);
  }

  /** Returns a copy with {@code value} appended to query parameter {@code name}. */
  public ApiRequest withQuery(String name, String value) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    Map<String, List<String>> copy = new LinkedHashMap<>(query);
    List<String> values = new ArrayList<>(copy.getOrDefault(name, List.of()));
    values.add(value);
    copy.put(name, values);
    return new ApiRequest(method, path, copy, headers);
  }

  /** Returns a copy with header {@code name} set to {@code value}. */
  public ApiRequest withHeader(String name, String value) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.put(name, value);
    return new ApiRequest(method, path, query, copy);
  }

  /**
   * Encodes the query parameters sorted by key, using query escaping ({@code +} for space, {@code
   * %2A} for {@code *}).
   *
   * @return the encoded query string without a leading {@code ?}, empty if there are no parameters
   */
  public String canonicalQuery() {
    StringJoiner joiner = new StringJoiner("&");
    new TreeMap<>(query)
        .forEach(
            (name, values) -> {
              for (String value : values) {
                joiner.add(escape(name) + "=" + escape(value));
              }
            });
    return joiner.toString();
  }

  /**
   * Escapes one path segment, so that caller-supplied IDs cannot add segments or break the URL.
   *
   * @param segment the raw segment
   * @return the percent-encoded segment
   */
  public static String escapePathSegment(String segment) {
    return escape(Objects.requireNonNull(segment, "segment")).replace("+", "%20");
  }

  static String escape(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("*", "%2A").replace("%7E", "~");
  }
}
