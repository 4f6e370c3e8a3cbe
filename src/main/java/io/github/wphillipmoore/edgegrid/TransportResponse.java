package io.github.wphillipmoore.edgegrid;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable response from a transport operation. Headers are defensively copied to guarantee
 * unmodifiability.
 *
 * @param statusCode the HTTP status code
 * @param body the response body text, never null (empty string if no body)
 * @param headers the response headers, never null, unmodifiable
 */
public record TransportResponse(int statusCode, String body, Map<String, String> headers) {

  /** Validates non-null fields and defensively copies headers. */
  public TransportResponse {
    Objects.requireNonNull(body, "body");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /**
   * Looks up a header by name, ignoring case.
   *
   * @param name the header name
   * @return the header value, or {@code null} if absent
   */
  public @Nullable String header(String name) {
    return findHeader(headers, name);
  }

  static @Nullable String findHeader(Map<String, String> headers, String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
