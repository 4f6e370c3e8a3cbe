package io.github.wphillipmoore.edgegrid;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link EdgeGridSession#exec}: the response metadata, the buffered body text and, for
 * a decodable success response, the decoded value.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers, unmodifiable
 * @param body the raw body text, kept for error inspection
 * @param value the decoded value, or {@code null} if nothing was decoded
 * @param <T> the decoded type
 */
public record ApiResponse<T>(
    int statusCode, Map<String, String> headers, String body, @Nullable T value) {

  /** Validates non-null fields and defensively copies headers. */
  public ApiResponse {
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
    Objects.requireNonNull(body, "body");
  }

  /** Looks up a header by name, ignoring case. */
  public @Nullable String header(String name) {
    return TransportResponse.findHeader(headers, name);
  }
}
